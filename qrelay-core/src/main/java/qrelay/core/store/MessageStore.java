package qrelay.core.store;

import qrelay.core.model.Message;
import qrelay.core.model.Queue;

import java.util.List;
import java.util.Optional;

/**
 * Key-value store of message snapshots keyed by message id, plus the definitions of the
 * queues those messages belong to.
 * <p>
 * The store does no locking of its own beyond keeping individual calls consistent;
 * the queue store serializes mutations per queue.
 */
public interface MessageStore extends AutoCloseable {

    Optional<Message> get(String messageId);

    /**
     * Inserts the message or replaces the snapshot with the same id.
     */
    void put(Message message);

    boolean delete(String messageId);

    /**
     * Messages of a queue whose visible-at time is at or before {@code visibleAtOrBefore},
     * ordered by visible-at time.
     */
    List<Message> scanByVisibleAt(String queueId, long visibleAtOrBefore);

    /**
     * All messages of a queue, in send order.
     */
    List<Message> findByQueue(String queueId);

    int deleteByQueue(String queueId);

    /**
     * Highest sequence number stored, or 0 when empty.
     */
    long maxSequence();

    /**
     * Inserts the queue definition or replaces the one with the same id.
     */
    void putQueue(Queue queue);

    boolean deleteQueue(String queueId);

    /**
     * All stored queue definitions, oldest first.
     */
    List<Queue> loadQueues();

    @Override
    void close();
}
