package qrelay.core;

import qrelay.core.events.LifecycleEvent;
import qrelay.core.events.LifecycleEvents;
import qrelay.core.exceptions.CapacityExceededException;
import qrelay.core.exceptions.QueueNotFoundException;
import qrelay.core.exceptions.ValidationException;
import qrelay.core.model.AckResult;
import qrelay.core.model.DeadLetterEntry;
import qrelay.core.model.Message;
import qrelay.core.model.Queue;
import qrelay.core.model.ReplayResult;
import qrelay.core.model.SendRequest;
import qrelay.core.utils.QUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Moves exhausted messages onto their queue's dead-letter queue and replays them.
 * <p>
 * Dead-lettering copies: the DLQ receives a new message with a new id, and a
 * {@link DeadLetterEntry} keeps the link back to the original message id. Entries stay
 * until purged; replay stamps each entry it re-sends and skips it afterwards.
 */
public class DeadLetterRouter {
    private static final Logger logger = LoggerFactory.getLogger(DeadLetterRouter.class);

    public static final String ORIGINAL_MESSAGE_ID = "x-original-message-id";
    public static final String ORIGINAL_QUEUE_ID = "x-original-queue-id";
    public static final String DEAD_LETTER_REASON = "x-dead-letter-reason";

    private final QueueStore queueStore;
    private final Map<String, List<DeadLetterEntry>> entriesByQueue = new ConcurrentHashMap<>();
    // one replay at a time, so no entry is picked by two callers
    private final ReentrantLock replayLock = new ReentrantLock();

    public DeadLetterRouter(QueueStore queueStore) {
        this.queueStore = queueStore;
    }

    /**
     * Dead-letters a live (pending or in-flight) message.
     *
     * @return {@link AckResult#NOT_FOUND} for unknown or terminal ids
     */
    public AckResult deadLetter(String messageId, String reason) {
        Optional<Message> found = messageId != null ? queueStore.messageStore().get(messageId) : Optional.empty();
        Optional<QueueState> owner = found.flatMap(m -> queueStore.findState(m.queueId()));
        if (owner.isEmpty()) {
            logger.debug("Dead-letter request for unknown message {}", messageId);
            return AckResult.NOT_FOUND;
        }

        QueueState state = owner.get();
        List<LifecycleEvent> events = new ArrayList<>();
        AckResult result = AckResult.NOT_FOUND;
        state.lock.lock();
        try {
            Optional<Message> current = state.deleted ? Optional.empty() : queueStore.messageStore().get(messageId);
            if (current.isPresent() && current.get().state().isLive()) {
                deadLetterLocked(state, current.get(), reason != null ? reason : "dead-lettered on request", events);
                result = AckResult.OK;
            }
        } finally {
            state.lock.unlock();
        }
        LifecycleEvents.fire(queueStore.listener(), events);
        return result;
    }

    // caller holds the origin queue's lock; the DLQ lock is taken inside
    DeadLetterEntry deadLetterLocked(QueueState origin, Message message, String reason, List<LifecycleEvent> events) {
        final Queue queue = origin.queue;
        queueStore.markDeadLettered(origin, message, reason, events);

        String dlqMessageId = null;
        Optional<QueueState> dlq = queueStore.findState(queue.dlqId());
        if (dlq.isPresent()) {
            QueueState dlqState = dlq.get();
            Map<String, String> attributes = new HashMap<>(message.attributes());
            attributes.put(ORIGINAL_MESSAGE_ID, message.messageId());
            attributes.put(ORIGINAL_QUEUE_ID, queue.queueId());
            attributes.put(DEAD_LETTER_REASON, reason);
            SendRequest copy = new SendRequest(message.body(), attributes, message.priority(), 0, null, message.groupId());

            dlqState.lock.lock();
            try {
                if (!dlqState.deleted) {
                    dlqMessageId = queueStore.admit(dlqState, copy, events).messageId();
                }
            } catch (CapacityExceededException e) {
                logger.warn("Dead-letter queue {} is full, message {} recorded without a copy", dlqState.queue.name(), message.messageId());
            } finally {
                dlqState.lock.unlock();
            }
        } else if (queue.isDeadLetterQueue()) {
            logger.warn("Message {} exhausted on dead-letter queue {} and was dropped: {}", message.messageId(), queue.name(), reason);
        } else {
            logger.warn("Dead-letter queue of {} is gone, message {} recorded without a copy", queue.name(), message.messageId());
        }

        DeadLetterEntry entry = new DeadLetterEntry(
                QUtils.newId("dlq"),
                message.messageId(),
                queue.queueId(),
                dlqMessageId,
                message.body(),
                message.attributes(),
                reason,
                message.deliveryCount(),
                queueStore.clock().millis(),
                null);
        entriesByQueue.computeIfAbsent(queue.queueId(), id -> new CopyOnWriteArrayList<>()).add(entry);

        logger.info("Dead-lettered message {} from queue {} after {} deliveries: {}",
                message.messageId(), queue.name(), message.deliveryCount(), reason);
        return entry;
    }

    /**
     * Re-sends up to {@code limit} not yet replayed entries, oldest first, onto their origin
     * queue as fresh messages. Each entry is stamped as replayed once its send succeeds, so
     * repeated calls walk through the backlog. Entries are kept; stops at the first send the
     * origin rejects for capacity, leaving that entry and the rest for the next call.
     */
    public ReplayResult replayDeadLetters(String originQueueId, int limit) throws QueueNotFoundException, ValidationException {
        if (limit < 1) {
            throw new ValidationException("limit must be at least 1: " + limit, "limit");
        }
        queueStore.getQueue(originQueueId);

        int replayed = 0;
        int rejected = 0;
        int selected = 0;
        replayLock.lock();
        try {
            List<DeadLetterEntry> entries = entriesByQueue.get(originQueueId);
            List<DeadLetterEntry> batch = new ArrayList<>();
            if (entries != null) {
                for (DeadLetterEntry entry : entries) {
                    if (batch.size() == limit) {
                        break;
                    }
                    if (!entry.isReplayed()) {
                        batch.add(entry);
                    }
                }
            }
            selected = batch.size();

            for (DeadLetterEntry entry : batch) {
                try {
                    queueStore.send(originQueueId, SendRequest.of(entry.body(), entry.attributes()));
                } catch (CapacityExceededException e) {
                    rejected = batch.size() - replayed;
                    logger.warn("Replay onto queue {} stopped after {} message(s): {}", originQueueId, replayed, e.getMessage());
                    break;
                }
                markReplayed(entries, entry);
                replayed++;
            }
        } finally {
            replayLock.unlock();
        }

        logger.info("Replayed {} of {} dead letter(s) onto queue {}", replayed, selected, originQueueId);
        return new ReplayResult(originQueueId, replayed, rejected);
    }

    private void markReplayed(List<DeadLetterEntry> entries, DeadLetterEntry entry) {
        int index = entries.indexOf(entry);
        if (index >= 0) {
            entries.set(index, entry.replayed(queueStore.clock().millis()));
        }
    }

    public List<DeadLetterEntry> listDeadLetters(String originQueueId) {
        List<DeadLetterEntry> entries = entriesByQueue.get(originQueueId);
        return entries != null ? new ArrayList<>(entries) : new ArrayList<>();
    }

    public int countDeadLetters() {
        return entriesByQueue.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Drops the dead-letter entries of a queue and purges the copies on its DLQ.
     *
     * @return number of entries dropped
     */
    public int purgeDeadLetters(String originQueueId) throws QueueNotFoundException {
        Queue queue = queueStore.getQueue(originQueueId);
        List<DeadLetterEntry> removed = entriesByQueue.remove(originQueueId);
        if (queue.dlqId() != null) {
            queueStore.purgeQueue(queue.dlqId());
        }
        int count = removed != null ? removed.size() : 0;
        logger.info("Purged {} dead letter(s) of queue {}", count, queue.name());
        return count;
    }

    void dropEntries(Collection<String> queueIds) {
        queueIds.forEach(entriesByQueue::remove);
    }
}
