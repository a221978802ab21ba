package qrelay.core.store;

import qrelay.config.QueueConfig;
import qrelay.core.model.DeliveryMode;
import qrelay.core.model.Message;
import qrelay.core.model.MessageState;
import qrelay.core.model.Queue;
import qrelay.core.model.QueueDiscipline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link MessageStore} implementation shares.
 */
public abstract class AbstractMessageStoreTest {

    protected MessageStore store;

    protected abstract MessageStore createStore();

    @BeforeEach
    public void setUp() {
        store = createStore();
    }

    @AfterEach
    public void tearDown() {
        store.close();
    }

    protected static Message message(String id, String queueId, long visibleAt, long sequence) {
        return new Message(id, queueId, "body-" + id, Map.of("k", "v-" + id), 5, MessageState.PENDING, 0,
                null, null, visibleAt, 1_000L, 100_000L, null, null, sequence);
    }

    protected static Queue queue(String id, String name, long createdAt) {
        QueueConfig config = new QueueConfig.Builder()
                .MaxSize(50)
                .TtlSeconds(600)
                .VisibilityTimeoutSeconds(15)
                .MaxRetries(2)
                .DeliveryMode(DeliveryMode.AT_MOST_ONCE)
                .DelaySeconds(3)
                .build();
        return new Queue(id, name, QueueDiscipline.FIFO, config, id + "-dlq-id", null, createdAt);
    }

    @Test
    public void testPutAndGet() {
        Message message = message("m1", "q1", 10L, 1L);
        store.put(message);

        Optional<Message> found = store.get("m1");
        assertTrue(found.isPresent());
        assertEquals(message, found.get());
        assertTrue(store.get("missing").isEmpty());
    }

    @Test
    public void testPutReplacesSnapshot() {
        Message message = message("m1", "q1", 10L, 1L);
        store.put(message);

        Message delivered = message.delivered(20L, 30_020L);
        store.put(delivered);

        Message found = store.get("m1").orElseThrow();
        assertEquals(MessageState.PROCESSING, found.state());
        assertEquals(1, found.deliveryCount());
        assertEquals(20L, found.firstDeliveredAt());
        assertEquals(30_020L, found.visibleAt());
        assertEquals(Map.of("k", "v-m1"), found.attributes());
        assertEquals(1, store.findByQueue("q1").size());
    }

    @Test
    public void testDelete() {
        store.put(message("m1", "q1", 10L, 1L));

        assertTrue(store.delete("m1"));
        assertFalse(store.delete("m1"));
        assertTrue(store.get("m1").isEmpty());
        assertTrue(store.findByQueue("q1").isEmpty());
    }

    @Test
    public void testScanByVisibleAt() {
        store.put(message("late", "q1", 300L, 1L));
        store.put(message("early", "q1", 100L, 2L));
        store.put(message("middle", "q1", 200L, 3L));
        store.put(message("other", "q2", 50L, 4L));

        List<Message> visible = store.scanByVisibleAt("q1", 200L);

        assertEquals(List.of("early", "middle"), visible.stream().map(Message::messageId).toList());
    }

    @Test
    public void testFindByQueueInSequenceOrder() {
        store.put(message("c", "q1", 0L, 3L));
        store.put(message("a", "q1", 0L, 1L));
        store.put(message("b", "q1", 0L, 2L));

        assertEquals(List.of("a", "b", "c"), store.findByQueue("q1").stream().map(Message::messageId).toList());
        assertTrue(store.findByQueue("unknown").isEmpty());
    }

    @Test
    public void testDeleteByQueue() {
        store.put(message("a", "q1", 0L, 1L));
        store.put(message("b", "q1", 0L, 2L));
        store.put(message("c", "q2", 0L, 3L));

        assertEquals(2, store.deleteByQueue("q1"));
        assertEquals(0, store.deleteByQueue("q1"));
        assertTrue(store.get("a").isEmpty());
        assertTrue(store.get("c").isPresent());
    }

    @Test
    public void testMaxSequence() {
        assertEquals(0L, store.maxSequence());

        store.put(message("a", "q1", 0L, 7L));
        store.put(message("b", "q2", 0L, 3L));

        assertEquals(7L, store.maxSequence());
    }

    @Test
    public void testQueueDefinitions() {
        assertTrue(store.loadQueues().isEmpty());

        Queue later = queue("q2", "payments", 2_000L);
        Queue earlier = queue("q1", "orders", 1_000L);
        store.putQueue(later);
        store.putQueue(earlier);

        assertEquals(List.of(earlier, later), store.loadQueues());

        assertTrue(store.deleteQueue("q1"));
        assertFalse(store.deleteQueue("q1"));
        assertEquals(List.of(later), store.loadQueues());
    }
}
