package qrelay.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MessageTest {

    private static Message pending(long visibleAt, long expiresAt) {
        return new Message("msg_1", "q_1", "body", Map.of("k", "v"), Message.DEFAULT_PRIORITY,
                MessageState.PENDING, 0, null, null, visibleAt, 0L, expiresAt, null, null, 1L);
    }

    @Test
    public void testAttributesAreCopied() {
        Map<String, String> attributes = new HashMap<>();
        attributes.put("k", "v");
        Message message = new Message("msg_1", "q_1", "body", attributes, 5, MessageState.PENDING,
                0, null, null, 0L, 0L, 100L, null, null, 1L);

        attributes.put("other", "x");

        assertEquals(Map.of("k", "v"), message.attributes());
        assertThrows(UnsupportedOperationException.class, () -> message.attributes().put("a", "b"));
    }

    @Test
    public void testNullAttributesBecomeEmpty() {
        Message message = new Message("msg_1", "q_1", "body", null, 5, MessageState.PENDING,
                0, null, null, 0L, 0L, 100L, null, null, 1L);
        assertTrue(message.attributes().isEmpty());
    }

    @Test
    public void testVisibility() {
        Message message = pending(10L, 100L);

        assertFalse(message.isVisibleAt(5L));
        assertTrue(message.isVisibleAt(10L));
        assertTrue(message.isVisibleAt(99L));
        assertFalse(message.isVisibleAt(100L));
        assertTrue(message.isExpiredAt(100L));
        assertFalse(message.withState(MessageState.PROCESSING).isVisibleAt(50L));
    }

    @Test
    public void testDeliveredKeepsFirstDeliveryTime() {
        Message first = pending(0L, 1000L).delivered(10L, 40L);

        assertEquals(MessageState.PROCESSING, first.state());
        assertEquals(1, first.deliveryCount());
        assertEquals(10L, first.firstDeliveredAt());
        assertEquals(10L, first.lastDeliveredAt());
        assertEquals(40L, first.visibleAt());

        Message second = first.requeued(60L).delivered(70L, 100L);

        assertEquals(2, second.deliveryCount());
        assertEquals(10L, second.firstDeliveredAt());
        assertEquals(70L, second.lastDeliveredAt());
    }

    @Test
    public void testRequeued() {
        Message requeued = pending(0L, 1000L).delivered(10L, 40L).requeued(25L);

        assertEquals(MessageState.PENDING, requeued.state());
        assertEquals(1, requeued.deliveryCount());
        assertEquals(25L, requeued.visibleAt());
        assertEquals(1L, requeued.sequence());
    }

    @Test
    public void testHasGroup() {
        assertFalse(pending(0L, 10L).hasGroup());
        Message grouped = new Message("msg_1", "q_1", "body", null, 5, MessageState.PENDING,
                0, null, null, 0L, 0L, 100L, null, "g1", 1L);
        assertTrue(grouped.hasGroup());
    }
}
