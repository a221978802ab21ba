package qrelay.client.impl;

import qrelay.client.api.MessageProducer;
import qrelay.core.QRelay;
import qrelay.core.exceptions.CapacityExceededException;
import qrelay.core.exceptions.QRelayException;
import qrelay.core.model.Exchange;
import qrelay.core.model.ExchangeType;
import qrelay.core.model.Message;
import qrelay.core.model.PublishResult;
import qrelay.core.model.Queue;
import qrelay.core.model.QueueDiscipline;
import qrelay.core.model.SendRequest;
import qrelay.config.QueueConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for {@link SimpleMessageProducer}.
 */
public class SimpleMessageProducerTest {

    private QRelay qRelay;
    private Queue queue;
    private MessageProducer producer;

    @BeforeEach
    public void setUp() throws QRelayException {
        qRelay = new QRelay();
        queue = qRelay.createQueue("test_queue", QueueDiscipline.PRIORITY);
        producer = new SimpleMessageProducer(qRelay, queue.queueId());
    }

    @AfterEach
    public void tearDown() {
        producer.close();
        qRelay.close();
    }

    @Test
    public void testSendMessage() throws Exception {
        String messageId = producer.sendMessage("Test message").get();

        assertNotNull(messageId);
        assertEquals(1, qRelay.depth(queue.queueId()));

        List<Message> received = qRelay.receive(queue.queueId(), 1);
        assertEquals(messageId, received.get(0).messageId());
        assertEquals("Test message", received.get(0).body());
    }

    @Test
    public void testSendMessageWithAttributes() throws Exception {
        String messageId = producer.sendMessage("order", Map.of("type", "created")).get();

        Message message = qRelay.receive(queue.queueId(), 1).get(0);
        assertEquals(messageId, message.messageId());
        assertEquals("created", message.attributes().get("type"));
    }

    @Test
    public void testSendRequest() throws Exception {
        producer.sendMessage(SendRequest.of("low")).get();
        producer.sendMessage(new SendRequest.Builder().Body("high").Priority(9).build()).get();

        List<Message> received = qRelay.receive(queue.queueId(), 2);
        assertEquals("high", received.get(0).body());
        assertEquals("low", received.get(1).body());
    }

    @Test
    public void testSendFailureCompletesExceptionally() throws Exception {
        Queue tiny = qRelay.createQueue("tiny", QueueDiscipline.STANDARD, new QueueConfig.Builder().MaxSize(1).build());
        MessageProducer tinyProducer = new SimpleMessageProducer(qRelay, tiny.queueId());
        try {
            tinyProducer.sendMessage("first").get();

            ExecutionException e = assertThrows(ExecutionException.class, () -> tinyProducer.sendMessage("second").get());
            assertInstanceOf(RuntimeException.class, e.getCause());
            assertInstanceOf(CapacityExceededException.class, e.getCause().getCause());
        } finally {
            tinyProducer.close();
        }
    }

    @Test
    public void testPublish() throws Exception {
        Queue other = qRelay.createQueue("other_queue", QueueDiscipline.STANDARD);
        Exchange exchange = qRelay.createExchange("events", ExchangeType.TOPIC);
        qRelay.bind(exchange.exchangeId(), queue.queueId(), "orders.*");
        qRelay.bind(exchange.exchangeId(), other.queueId(), "orders.#");

        int matched = producer.publish(exchange.exchangeId(), "payload", "orders.created", null).get();
        assertEquals(2, matched);

        PublishResult result = producer.publishDetailed(exchange.exchangeId(), "payload", "orders.eu.created", Map.of()).get();
        assertEquals(List.of(other.queueId()), result.deliveredQueueIds());
        assertTrue(result.rejectedQueueIds().isEmpty());

        assertEquals(1, qRelay.depth(queue.queueId()));
        assertEquals(2, qRelay.depth(other.queueId()));
    }

    @Test
    public void testPublishToUnknownExchange() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> producer.publish("exch_missing", "payload", "key", null).get());
        assertInstanceOf(QRelayException.class, e.getCause().getCause());
    }
}
