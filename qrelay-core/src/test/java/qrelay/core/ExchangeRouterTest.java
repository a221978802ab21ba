package qrelay.core;

import qrelay.config.BrokerConfig;
import qrelay.config.QueueConfig;
import qrelay.core.exceptions.BindingException;
import qrelay.core.exceptions.ConflictException;
import qrelay.core.exceptions.ExchangeNotFoundException;
import qrelay.core.exceptions.QRelayException;
import qrelay.core.exceptions.ValidationException;
import qrelay.core.model.Exchange;
import qrelay.core.model.ExchangeType;
import qrelay.core.model.Message;
import qrelay.core.model.PublishResult;
import qrelay.core.model.Queue;
import qrelay.core.model.QueueDiscipline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for {@link ExchangeRouter}.
 */
public class ExchangeRouterTest {

    private QRelay qRelay;
    private Queue created;
    private Queue shipped;
    private Queue audit;

    @BeforeEach
    public void setUp() throws QRelayException {
        qRelay = new QRelay(new BrokerConfig.Builder().Clock(new MutableClock(1_700_000_000_000L)).build());
        created = qRelay.createQueue("created", QueueDiscipline.STANDARD);
        shipped = qRelay.createQueue("shipped", QueueDiscipline.STANDARD);
        audit = qRelay.createQueue("audit", QueueDiscipline.STANDARD);
    }

    @AfterEach
    public void tearDown() {
        qRelay.close();
    }

    @Test
    public void testCreateExchange() throws QRelayException {
        Exchange exchange = qRelay.createExchange("events", ExchangeType.TOPIC);

        assertTrue(exchange.exchangeId().startsWith("ex_"));
        assertEquals("events", exchange.name());
        assertTrue(exchange.bindings().isEmpty());
        assertEquals(exchange, qRelay.getExchange(exchange.exchangeId()));
        assertEquals(1, qRelay.listExchanges().size());

        assertThrows(ConflictException.class, () -> qRelay.createExchange("events", ExchangeType.FANOUT));
        assertThrows(ValidationException.class, () -> qRelay.createExchange("", ExchangeType.FANOUT));
        assertThrows(ValidationException.class, () -> qRelay.createExchange("other", null));
    }

    @Test
    public void testDeleteExchange() throws QRelayException {
        Exchange exchange = qRelay.createExchange("events", ExchangeType.FANOUT);

        qRelay.deleteExchange(exchange.exchangeId());

        assertThrows(ExchangeNotFoundException.class, () -> qRelay.getExchange(exchange.exchangeId()));
        assertThrows(ExchangeNotFoundException.class, () -> qRelay.deleteExchange(exchange.exchangeId()));
        assertTrue(qRelay.findExchangeByName("events").isEmpty());
    }

    @Test
    public void testBindErrors() throws QRelayException {
        Exchange exchange = qRelay.createExchange("events", ExchangeType.DIRECT);

        assertThrows(BindingException.class, () -> qRelay.bind(exchange.exchangeId(), "q_missing", "key"));
        assertThrows(ExchangeNotFoundException.class, () -> qRelay.bind("ex_missing", created.queueId(), "key"));
        assertThrows(ExchangeNotFoundException.class, () -> qRelay.publish("ex_missing", "body", "key"));
    }

    @Test
    public void testBindIsIdempotent() throws QRelayException {
        Exchange exchange = qRelay.createExchange("events", ExchangeType.DIRECT);

        qRelay.bind(exchange.exchangeId(), created.queueId(), "order.created");
        Exchange updated = qRelay.bind(exchange.exchangeId(), created.queueId(), "order.created");

        assertEquals(1, updated.bindings().size());
        assertFalse(qRelay.unbind(exchange.exchangeId(), created.queueId(), "order.shipped"));
        assertTrue(qRelay.unbind(exchange.exchangeId(), created.queueId(), "order.created"));
        assertTrue(qRelay.getExchange(exchange.exchangeId()).bindings().isEmpty());
    }

    @Test
    public void testDirectRouting() throws QRelayException {
        Exchange exchange = qRelay.createExchange("orders", ExchangeType.DIRECT);
        qRelay.bind(exchange.exchangeId(), created.queueId(), "order.created");
        qRelay.bind(exchange.exchangeId(), shipped.queueId(), "order.shipped");

        PublishResult result = qRelay.publish(exchange.exchangeId(), "{\"id\":1}", "order.created",
                Map.of("source", "web"));

        assertEquals(List.of(created.queueId()), result.deliveredQueueIds());
        Message message = qRelay.receive(created.queueId(), 1).get(0);
        assertEquals("{\"id\":1}", message.body());
        assertEquals("web", message.attributes().get("source"));
        assertEquals(0, qRelay.depth(shipped.queueId()));

        assertEquals(0, qRelay.publish(exchange.exchangeId(), "x", "order").matchedQueues());
    }

    @Test
    public void testTopicRouting() throws QRelayException {
        Exchange exchange = qRelay.createExchange("events", ExchangeType.TOPIC);
        qRelay.bind(exchange.exchangeId(), created.queueId(), "orders.*");
        qRelay.bind(exchange.exchangeId(), shipped.queueId(), "orders.#");
        qRelay.bind(exchange.exchangeId(), audit.queueId(), "#.created");

        PublishResult deep = qRelay.publish(exchange.exchangeId(), "a", "orders.eu.created");
        assertEquals(List.of(shipped.queueId(), audit.queueId()), deep.deliveredQueueIds());

        PublishResult shallow = qRelay.publish(exchange.exchangeId(), "b", "orders.created");
        assertEquals(3, shallow.matchedQueues());

        PublishResult none = qRelay.publish(exchange.exchangeId(), "c", "users.deleted");
        assertEquals(0, none.matchedQueues());
    }

    @Test
    public void testQueueMatchedTwiceGetsOneCopy() throws QRelayException {
        Exchange exchange = qRelay.createExchange("events", ExchangeType.TOPIC);
        qRelay.bind(exchange.exchangeId(), audit.queueId(), "orders.*");
        qRelay.bind(exchange.exchangeId(), audit.queueId(), "#");

        assertEquals(1, qRelay.publish(exchange.exchangeId(), "x", "orders.created").matchedQueues());
        assertEquals(1, qRelay.depth(audit.queueId()));
    }

    @Test
    public void testPublishContinuesPastFullQueue() throws QRelayException {
        Queue tiny = qRelay.createQueue("tiny", QueueDiscipline.STANDARD, new QueueConfig.Builder().MaxSize(1).build());
        Exchange exchange = qRelay.createExchange("broadcast", ExchangeType.FANOUT);
        qRelay.bind(exchange.exchangeId(), tiny.queueId(), "");
        qRelay.bind(exchange.exchangeId(), audit.queueId(), "");
        qRelay.send(tiny.queueId(), "filler");

        PublishResult result = qRelay.publish(exchange.exchangeId(), "event", "");

        assertEquals(1, result.matchedQueues());
        assertEquals(List.of(audit.queueId()), result.deliveredQueueIds());
        assertEquals(List.of(tiny.queueId()), result.rejectedQueueIds());
        assertEquals(1, qRelay.depth(audit.queueId()));
    }

    @Test
    public void testPublishRejectsInvalidBody() throws QRelayException {
        Exchange exchange = qRelay.createExchange("broadcast", ExchangeType.FANOUT);
        qRelay.bind(exchange.exchangeId(), audit.queueId(), "");

        assertThrows(ValidationException.class, () -> qRelay.publish(exchange.exchangeId(), null, ""));
        assertEquals(0, qRelay.depth(audit.queueId()));
    }
}
