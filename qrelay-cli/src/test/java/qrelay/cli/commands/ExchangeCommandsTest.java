package qrelay.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import qrelay.cli.ExitCodes;
import qrelay.core.QRelay;
import qrelay.core.exceptions.QRelayException;
import qrelay.core.model.Exchange;
import qrelay.core.model.ExchangeType;

import static org.assertj.core.api.Assertions.assertThat;

class ExchangeCommandsTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private QRelay qRelay;
    private CliRunner cli;

    @BeforeEach
    void setUp() throws QRelayException {
        qRelay = new QRelay();
        cli = new CliRunner(qRelay);
        cli.run("create-queue", "--name", "orders");
        cli.run("create-queue", "--name", "audit");
    }

    @AfterEach
    void tearDown() {
        qRelay.close();
    }

    @Test
    void testCreateExchange() {
        assertThat(cli.run("create-exchange", "--name", "events", "--type", "topic")).isEqualTo(ExitCodes.OK);

        Exchange exchange = qRelay.findExchangeByName("events").orElseThrow();
        assertThat(exchange.type()).isEqualTo(ExchangeType.TOPIC);
        assertThat(cli.out()).contains("events").contains(exchange.exchangeId());
    }

    @Test
    void testCreateExchange_invalidType() {
        assertThat(cli.run("create-exchange", "--name", "events", "--type", "headers")).isEqualTo(ExitCodes.VALIDATION);
        assertThat(qRelay.listExchanges()).isEmpty();
    }

    @Test
    void testCreateExchange_duplicate() {
        cli.run("create-exchange", "--name", "events", "--type", "fanout");

        assertThat(cli.run("create-exchange", "--name", "events", "--type", "direct")).isEqualTo(ExitCodes.CONFLICT);
    }

    @Test
    void testBindAndPublish() {
        cli.run("create-exchange", "--name", "events", "--type", "topic");

        assertThat(cli.run("bind", "--exchange", "events", "--queue", "orders", "--routing-key", "orders.*"))
                .isEqualTo(ExitCodes.OK);
        assertThat(cli.out()).contains("Bound orders to events with key 'orders.*'");
        cli.run("bind", "--exchange", "events", "--queue", "audit", "--routing-key", "#");

        assertThat(cli.run("publish", "--exchange", "events", "--body", "created", "--routing-key", "orders.created"))
                .isEqualTo(ExitCodes.OK);
        assertThat(cli.out()).contains("Matched queues: 2");

        cli.run("publish", "--exchange", "events", "--body", "login", "--routing-key", "users.login");
        assertThat(cli.out()).contains("Matched queues: 1");
    }

    @Test
    void testPublish_json() throws Exception {
        cli.run("create-exchange", "--name", "broadcast", "--type", "fanout");
        cli.run("bind", "--exchange", "broadcast", "--queue", "orders");

        cli.run("publish", "--exchange", "broadcast", "--body", "hello", "-a", "source=test", "-f", "json");

        JsonNode json = mapper.readTree(cli.out());
        assertThat(json.get("matchedQueues").asInt()).isEqualTo(1);
        assertThat(json.get("rejectedQueueIds")).isEmpty();
    }

    @Test
    void testUnbind() {
        cli.run("create-exchange", "--name", "events", "--type", "direct");
        cli.run("bind", "--exchange", "events", "--queue", "orders", "--routing-key", "created");

        assertThat(cli.run("unbind", "--exchange", "events", "--queue", "orders", "--routing-key", "created"))
                .isEqualTo(ExitCodes.OK);
        assertThat(cli.out()).contains("Binding removed");

        cli.run("unbind", "--exchange", "events", "--queue", "orders", "--routing-key", "created");
        assertThat(cli.out()).contains("No such binding");

        cli.run("publish", "--exchange", "events", "--body", "x", "--routing-key", "created");
        assertThat(cli.out()).contains("Matched queues: 0");
    }

    @Test
    void testListExchanges() throws Exception {
        assertThat(cli.run("list-exchanges")).isEqualTo(ExitCodes.OK);
        assertThat(cli.out()).contains("No exchanges found.");

        cli.run("create-exchange", "--name", "events", "--type", "fanout");
        cli.run("bind", "--exchange", "events", "--queue", "orders");
        cli.run("list-exchanges");
        assertThat(cli.out()).contains("events").contains("Total exchanges: 1");

        cli.run("list-exchanges", "-f", "json");
        JsonNode exchanges = mapper.readTree(cli.out()).get("exchanges");
        assertThat(exchanges).hasSize(1);
        assertThat(exchanges.get(0).get("bindings")).hasSize(1);
    }

    @Test
    void testPublish_unknownExchange() {
        assertThat(cli.run("publish", "--exchange", "missing", "--body", "x")).isEqualTo(ExitCodes.NOT_FOUND);
    }
}
