package qrelay.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import qrelay.cli.ExitCodes;
import qrelay.core.QRelay;
import qrelay.core.exceptions.QRelayException;
import qrelay.core.model.DeliveryMode;
import qrelay.core.model.Queue;
import qrelay.core.model.QueueDiscipline;

import static org.assertj.core.api.Assertions.assertThat;

class QueueCommandsTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private QRelay qRelay;
    private CliRunner cli;

    @BeforeEach
    void setUp() throws QRelayException {
        qRelay = new QRelay();
        cli = new CliRunner(qRelay);
    }

    @AfterEach
    void tearDown() {
        qRelay.close();
    }

    @Test
    void testCreateQueue_withDefaults() {
        int exitCode = cli.run("create-queue", "--name", "orders");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        Queue queue = qRelay.findQueueByName("orders").orElseThrow();
        assertThat(cli.out()).contains("Created queue orders (" + queue.queueId() + ")");
        assertThat(cli.out()).contains("Dead-letter queue: " + queue.dlqId());
        assertThat(queue.discipline()).isEqualTo(QueueDiscipline.STANDARD);
        assertThat(queue.config().maxSize()).isEqualTo(10000);
        assertThat(queue.config().deliveryMode()).isEqualTo(DeliveryMode.AT_LEAST_ONCE);
    }

    @Test
    void testCreateQueue_withOptions() throws Exception {
        int exitCode = cli.run("create-queue", "--name", "jobs", "--discipline", "PRIORITY",
                "--max-size", "50", "--ttl-seconds", "600", "--visibility-timeout-seconds", "5",
                "--max-retries", "1", "--delivery-mode", "exactly_once", "--delay-seconds", "2", "-f", "json");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        JsonNode json = mapper.readTree(cli.out());
        assertThat(json.get("name").asText()).isEqualTo("jobs");
        assertThat(json.get("discipline").asText()).isEqualTo("priority");
        assertThat(json.get("maxSize").asInt()).isEqualTo(50);
        assertThat(json.get("ttlSeconds").asInt()).isEqualTo(600);
        assertThat(json.get("visibilityTimeoutSeconds").asInt()).isEqualTo(5);
        assertThat(json.get("maxRetries").asInt()).isEqualTo(1);
        assertThat(json.get("deliveryMode").asText()).isEqualTo("exactly_once");
        assertThat(json.get("delaySeconds").asInt()).isEqualTo(2);
    }

    @Test
    void testListQueues() throws Exception {
        assertThat(cli.run("list-queues")).isEqualTo(ExitCodes.OK);
        assertThat(cli.out()).contains("No queues found.");

        cli.run("create-queue", "--name", "orders");
        cli.run("list-queues");
        assertThat(cli.out()).contains("orders").contains("orders-dlq").contains("Total queues: 2");

        cli.run("list-queues", "--format", "json");
        JsonNode queues = mapper.readTree(cli.out()).get("queues");
        assertThat(queues).hasSize(2);
    }

    @Test
    void testPurgeQueue_byName() {
        cli.run("create-queue", "--name", "orders");
        cli.run("send", "--queue", "orders", "--body", "one");
        cli.run("send", "--queue", "orders", "--body", "two");

        assertThat(cli.run("purge-queue", "--id", "orders")).isEqualTo(ExitCodes.OK);
        assertThat(cli.out()).contains("Purged 2 message(s)");
    }

    @Test
    void testDeleteQueue_byId() {
        cli.run("create-queue", "--name", "orders");
        Queue queue = qRelay.findQueueByName("orders").orElseThrow();

        assertThat(cli.run("delete-queue", "--id", queue.queueId())).isEqualTo(ExitCodes.OK);
        assertThat(cli.out()).contains(queue.queueId()).contains(queue.dlqId());
        assertThat(qRelay.listQueues()).isEmpty();
    }

    @Test
    void testQueueStats() throws Exception {
        cli.run("create-queue", "--name", "orders");
        cli.run("send", "--queue", "orders", "--body", "one");
        cli.run("send", "--queue", "orders", "--body", "two");
        cli.run("receive", "--queue", "orders");

        assertThat(cli.run("queue-stats", "--id", "orders")).isEqualTo(ExitCodes.OK);
        assertThat(cli.out()).contains("Pending:         1").contains("In flight:       1");

        cli.run("queue-stats", "--id", "orders", "-f", "json");
        JsonNode stats = mapper.readTree(cli.out());
        assertThat(stats.get("pending").asInt()).isEqualTo(1);
        assertThat(stats.get("inFlight").asInt()).isEqualTo(1);
        assertThat(stats.get("totalSent").asLong()).isEqualTo(2L);
    }

    @Test
    void testQueueStats_unknownQueue() {
        assertThat(cli.run("queue-stats", "--id", "missing")).isEqualTo(ExitCodes.NOT_FOUND);
        assertThat(cli.err()).contains("Error:");
    }
}
