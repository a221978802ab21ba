package qrelay.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import qrelay.cli.ExitCodes;
import qrelay.config.BrokerConfig;
import qrelay.core.QRelay;
import qrelay.core.exceptions.QRelayException;
import qrelay.core.retry.BackoffPolicy;

import static org.assertj.core.api.Assertions.assertThat;

class MessageCommandsTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private QRelay qRelay;
    private CliRunner cli;

    @BeforeEach
    void setUp() throws QRelayException {
        qRelay = new QRelay(new BrokerConfig.Builder().BackoffPolicy(BackoffPolicy.none()).build());
        cli = new CliRunner(qRelay);
        cli.run("create-queue", "--name", "orders", "--max-retries", "1");
    }

    @AfterEach
    void tearDown() {
        qRelay.close();
    }

    private String send(String body) {
        assertThat(cli.run("send", "--queue", "orders", "--body", body)).isEqualTo(ExitCodes.OK);
        return cli.lastLine();
    }

    private String receiveOne() throws Exception {
        cli.run("receive", "--queue", "orders", "-f", "json");
        JsonNode messages = mapper.readTree(cli.out());
        assertThat(messages).hasSize(1);
        return messages.get(0).get("messageId").asText();
    }

    @Test
    void testSend_printsMessageId() throws Exception {
        String messageId = send("hello");

        assertThat(messageId).startsWith("msg_");
        assertThat(qRelay.queueStats(qRelay.findQueueByName("orders").orElseThrow().queueId()).pending()).isEqualTo(1);
    }

    @Test
    void testSend_json() throws Exception {
        cli.run("send", "--queue", "orders", "--body", "hello", "--priority", "7", "-a", "type=created", "-f", "json");

        JsonNode json = mapper.readTree(cli.out());
        assertThat(json.get("messageId").asText()).startsWith("msg_");
    }

    @Test
    void testSend_invalidPriority() {
        assertThat(cli.run("send", "--queue", "orders", "--body", "x", "--priority", "12")).isEqualTo(ExitCodes.VALIDATION);
    }

    @Test
    void testReceive_noMessages() {
        assertThat(cli.run("receive", "--queue", "orders")).isEqualTo(ExitCodes.OK);
        assertThat(cli.out()).contains("No messages available.");
    }

    @Test
    void testReceive_table() {
        String messageId = send("hello");
        cli.run("send", "--queue", "orders", "--body", "second", "-a", "type=created");

        cli.run("receive", "--queue", "orders", "--max-messages", "5");

        assertThat(cli.out())
                .contains(messageId + " [delivery 1] hello")
                .contains("second")
                .contains("type=created");
    }

    @Test
    void testReceive_json() throws Exception {
        cli.run("send", "--queue", "orders", "--body", "hello", "-a", "type=created");

        cli.run("receive", "--queue", "orders", "-f", "json");

        JsonNode message = mapper.readTree(cli.out()).get(0);
        assertThat(message.get("body").asText()).isEqualTo("hello");
        assertThat(message.get("deliveryCount").asInt()).isEqualTo(1);
        assertThat(message.get("attributes").get("type").asText()).isEqualTo("created");
    }

    @Test
    void testAck() throws Exception {
        send("hello");
        String messageId = receiveOne();

        assertThat(cli.run("ack", "--message-id", messageId)).isEqualTo(ExitCodes.OK);
        assertThat(cli.lastLine()).isEqualTo("ok");

        assertThat(cli.run("ack", "--message-id", messageId)).isEqualTo(ExitCodes.NOT_FOUND);
        assertThat(cli.lastLine()).isEqualTo("not_found");
    }

    @Test
    void testNack_requeues() throws Exception {
        send("hello");
        String messageId = receiveOne();

        assertThat(cli.run("nack", "--message-id", messageId)).isEqualTo(ExitCodes.OK);
        assertThat(cli.lastLine()).isEqualTo("ok");

        cli.run("receive", "--queue", "orders");
        assertThat(cli.out()).contains(messageId + " [delivery 2] hello");
    }

    @Test
    void testNack_withoutRequeue_deadLetters() throws Exception {
        send("poison");
        String messageId = receiveOne();

        assertThat(cli.run("nack", "--message-id", messageId, "--requeue", "false")).isEqualTo(ExitCodes.OK);

        cli.run("list-dead-letters", "--queue", "orders");
        assertThat(cli.out()).contains(messageId).contains("poison").contains("rejected by consumer without requeue");
    }

    @Test
    void testNack_unknownMessage() {
        assertThat(cli.run("nack", "--message-id", "msg_missing")).isEqualTo(ExitCodes.NOT_FOUND);
        assertThat(cli.lastLine()).isEqualTo("not_found");
    }

    @Test
    void testRetriesExhausted_thenReplay() throws Exception {
        send("flaky");

        cli.run("nack", "--message-id", receiveOne());
        cli.run("nack", "--message-id", receiveOne());

        assertThat(cli.run("receive", "--queue", "orders")).isEqualTo(ExitCodes.OK);
        assertThat(cli.out()).contains("No messages available.");

        cli.run("list-dead-letters", "--queue", "orders", "-f", "json");
        JsonNode entries = mapper.readTree(cli.out());
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).get("failureCount").asInt()).isEqualTo(2);

        assertThat(cli.run("replay-dead-letters", "--queue", "orders")).isEqualTo(ExitCodes.OK);
        assertThat(cli.out()).contains("Replayed: 1");

        cli.run("receive", "--queue", "orders");
        assertThat(cli.out()).contains("[delivery 1] flaky");

        cli.run("replay-dead-letters", "--queue", "orders");
        assertThat(cli.out()).contains("Replayed: 0");

        cli.run("list-dead-letters", "--queue", "orders");
        assertThat(cli.out()).contains("flaky [replayed ");
    }

    @Test
    void testListDeadLetters_empty() {
        assertThat(cli.run("list-dead-letters", "--queue", "orders")).isEqualTo(ExitCodes.OK);
        assertThat(cli.out()).contains("No dead letters.");
    }

    @Test
    void testStats() throws Exception {
        send("one");
        send("two");
        receiveOne();

        assertThat(cli.run("stats")).isEqualTo(ExitCodes.OK);
        assertThat(cli.out()).contains("Queues:            2").contains("Pending messages:  1").contains("In flight:         1");

        cli.run("stats", "-f", "json");
        JsonNode stats = mapper.readTree(cli.out());
        assertThat(stats.get("queues").asInt()).isEqualTo(2);
    }
}
