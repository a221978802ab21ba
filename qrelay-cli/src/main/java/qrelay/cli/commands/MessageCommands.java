package qrelay.cli.commands;

import qrelay.cli.ExitCodes;
import qrelay.core.exceptions.QRelayException;
import qrelay.core.model.AckResult;
import qrelay.core.model.DeadLetterEntry;
import qrelay.core.model.Message;
import qrelay.core.model.PublishResult;
import qrelay.core.model.ReplayResult;
import qrelay.core.model.SendRequest;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Data-plane commands. Ack and nack print {@code ok} or {@code not_found}; the latter
 * also exits with the not-found code.
 */
public class MessageCommands {

    private MessageCommands() {
    }

    static Map<String, Object> messageMap(Message message) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("messageId", message.messageId());
        map.put("body", message.body());
        map.put("attributes", message.attributes());
        map.put("deliveryCount", message.deliveryCount());
        map.put("priority", message.priority());
        if (message.groupId() != null) {
            map.put("groupId", message.groupId());
        }
        return map;
    }

    private static String outcome(AckResult result) {
        return result.name().toLowerCase(Locale.ROOT);
    }

    @Command(name = "send", description = "Send a message to a queue")
    public static class Send extends QRelayCommand {
        @Option(names = "--queue", required = true, description = "Queue id or name")
        private String queue;

        @Option(names = "--body", required = true, description = "Message body")
        private String body;

        @Option(names = {"-a", "--attribute"}, description = "Attribute as name=value, repeatable")
        private Map<String, String> attributes;

        @Option(names = "--priority", description = "0-9, higher is delivered first (default: 5)")
        private Integer priority;

        @Option(names = "--delay-seconds", description = "Delivery delay, defaults to the queue's")
        private Integer delaySeconds;

        @Option(names = "--dedup-id", description = "Deduplication id")
        private String dedupId;

        @Option(names = "--group-id", description = "Ordering group of FIFO queues")
        private String groupId;

        @Override
        public Integer call() throws QRelayException {
            SendRequest request = new SendRequest.Builder()
                    .Body(body)
                    .Attributes(attributes)
                    .Priority(priority)
                    .DelaySeconds(delaySeconds)
                    .DedupId(dedupId)
                    .GroupId(groupId)
                    .build();
            Message message = qRelay().send(queueId(queue), request);
            if (json()) {
                printJson(Map.of("messageId", message.messageId()));
            } else {
                out().println(message.messageId());
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "publish", description = "Publish a message to an exchange")
    public static class Publish extends QRelayCommand {
        @Option(names = "--exchange", required = true, description = "Exchange id or name")
        private String exchange;

        @Option(names = "--body", required = true, description = "Message body")
        private String body;

        @Option(names = "--routing-key", defaultValue = "", description = "Routing key")
        private String routingKey;

        @Option(names = {"-a", "--attribute"}, description = "Attribute as name=value, repeatable")
        private Map<String, String> attributes;

        @Override
        public Integer call() throws QRelayException {
            PublishResult result = qRelay().publish(exchangeId(exchange), body, routingKey,
                    attributes != null ? attributes : Map.of());
            if (json()) {
                Map<String, Object> map = new LinkedHashMap<>();
                map.put("matchedQueues", result.matchedQueues());
                map.put("deliveredQueueIds", result.deliveredQueueIds());
                map.put("rejectedQueueIds", result.rejectedQueueIds());
                printJson(map);
            } else {
                out().println("Matched queues: " + result.matchedQueues());
                if (!result.rejectedQueueIds().isEmpty()) {
                    out().println("Rejected by: " + String.join(", ", result.rejectedQueueIds()));
                }
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "receive", description = "Receive messages from a queue")
    public static class Receive extends QRelayCommand {
        @Option(names = "--queue", required = true, description = "Queue id or name")
        private String queue;

        @Option(names = "--max-messages", defaultValue = "1", description = "Maximum messages to receive (default: 1)")
        private int maxMessages;

        @Option(names = "--visibility-timeout-seconds", description = "Overrides the queue's visibility timeout")
        private Integer visibilityTimeoutSeconds;

        @Override
        public Integer call() throws QRelayException {
            List<Message> messages = qRelay().receive(queueId(queue), maxMessages, visibilityTimeoutSeconds);
            if (json()) {
                printJson(messages.stream().map(MessageCommands::messageMap).collect(Collectors.toList()));
                return ExitCodes.OK;
            }

            PrintWriter out = out();
            if (messages.isEmpty()) {
                out.println("No messages available.");
                return ExitCodes.OK;
            }
            for (Message message : messages) {
                out.printf("%s [delivery %d] %s%n", message.messageId(), message.deliveryCount(), message.body());
                if (!message.attributes().isEmpty()) {
                    out.println("    " + message.attributes());
                }
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "ack", description = "Acknowledge an in-flight message")
    public static class Ack extends QRelayCommand {
        @Option(names = "--message-id", required = true, description = "Message id")
        private String messageId;

        @Override
        public Integer call() {
            AckResult result = qRelay().ack(messageId);
            if (json()) {
                printJson(Map.of("result", outcome(result)));
            } else {
                out().println(outcome(result));
            }
            return result == AckResult.OK ? ExitCodes.OK : ExitCodes.NOT_FOUND;
        }
    }

    @Command(name = "nack", description = "Reject an in-flight message")
    public static class Nack extends QRelayCommand {
        @Option(names = "--message-id", required = true, description = "Message id")
        private String messageId;

        @Option(names = "--requeue", defaultValue = "true", arity = "1",
                description = "Retry the message (true) or dead-letter it now (false)")
        private boolean requeue;

        @Override
        public Integer call() {
            AckResult result = qRelay().nack(messageId, requeue);
            if (json()) {
                printJson(Map.of("result", outcome(result)));
            } else {
                out().println(outcome(result));
            }
            return result == AckResult.OK ? ExitCodes.OK : ExitCodes.NOT_FOUND;
        }
    }

    @Command(name = "replay-dead-letters", description = "Re-send dead-lettered messages onto their queue")
    public static class ReplayDeadLetters extends QRelayCommand {
        @Option(names = "--queue", required = true, description = "Origin queue id or name")
        private String queue;

        @Option(names = "--limit", defaultValue = "10", description = "Maximum messages to replay (default: 10)")
        private int limit;

        @Override
        public Integer call() throws QRelayException {
            ReplayResult result = qRelay().replayDeadLetters(queueId(queue), limit);
            if (json()) {
                printJson(Map.of("replayed", result.replayed(), "rejected", result.rejected()));
            } else {
                out().println("Replayed: " + result.replayed());
                if (result.rejected() > 0) {
                    out().println("Rejected (queue full): " + result.rejected());
                }
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "list-dead-letters", description = "List dead-letter entries of a queue")
    public static class ListDeadLetters extends QRelayCommand {
        @Option(names = "--queue", required = true, description = "Origin queue id or name")
        private String queue;

        @Override
        public Integer call() throws QRelayException {
            List<DeadLetterEntry> entries = qRelay().listDeadLetters(queueId(queue));
            if (json()) {
                printJson(entries.stream().map(e -> {
                    Map<String, Object> map = new LinkedHashMap<>();
                    map.put("entryId", e.entryId());
                    map.put("originalMessageId", e.originalMessageId());
                    map.put("dlqMessageId", e.dlqMessageId());
                    map.put("body", e.body());
                    map.put("reason", e.reason());
                    map.put("failureCount", e.failureCount());
                    map.put("deadLetteredAt", time(e.deadLetteredAt()));
                    map.put("replayedAt", e.isReplayed() ? time(e.replayedAt()) : null);
                    return map;
                }).collect(Collectors.toList()));
                return ExitCodes.OK;
            }

            PrintWriter out = out();
            if (entries.isEmpty()) {
                out.println("No dead letters.");
                return ExitCodes.OK;
            }
            for (DeadLetterEntry entry : entries) {
                out.printf("%s %s (%d failures) %s: %s%s%n", time(entry.deadLetteredAt()), entry.originalMessageId(),
                        entry.failureCount(), entry.reason(), entry.body(),
                        entry.isReplayed() ? " [replayed " + time(entry.replayedAt()) + "]" : "");
            }
            return ExitCodes.OK;
        }
    }
}
