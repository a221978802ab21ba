package qrelay.cli.commands;

import qrelay.cli.ExitCodes;
import qrelay.config.QueueConfig;
import qrelay.core.exceptions.QRelayException;
import qrelay.core.model.DeliveryMode;
import qrelay.core.model.Queue;
import qrelay.core.model.QueueDiscipline;
import qrelay.core.model.QueueStats;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Queue administration commands.
 */
public class QueueCommands {

    private QueueCommands() {
    }

    static Map<String, Object> queueMap(Queue queue) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("queueId", queue.queueId());
        map.put("name", queue.name());
        map.put("discipline", queue.discipline().getValue());
        map.put("maxSize", queue.config().maxSize());
        map.put("ttlSeconds", queue.config().ttlSeconds());
        map.put("visibilityTimeoutSeconds", queue.config().visibilityTimeoutSeconds());
        map.put("maxRetries", queue.config().maxRetries());
        map.put("deliveryMode", queue.config().deliveryMode().getValue());
        map.put("delaySeconds", queue.config().delaySeconds());
        map.put("dlqId", queue.dlqId());
        return map;
    }

    @Command(name = "create-queue", description = "Create a queue together with its dead-letter queue")
    public static class CreateQueue extends QRelayCommand {
        @Option(names = "--name", required = true, description = "Queue name")
        private String name;

        @Option(names = "--discipline", defaultValue = "standard",
                description = "standard, fifo, priority, delay or dlq (default: standard)")
        private QueueDiscipline discipline;

        @Option(names = "--max-size", defaultValue = "" + QueueConfig.DEFAULT_MAX_SIZE, description = "Maximum live messages")
        private int maxSize;

        @Option(names = "--ttl-seconds", defaultValue = "" + QueueConfig.DEFAULT_TTL_SECONDS, description = "Message time to live")
        private int ttlSeconds;

        @Option(names = "--visibility-timeout-seconds", defaultValue = "" + QueueConfig.DEFAULT_VISIBILITY_TIMEOUT_SECONDS,
                description = "Seconds a received message stays hidden")
        private int visibilityTimeoutSeconds;

        @Option(names = "--max-retries", defaultValue = "" + QueueConfig.DEFAULT_MAX_RETRIES,
                description = "Redeliveries before dead-lettering")
        private int maxRetries;

        @Option(names = "--delivery-mode", defaultValue = "at_least_once",
                description = "at_least_once, at_most_once or exactly_once")
        private DeliveryMode deliveryMode;

        @Option(names = "--delay-seconds", defaultValue = "0", description = "Default delivery delay")
        private int delaySeconds;

        @Override
        public Integer call() throws QRelayException {
            QueueConfig config = new QueueConfig.Builder()
                    .MaxSize(maxSize)
                    .TtlSeconds(ttlSeconds)
                    .VisibilityTimeoutSeconds(visibilityTimeoutSeconds)
                    .MaxRetries(maxRetries)
                    .DeliveryMode(deliveryMode)
                    .DelaySeconds(delaySeconds)
                    .build();
            Queue queue = qRelay().createQueue(name, discipline, config);

            if (json()) {
                printJson(queueMap(queue));
            } else {
                out().println("Created queue " + queue.name() + " (" + queue.queueId() + ")");
                if (queue.dlqId() != null) {
                    out().println("Dead-letter queue: " + queue.dlqId());
                }
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "delete-queue", description = "Delete a queue and its dead-letter queue")
    public static class DeleteQueue extends QRelayCommand {
        @Option(names = "--id", required = true, description = "Queue id or name")
        private String id;

        @Option(names = "--force", description = "Purge live messages instead of failing")
        private boolean force;

        @Override
        public Integer call() throws QRelayException {
            List<String> deleted = qRelay().deleteQueue(queueId(id), force);
            if (json()) {
                printJson(Map.of("deleted", deleted));
            } else {
                out().println("Deleted queue(s): " + String.join(", ", deleted));
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "purge-queue", description = "Remove every live message of a queue")
    public static class PurgeQueue extends QRelayCommand {
        @Option(names = "--id", required = true, description = "Queue id or name")
        private String id;

        @Override
        public Integer call() throws QRelayException {
            int purged = qRelay().purgeQueue(queueId(id));
            if (json()) {
                printJson(Map.of("purged", purged));
            } else {
                out().println("Purged " + purged + " message(s)");
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "list-queues", description = "List all queues")
    public static class ListQueues extends QRelayCommand {

        @Override
        public Integer call() {
            List<Queue> queues = qRelay().listQueues();
            if (json()) {
                printJson(Map.of("queues", queues.stream().map(QueueCommands::queueMap).collect(Collectors.toList())));
                return ExitCodes.OK;
            }

            PrintWriter out = out();
            if (queues.isEmpty()) {
                out.println("No queues found.");
                return ExitCodes.OK;
            }
            out.println("Queues");
            out.println("=".repeat(100));
            out.printf("%-40s %-24s %-10s %-10s %-14s%n", "Queue Id", "Name", "Discipline", "Max Size", "Delivery");
            out.println("-".repeat(100));
            for (Queue queue : queues) {
                out.printf("%-40s %-24s %-10s %-10d %-14s%n", queue.queueId(), queue.name(),
                        queue.discipline().getValue(), queue.config().maxSize(), queue.config().deliveryMode().getValue());
            }
            out.println("=".repeat(100));
            out.println("Total queues: " + queues.size());
            return ExitCodes.OK;
        }
    }

    @Command(name = "queue-stats", description = "Show counters of a queue")
    public static class QueueStatsCommand extends QRelayCommand {
        @Option(names = "--id", required = true, description = "Queue id or name")
        private String id;

        @Override
        public Integer call() throws QRelayException {
            QueueStats stats = qRelay().queueStats(queueId(id));
            if (json()) {
                printJson(stats);
                return ExitCodes.OK;
            }

            PrintWriter out = out();
            out.println("Queue: " + stats.name() + " (" + stats.queueId() + ")");
            out.println("=".repeat(50));
            out.println("Discipline:      " + stats.discipline().getValue());
            out.println("Pending:         " + stats.pending() + " (delayed " + stats.delayed() + ")");
            out.println("In flight:       " + stats.inFlight());
            out.println("Capacity:        " + stats.depth() + "/" + stats.maxSize());
            out.println("Consumers:       " + stats.consumers());
            out.println("Sent:            " + stats.totalSent());
            out.println("Delivered:       " + stats.totalDelivered());
            out.println("Acked:           " + stats.totalAcked());
            out.println("Rejected:        " + stats.totalRejected());
            out.println("Dead-lettered:   " + stats.totalDeadLettered());
            out.println("Expired:         " + stats.totalExpired());
            out.println("=".repeat(50));
            return ExitCodes.OK;
        }
    }
}
