package qrelay.cli.commands;

import qrelay.cli.ExitCodes;
import static qrelay.cli.commands.QRelayCommand.time;
import qrelay.core.exceptions.QRelayException;
import qrelay.core.model.QueueConsumer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class ConsumerCommands {

    private ConsumerCommands() {
    }

    static Map<String, Object> consumerMap(QueueConsumer consumer) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("consumerId", consumer.consumerId());
        map.put("queueId", consumer.queueId());
        map.put("name", consumer.name());
        map.put("batchSize", consumer.batchSize());
        map.put("registeredAt", time(consumer.registeredAt()));
        return map;
    }

    @Command(name = "register-consumer", description = "Register a consumer on a queue")
    public static class RegisterConsumer extends QRelayCommand {
        @Option(names = "--queue", required = true, description = "Queue id or name")
        private String queue;

        @Option(names = "--name", defaultValue = "consumer", description = "Consumer name")
        private String name;

        @Option(names = "--batch-size", defaultValue = "10", description = "Messages per receive (default: 10)")
        private int batchSize;

        @Override
        public Integer call() throws QRelayException {
            QueueConsumer consumer = qRelay().registerConsumer(queueId(queue), name, batchSize);
            if (json()) {
                printJson(consumerMap(consumer));
            } else {
                out().println("Registered consumer " + consumer.name() + " (" + consumer.consumerId() + ")");
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "list-consumers", description = "List registered consumers")
    public static class ListConsumers extends QRelayCommand {
        @Option(names = "--queue", description = "Only consumers of this queue (id or name)")
        private String queue;

        @Override
        public Integer call() {
            List<QueueConsumer> consumers = queue != null
                    ? qRelay().listConsumers(queueId(queue))
                    : qRelay().listConsumers();
            if (json()) {
                printJson(Map.of("consumers", consumers.stream().map(ConsumerCommands::consumerMap).collect(Collectors.toList())));
                return ExitCodes.OK;
            }

            PrintWriter out = out();
            if (consumers.isEmpty()) {
                out.println("No consumers found.");
                return ExitCodes.OK;
            }
            out.printf("%-40s %-40s %-20s %-6s%n", "Consumer Id", "Queue Id", "Name", "Batch");
            out.println("-".repeat(110));
            for (QueueConsumer consumer : consumers) {
                out.printf("%-40s %-40s %-20s %-6d%n", consumer.consumerId(), consumer.queueId(), consumer.name(),
                        consumer.batchSize());
            }
            return ExitCodes.OK;
        }
    }
}
