package qrelay.cli.commands;

import qrelay.cli.ExitCodes;
import qrelay.core.exceptions.QRelayException;
import qrelay.core.model.Binding;
import qrelay.core.model.Exchange;
import qrelay.core.model.ExchangeType;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Exchange and binding commands.
 */
public class ExchangeCommands {

    private ExchangeCommands() {
    }

    static Map<String, Object> exchangeMap(Exchange exchange) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("exchangeId", exchange.exchangeId());
        map.put("name", exchange.name());
        map.put("type", exchange.type().getValue());
        map.put("bindings", exchange.bindings().stream()
                .map(b -> Map.of("queueId", b.queueId(), "routingKey", b.routingKey()))
                .collect(Collectors.toList()));
        return map;
    }

    @Command(name = "create-exchange", description = "Create a fanout, direct or topic exchange")
    public static class CreateExchange extends QRelayCommand {
        @Option(names = "--name", required = true, description = "Exchange name")
        private String name;

        @Option(names = "--type", required = true, description = "fanout, direct or topic")
        private ExchangeType type;

        @Override
        public Integer call() throws QRelayException {
            Exchange exchange = qRelay().createExchange(name, type);
            if (json()) {
                printJson(exchangeMap(exchange));
            } else {
                out().println("Created " + exchange.type().getValue() + " exchange " + exchange.name()
                        + " (" + exchange.exchangeId() + ")");
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "bind", description = "Bind a queue to an exchange")
    public static class Bind extends QRelayCommand {
        @Option(names = "--exchange", required = true, description = "Exchange id or name")
        private String exchange;

        @Option(names = "--queue", required = true, description = "Queue id or name")
        private String queue;

        @Option(names = "--routing-key", defaultValue = "", description = "Binding key, ignored by fanout exchanges")
        private String routingKey;

        @Override
        public Integer call() throws QRelayException {
            Exchange updated = qRelay().bind(exchangeId(exchange), queueId(queue), routingKey);
            if (json()) {
                printJson(exchangeMap(updated));
            } else {
                out().println("Bound " + queue + " to " + updated.name() + " with key '" + routingKey + "'");
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "unbind", description = "Remove a binding from an exchange")
    public static class Unbind extends QRelayCommand {
        @Option(names = "--exchange", required = true, description = "Exchange id or name")
        private String exchange;

        @Option(names = "--queue", required = true, description = "Queue id or name")
        private String queue;

        @Option(names = "--routing-key", defaultValue = "", description = "Binding key")
        private String routingKey;

        @Override
        public Integer call() throws QRelayException {
            boolean removed = qRelay().unbind(exchangeId(exchange), queueId(queue), routingKey);
            if (json()) {
                printJson(Map.of("removed", removed));
            } else {
                out().println(removed ? "Binding removed" : "No such binding");
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "list-exchanges", description = "List exchanges and their bindings")
    public static class ListExchanges extends QRelayCommand {

        @Override
        public Integer call() {
            List<Exchange> exchanges = qRelay().listExchanges();
            if (json()) {
                printJson(Map.of("exchanges", exchanges.stream().map(ExchangeCommands::exchangeMap).collect(Collectors.toList())));
                return ExitCodes.OK;
            }

            PrintWriter out = out();
            if (exchanges.isEmpty()) {
                out.println("No exchanges found.");
                return ExitCodes.OK;
            }
            out.println("Exchanges");
            out.println("=".repeat(80));
            for (Exchange exchange : exchanges) {
                out.printf("%-40s %-24s %-8s%n", exchange.exchangeId(), exchange.name(), exchange.type().getValue());
                for (Binding binding : exchange.bindings()) {
                    out.printf("    -> %-40s key '%s'%n", binding.queueId(), binding.routingKey());
                }
            }
            out.println("=".repeat(80));
            out.println("Total exchanges: " + exchanges.size());
            return ExitCodes.OK;
        }
    }
}
