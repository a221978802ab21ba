package qrelay.cli.commands;

import qrelay.cli.ExitCodes;
import qrelay.core.model.BrokerStats;
import qrelay.core.model.QueueDiscipline;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.Map;

@Command(name = "stats", description = "Show broker-wide counters")
public class StatsCommand extends QRelayCommand {

    @Override
    public Integer call() {
        BrokerStats stats = qRelay().stats();
        if (json()) {
            printJson(stats);
            return ExitCodes.OK;
        }

        PrintWriter out = out();
        out.println("QRelay");
        out.println("=".repeat(50));
        out.println("Queues:            " + stats.queues());
        for (Map.Entry<QueueDiscipline, Integer> entry : stats.queuesByDiscipline().entrySet()) {
            out.println("  " + entry.getKey().getValue() + ": " + entry.getValue());
        }
        out.println("Exchanges:         " + stats.exchanges());
        out.println("Consumers:         " + stats.consumers());
        out.println("Pending messages:  " + stats.messagesPending());
        out.println("In flight:         " + stats.messagesInFlight());
        out.println("Dead letters:      " + stats.deadLetterEntries());
        out.println("=".repeat(50));
        return ExitCodes.OK;
    }
}
