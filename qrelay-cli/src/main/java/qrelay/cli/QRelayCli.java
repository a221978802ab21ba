package qrelay.cli;

import qrelay.cli.commands.ConsumerCommands;
import qrelay.cli.commands.ExchangeCommands;
import qrelay.cli.commands.MessageCommands;
import qrelay.cli.commands.QueueCommands;
import qrelay.cli.commands.StatsCommand;
import qrelay.cli.config.CliConfiguration;
import qrelay.cli.ui.InteractiveShell;
import qrelay.core.QRelay;
import qrelay.core.exceptions.QRelayException;
import qrelay.core.model.DeliveryMode;
import qrelay.core.model.ExchangeType;
import qrelay.core.model.QueueDiscipline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
        name = "qrelay",
        description = "QRelay message queue - administration and data-plane commands",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        subcommands = {
                QueueCommands.CreateQueue.class,
                QueueCommands.DeleteQueue.class,
                QueueCommands.PurgeQueue.class,
                QueueCommands.ListQueues.class,
                QueueCommands.QueueStatsCommand.class,
                ExchangeCommands.CreateExchange.class,
                ExchangeCommands.Bind.class,
                ExchangeCommands.Unbind.class,
                ExchangeCommands.ListExchanges.class,
                ConsumerCommands.RegisterConsumer.class,
                ConsumerCommands.ListConsumers.class,
                MessageCommands.Send.class,
                MessageCommands.Publish.class,
                MessageCommands.Receive.class,
                MessageCommands.Ack.class,
                MessageCommands.Nack.class,
                MessageCommands.ReplayDeadLetters.class,
                MessageCommands.ListDeadLetters.class,
                StatsCommand.class
        }
)
public class QRelayCli implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(QRelayCli.class);

    private final QRelay qRelay;

    @Spec
    private CommandSpec spec;

    public QRelayCli(QRelay qRelay) {
        this.qRelay = qRelay;
    }

    public QRelay getQRelay() {
        return qRelay;
    }

    public static void main(String[] args) {
        int exitCode;
        try (QRelay qRelay = new QRelay(CliConfiguration.getInstance().toBrokerConfig())) {
            CommandLine commandLine = newCommandLine(qRelay);
            if (args.length == 0) {
                // no arguments: interactive shell over one broker instance
                new InteractiveShell(commandLine).start();
                exitCode = ExitCodes.OK;
            } else {
                exitCode = commandLine.execute(args);
            }
        } catch (QRelayException e) {
            System.err.println("Error: " + e.getMessage());
            exitCode = ExitCodes.forException(e);
        }
        System.exit(exitCode);
    }

    /**
     * Builds the command line with the converters and exit code handling shared by
     * one-shot runs and the interactive shell.
     */
    public static CommandLine newCommandLine(QRelay qRelay) {
        CommandLine commandLine = new CommandLine(new QRelayCli(qRelay));
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.registerConverter(QueueDiscipline.class, QueueDiscipline::fromValue);
        commandLine.registerConverter(DeliveryMode.class, DeliveryMode::fromValue);
        commandLine.registerConverter(ExchangeType.class, ExchangeType::fromValue);

        commandLine.setParameterExceptionHandler((ex, args) -> {
            CommandLine cmd = ex.getCommandLine();
            cmd.getErr().println("Error: " + ex.getMessage());
            cmd.usage(cmd.getErr());
            return ExitCodes.VALIDATION;
        });
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            int exitCode = ExitCodes.forException(ex);
            if (ex instanceof QRelayException) {
                cmd.getErr().println("Error: " + ex.getMessage());
            } else {
                logger.error("Command {} failed", cmd.getCommandName(), ex);
                cmd.getErr().println("Error: " + ex);
            }
            return exitCode;
        });
        return commandLine;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
