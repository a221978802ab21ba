package qrelay.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import qrelay.cli.QRelayCli;
import qrelay.core.QRelay;
import qrelay.core.model.Exchange;
import qrelay.core.model.Queue;
import qrelay.core.utils.QUtils;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Shared plumbing of the subcommands: access to the broker, output format and
 * queue/exchange references that may be given by id or by name.
 */
abstract class QRelayCommand implements Callable<Integer> {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @ParentCommand
    protected QRelayCli root;

    @Spec
    protected CommandSpec spec;

    @Option(names = {"-f", "--format"}, description = "Output format: table or json (default: table)", defaultValue = "table")
    protected OutputFormat format;

    protected QRelay qRelay() {
        return root.getQRelay();
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected boolean json() {
        return format == OutputFormat.JSON;
    }

    protected void printJson(Object value) {
        try {
            out().println(MAPPER.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Error formatting JSON: " + e.getMessage(), e);
        }
    }

    protected String queueId(String reference) {
        return qRelay().findQueueByName(reference).map(Queue::queueId).orElse(reference);
    }

    protected String exchangeId(String reference) {
        return qRelay().findExchangeByName(reference).map(Exchange::exchangeId).orElse(reference);
    }

    protected static String time(long millis) {
        return QUtils.millisToDateTime(millis);
    }
}
