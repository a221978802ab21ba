package qrelay.cli.ui;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import picocli.CommandLine;

import java.io.IOException;
import java.util.List;

/**
 * Line-oriented shell that runs {@code qrelay} subcommands against one broker instance,
 * so queues and in-flight messages survive from one command to the next.
 */
public class InteractiveShell {
    private static final String PROMPT = "qrelay> ";

    private final CommandLine commandLine;
    private final DefaultParser parser = new DefaultParser();
    private boolean running = true;

    public InteractiveShell(CommandLine commandLine) {
        this.commandLine = commandLine;
    }

    public void start() {
        Terminal terminal;
        try {
            terminal = TerminalBuilder.builder().system(true).build();
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize interactive shell", e);
        }
        LineReader reader = LineReaderBuilder.builder().terminal(terminal).parser(parser).build();

        printWelcome();
        while (running) {
            try {
                String line = reader.readLine(PROMPT);
                execute(line);
            } catch (UserInterruptException e) {
                // ctrl-c drops the current line
            } catch (EndOfFileException e) {
                running = false;
            }
        }
        System.out.println("Goodbye!");
    }

    private void printWelcome() {
        System.out.println();
        System.out.println("=".repeat(60));
        System.out.println("        QRelay - Interactive Mode");
        System.out.println("=".repeat(60));
        System.out.println("Type 'help' for the list of commands, 'exit' to quit.");
        System.out.println();
    }

    /**
     * Runs one shell line.
     *
     * @return the command's exit code, 0 for blank lines and built-ins
     */
    public int execute(String line) {
        if (line == null || line.isBlank()) {
            return 0;
        }
        List<String> words = parser.parse(line, line.length()).words();
        String[] args = words.stream().filter(w -> !w.isEmpty()).toArray(String[]::new);
        if (args.length == 0) {
            return 0;
        }

        if ("exit".equals(args[0]) || "quit".equals(args[0])) {
            running = false;
            return 0;
        }
        if ("help".equals(args[0])) {
            commandLine.usage(commandLine.getOut());
            return 0;
        }
        return commandLine.execute(args);
    }

    public boolean isRunning() {
        return running;
    }
}
