package com.docinsight;

import ch.qos.logback.classic.Level;
import com.docinsight.cli.GenerateCommand;
import com.docinsight.cli.ListCommand;
import com.docinsight.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for DocInsight.
 *
 * <p>DocInsight turns extracted patterns and observations about a knowledge entity into an
 * insight document with validated PlantUML diagrams.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate the insight document for one entity</li>
 *   <li>{@code validate} - Fix and check a PlantUML file</li>
 *   <li>{@code list} - List diagram types or configured providers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Generate documentation for an entity
 * doc-insight generate request.json -c docinsight.yaml
 *
 * # Fix a diagram in place
 * doc-insight validate diagrams/order-service-sequence.puml --type sequence --write
 * }</pre>
 */
@Command(
    name = "docinsight",
    mixinStandardHelpOptions = true,
    version = "DocInsight 1.0.0-SNAPSHOT",
    description = "Insight document and diagram generation with resilient LLM providers",
    subcommands = {
        GenerateCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class DocInsightCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DocInsightCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("DocInsight - Insight documents with validated diagrams");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'docinsight --help' to see available commands");
        System.out.println("Use 'docinsight <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Creates the command line with logging configured before any command runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DocInsightCLI cli = new DocInsightCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
