package com.docinsight.cli;

import com.docinsight.core.config.ConfigLoader;
import com.docinsight.core.config.ProjectConfig;
import com.docinsight.core.config.ProjectConfig.ProviderSettings;
import com.docinsight.core.model.DiagramType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list diagram types or configured providers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * docinsight list types
 * docinsight list providers -c docinsight.yaml
 * }</pre>
 */
@Command(
    name = "list",
    description = "List diagram types or configured providers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "What to list: types or providers")
    private String what;

    @Option(names = {"-c", "--config"}, description = "Configuration file", defaultValue = "docinsight.yaml")
    private Path configFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (what.toLowerCase(Locale.ROOT)) {
            case "types", "type" -> listTypes(out);
            case "providers", "provider" -> listProviders(out);
            default -> {
                log.error("Unknown type: {}. Use: types or providers", what);
                yield 1;
            }
        };
    }

    private int listTypes(PrintWriter out) {
        out.println("Diagram Types:");
        out.println();
        for (DiagramType type : DiagramType.values()) {
            out.printf("  • %s (%s)%s%n", type.title(), type.slug(), type.structural() ? " - structural" : "");
        }
        out.flush();
        return 0;
    }

    private int listProviders(PrintWriter out) {
        ProjectConfig config = ConfigLoader.load(configFile);
        List<ProviderSettings> providers = config.providersByPriority();

        out.println("Configured Providers (priority order):");
        out.println();
        if (providers.isEmpty()) {
            out.println("  No providers configured.");
        }
        for (ProviderSettings provider : providers) {
            boolean keyPresent = provider.apiKeyEnv() != null && System.getenv(provider.apiKeyEnv()) != null;
            out.printf("  • %s (%s, priority %d)%n", provider.id(), provider.kind(), provider.priority());
            out.printf("    Model: %s%n", provider.model() != null ? provider.model() : "(default)");
            out.printf("    API key: %s (%s)%n", provider.apiKeyEnv(), keyPresent ? "set" : "missing");
            out.printf("    Retries: %d, timeout %ss%n", provider.retryBudget(), provider.timeout().toSeconds());
        }
        out.flush();
        return 0;
    }
}
