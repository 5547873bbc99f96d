package com.docinsight.cli;

import com.docinsight.core.config.ConfigLoader;
import com.docinsight.core.config.ProjectConfig;
import com.docinsight.core.model.DiagramOutcome;
import com.docinsight.core.model.GenerationRequest;
import com.docinsight.core.model.GenerationResult;
import com.docinsight.core.orchestrator.GenerationOrchestrator;
import com.docinsight.core.provider.CompletionGateway;
import com.docinsight.core.provider.ProviderRegistry;
import com.docinsight.core.provider.ProviderRegistryFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to generate the insight document and diagrams for one entity.
 *
 * <p>The request file is JSON:
 * <pre>{@code
 * {
 *   "entity": {"name": "OrderService", "type": "Service", "observations": ["..."]},
 *   "patterns": [{"name": "Saga", "category": "architecture", "significance": 7}],
 *   "relations": [{"from": "OrderService", "to": "PaymentGateway", "relationType": "uses"}]
 * }
 * }</pre>
 *
 * <p>Exit code 0 when the document was written or generation was skipped, 1 otherwise.
 */
@Command(
    name = "generate",
    description = "Generate an insight document with diagrams for one entity",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    private static final ObjectMapper JSON = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "JSON request file (entity, patterns, relations)")
    private Path requestFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file", defaultValue = "docinsight.yaml")
    private Path configFile;

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides configuration)")
    private Path outputDirectory;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        GenerationRequest request;
        try {
            request = JSON.readValue(requestFile.toFile(), GenerationRequest.class);
        } catch (IOException e) {
            log.error("Cannot read request {}: {}", requestFile, e.getMessage());
            return 1;
        }

        ProjectConfig config = withOutputOverride(ConfigLoader.load(configFile));
        ProviderRegistry registry = ProviderRegistryFactory.fromConfig(config, System::getenv);

        GenerationResult result;
        try (CompletionGateway gateway = new CompletionGateway(registry)) {
            result = GenerationOrchestrator.create(config, gateway).generate(request);
        }

        printSummary(out, result);
        return result.succeeded() ? 0 : 1;
    }

    private ProjectConfig withOutputOverride(ProjectConfig config) {
        if (outputDirectory == null) {
            return config;
        }
        return new ProjectConfig(config.providers(), config.generation(), config.plantuml(),
            new ProjectConfig.OutputSettings(outputDirectory.toString()));
    }

    static void printSummary(PrintWriter out, GenerationResult result) {
        out.printf("Entity:      %s%n", result.entityName());
        out.printf("Status:      %s%n", result.status());
        if (result.failure() != null) {
            out.printf("Failure:     %s - %s%n", result.failure(), result.failureMessage());
        }
        out.printf("Patterns:    %d analyzed, %d significant (threshold %d)%n",
            result.patternsAnalyzed(), result.significantPatterns(), result.diagnostics().threshold());
        if (!result.diagnostics().qualifies()) {
            out.printf("Scores:      %s%n", result.diagnostics().distribution());
        }
        out.printf("Documents:   %d%n", result.documentsGenerated());
        out.printf("Diagrams:    %d attempted, %d succeeded, %d failed%n",
            result.diagramsAttempted(), result.successfulDiagrams(), result.failedDiagrams());
        for (DiagramOutcome diagram : result.diagrams()) {
            String detail = diagram.successful()
                ? (diagram.validatedButNotRendered() ? "valid, not rendered" : "valid, rendered")
                : diagram.failureReason();
            out.printf("  - %-12s %s%n", diagram.type().slug(), detail);
        }
        if (result.narrativeFile() != null) {
            out.printf("Narrative:   %s%n", result.narrativeFile());
        }
        out.printf("Time:        %dms%n", result.processingTime().toMillis());
        out.flush();
    }
}
