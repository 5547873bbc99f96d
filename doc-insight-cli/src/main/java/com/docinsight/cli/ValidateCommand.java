package com.docinsight.cli;

import com.docinsight.core.config.ConfigLoader;
import com.docinsight.core.config.ProjectConfig;
import com.docinsight.core.model.DiagramType;
import com.docinsight.core.repair.CheckResult;
import com.docinsight.core.repair.PlantUmlSyntaxChecker;
import com.docinsight.core.repair.ProcessRunner;
import com.docinsight.core.util.FileUtils;
import com.docinsight.core.validator.DiagramSyntax;
import com.docinsight.core.validator.PlantUmlValidator;
import com.docinsight.core.validator.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to fix a PlantUML file with the rule chain and optionally run the PlantUML checker.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print the fixed diagram
 * docinsight validate order-service-class.puml --type class
 *
 * # Fix in place and confirm with plantuml -checkonly
 * docinsight validate order-service-class.puml --write --check
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Fix and check a PlantUML diagram file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "PlantUML file to validate")
    private Path diagramFile;

    @Option(names = {"-t", "--type"}, description = "Diagram type (architecture, sequence, class, use-cases); inferred if omitted")
    private String type;

    @Option(names = {"-w", "--write"}, description = "Write the fixed diagram back to the file")
    private boolean write;

    @Option(names = {"--check"}, description = "Run the PlantUML syntax checker on the fixed diagram")
    private boolean check;

    @Option(names = {"-c", "--config"}, description = "Configuration file", defaultValue = "docinsight.yaml")
    private Path configFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String raw;
        try {
            raw = Files.readString(diagramFile);
        } catch (IOException e) {
            log.error("Cannot read {}: {}", diagramFile, e.getMessage());
            return 1;
        }

        DiagramSyntax syntax;
        try {
            syntax = type != null ? DiagramSyntax.of(DiagramType.fromValue(type)) : PlantUmlValidator.inferSyntax(raw);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 1;
        }

        ValidationResult result = new PlantUmlValidator().check(raw, syntax);
        if (result instanceof ValidationResult.Unrepairable unrepairable) {
            err.println("Unrepairable: " + unrepairable.reason());
            return 1;
        }
        String fixed = ((ValidationResult.Fixed) result).fixedText();

        if (write) {
            try {
                FileUtils.writeAtomically(diagramFile, fixed);
                out.println("Fixed diagram written to " + diagramFile);
            } catch (IOException e) {
                log.error("Cannot write {}: {}", diagramFile, e.getMessage());
                return 1;
            }
        } else {
            out.println(fixed);
        }

        if (check) {
            return runChecker(out, err, fixed);
        }
        return 0;
    }

    private int runChecker(PrintWriter out, PrintWriter err, String fixed) {
        ProjectConfig config = ConfigLoader.load(configFile);
        PlantUmlSyntaxChecker checker = new PlantUmlSyntaxChecker(config.plantuml().command(), new ProcessRunner(),
            config.generation().subprocessTimeout());

        Path target = diagramFile;
        Path scratch = null;
        try {
            if (!write) {
                scratch = Files.createTempFile("doc-insight-validate-", ".puml");
                Files.writeString(scratch, fixed);
                target = scratch;
            }
            CheckResult verdict = checker.check(target);
            if (verdict.valid()) {
                out.println("PlantUML check passed");
                return 0;
            }
            err.println("PlantUML check failed: " + verdict.diagnostic());
            return 1;
        } catch (IOException e) {
            log.error("Cannot prepare file for checking: {}", e.getMessage());
            return 1;
        } finally {
            if (scratch != null) {
                FileUtils.deleteQuietly(scratch);
            }
        }
    }
}
