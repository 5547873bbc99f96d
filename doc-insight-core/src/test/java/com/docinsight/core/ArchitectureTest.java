package com.docinsight.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate the layering of the generation pipeline.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are immutable records and depend on nothing in the pipeline</li>
 *   <li>Text validation stays free of file and process access</li>
 *   <li>The gateway knows nothing about what its prompts are for</li>
 *   <li>Only the orchestrator wires the stages together</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.docinsight.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnPipelinePackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage("..provider..", "..validator..", "..repair..",
                "..generator..", "..writer..", "..orchestrator..", "..config..");

        rule.check(classes);
    }

    /**
     * The validator is a pure text transformation; files and subprocesses belong to the repair stage.
     */
    @Test
    void validator_shouldNotTouchFilesOrProcesses() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..validator..")
            .should().dependOnClassesThat().resideInAPackage("java.nio.file..")
            .orShould().dependOnClassesThat().belongToAnyOf(ProcessBuilder.class, java.io.File.class);

        rule.check(classes);
    }

    @Test
    void provider_shouldNotDependOnPipelineStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..provider..")
            .should().dependOnClassesThat().resideInAnyPackage("..validator..", "..repair..", "..generator..",
                "..writer..", "..orchestrator..");

        rule.check(classes);
    }

    @Test
    void writer_shouldNotDependOnGenerationStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..writer..")
            .should().dependOnClassesThat().resideInAnyPackage("..provider..", "..repair..", "..generator..",
                "..orchestrator..");

        rule.check(classes);
    }

    @Test
    void orchestrator_shouldOnlyBeUsedFromOutsideTheStages() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..provider..", "..validator..", "..repair..", "..generator..", "..writer..")
            .should().dependOnClassesThat().resideInAPackage("..orchestrator..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnFeaturePackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..provider..", "..validator..", "..repair..",
                "..generator..", "..writer..", "..orchestrator..", "..config..", "..model..");

        rule.check(classes);
    }
}
