package com.aacprocessors.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Stream;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Processors extend the shared base class</li>
 *   <li>Base classes don't depend on format implementations</li>
 *   <li>The model stays independent of processors, analysis and conversion</li>
 *   <li>Formats don't depend on each other</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.aacprocessors.core");
    }

    /**
     * Verifies all processor implementations extend AbstractProcessor.
     */
    @Test
    void processors_shouldExtendAbstractProcessor() {
        ArchRule rule = classes()
            .that().resideInAPackage("..processor.impl..")
            .and().haveSimpleNameEndingWith("Processor")
            .should().beAssignableTo("com.aacprocessors.core.processor.base.AbstractProcessor");

        rule.check(classes);
    }

    @Test
    void baseProcessors_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..processor.base..")
            .should().dependOnClassesThat().resideInAPackage("..processor.impl..");

        rule.check(classes);
    }

    /**
     * Verifies one format never reaches into another format's package.
     */
    @Test
    void formats_shouldNotDependOnEachOther() {
        for (String format : new String[] {"gridset", "obf", "touchchat", "snap", "dot"}) {
            ArchRule rule = noClasses()
                .that().resideInAPackage("..processor.impl." + format + "..")
                .should().dependOnClassesThat().resideInAnyPackage(
                    otherFormats(format).toArray(String[]::new));

            rule.check(classes);
        }
    }

    /**
     * Verifies the model has no dependencies on the layers built on top of it.
     */
    @Test
    void models_shouldNotDependOnUpperLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage("..processor..", "..analysis..", "..conversion..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnProcessors() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAPackage("..processor..");

        rule.check(classes);
    }

    private static List<String> otherFormats(String format) {
        return Stream.of("gridset", "obf", "touchchat", "snap", "dot")
            .filter(other -> !other.equals(format))
            .map(other -> "..processor.impl." + other + "..")
            .toList();
    }
}
