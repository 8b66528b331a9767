package com.polymind;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: domain and common at the bottom, api on top, analytics independent of ingestion.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.polymind");
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..analytics..", "..config..", "..api..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.polymind.common..")
                .should().dependOnClassesThat().resideInAnyPackage("com.polymind.domain..", "com.polymind.ingestion..",
                        "com.polymind.analytics..", "com.polymind.config..", "com.polymind.api..");
        rule.check(classes);
    }

    @Test
    void analytics_must_not_depend_on_ingestion_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.polymind.analytics..")
                .should().dependOnClassesThat().resideInAnyPackage("com.polymind.ingestion..", "com.polymind.api..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.polymind.ingestion..")
                .should().dependOnClassesThat().resideInAPackage("com.polymind.api..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.polymind.api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void decoder_must_not_depend_on_indexer_or_store() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.decoder..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.indexer..", "..ingestion.store..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.polymind.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
