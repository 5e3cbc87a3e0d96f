package com.stablegate;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: domain and common are leaves, the event bus knows nothing of listeners,
 * listeners reach chains only through the adapter port.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.stablegate");
    }

    @Test
    void domain_must_not_depend_on_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..config..", "..event..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..ingestion..", "..config..", "..event..");
        rule.check(classes);
    }

    @Test
    void event_must_not_depend_on_ingestion() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..event..")
                .should().dependOnClassesThat().resideInAPackage("..ingestion..");
        rule.check(classes);
    }

    @Test
    void decoder_must_not_depend_on_listener_or_clients() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.decoder..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.listener..",
                        "..ingestion.adapter.evm..", "..ingestion.adapter.tron..");
        rule.check(classes);
    }

    @Test
    void listener_must_not_depend_on_concrete_chain_clients() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.listener..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.adapter.evm..",
                        "..ingestion.adapter.tron..", "..ingestion.config..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.stablegate.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
