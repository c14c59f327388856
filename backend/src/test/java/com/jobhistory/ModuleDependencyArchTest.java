package com.jobhistory;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: domain and the store / search collaborators are leaves, history is the core, api and
 * config sit on top.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.jobhistory");
    }

    @Test
    void domain_must_not_depend_on_other_app_packages() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..api..", "..config..", "..history..", "..store..", "..search..");
        rule.check(classes);
    }

    @Test
    void store_must_not_depend_on_other_app_packages() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..store..")
                .should().dependOnClassesThat().resideInAnyPackage("..api..", "..config..", "..history..", "..search..", "..domain..");
        rule.check(classes);
    }

    @Test
    void search_must_not_depend_on_other_app_packages() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..search..")
                .should().dependOnClassesThat().resideInAnyPackage("..api..", "..config..", "..history..", "..store..", "..domain..");
        rule.check(classes);
    }

    @Test
    void history_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..history..")
                .should().dependOnClassesThat().resideInAPackage("..api..");
        rule.check(classes);
    }

    @Test
    void config_must_not_depend_on_api_or_history() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..config..")
                .should().dependOnClassesThat().resideInAnyPackage("..api..", "..history..");
        rule.check(classes);
    }

    @Test
    void api_should_not_use_collection_store_directly() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..api..")
                .should().dependOnClassesThat().resideInAPackage("..store..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.jobhistory.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
