package com.capgains;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: error is a leaf, domain knows only itself, the replay engine never
 * reaches into the REST layer, and the REST layer never touches repositories.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.capgains");
    }

    @Test
    void error_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.capgains.error..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..config..", "..api..",
                        "..costbasis..", "..fx..", "..store..");
        rule.check(classes);
    }

    @Test
    void domain_must_not_depend_on_services() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.capgains.domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..config..", "..api..", "..costbasis..",
                        "..fx..", "..store..");
        rule.check(classes);
    }

    @Test
    void config_must_not_depend_on_services() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.capgains.config..")
                .should().dependOnClassesThat().resideInAnyPackage("..api..", "..costbasis..", "..fx..", "..store..");
        rule.check(classes);
    }

    @Test
    void fx_and_store_must_not_depend_on_costbasis_or_api() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("com.capgains.fx..", "com.capgains.store..")
                .should().dependOnClassesThat().resideInAnyPackage("..costbasis..", "..api..");
        rule.check(classes);
    }

    @Test
    void costbasis_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.capgains.costbasis..")
                .should().dependOnClassesThat().resideInAPackage("..api..");
        rule.check(classes);
    }

    @Test
    void costbasis_pool_is_pure() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.capgains.costbasis.pool..")
                .should().dependOnClassesThat().resideInAnyPackage("org.springframework..", "..fx..",
                        "..store..", "..config..", "com.capgains.costbasis.settlement..", "com.capgains.costbasis.tax..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.capgains.api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.capgains.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
