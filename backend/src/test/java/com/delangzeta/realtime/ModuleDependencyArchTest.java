package com.delangzeta.realtime;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: domain and common are leaves, pipeline modules talk through the topic, only api sees
 * everything.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.delangzeta.realtime");
    }

    @Test
    void domain_must_not_depend_on_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..realtime.domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..realtime.ingestion..", "..realtime.config..",
                        "..realtime.api..", "..realtime.notification..", "..realtime.sync..", "..realtime.topic..",
                        "..realtime.ratelimit..", "..realtime.auth..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..realtime.common..")
                .should().dependOnClassesThat().resideInAnyPackage("..realtime.domain..", "..realtime.ingestion..",
                        "..realtime.config..", "..realtime.api..", "..realtime.notification..", "..realtime.sync..",
                        "..realtime.topic..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_consumers_or_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..realtime.ingestion..")
                .should().dependOnClassesThat().resideInAnyPackage("..realtime.notification..", "..realtime.sync..",
                        "..realtime.api..");
        rule.check(classes);
    }

    @Test
    void notification_must_not_depend_on_ingestion_sync_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..realtime.notification..")
                .should().dependOnClassesThat().resideInAnyPackage("..realtime.ingestion..", "..realtime.sync..",
                        "..realtime.api..");
        rule.check(classes);
    }

    @Test
    void sync_must_not_depend_on_ingestion_notification_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..realtime.sync..")
                .should().dependOnClassesThat().resideInAnyPackage("..realtime.ingestion..",
                        "..realtime.notification..", "..realtime.api..");
        rule.check(classes);
    }

    @Test
    void topic_only_knows_domain() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..realtime.topic..")
                .should().dependOnClassesThat().resideInAnyPackage("..realtime.ingestion..",
                        "..realtime.notification..", "..realtime.sync..", "..realtime.api..");
        rule.check(classes);
    }

    @Test
    void ratelimit_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..realtime.ratelimit..")
                .should().dependOnClassesThat().resideInAPackage("..realtime.api..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..realtime.api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.delangzeta.realtime.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
