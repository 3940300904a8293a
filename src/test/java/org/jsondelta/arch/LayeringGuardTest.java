package org.jsondelta.arch;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "org.jsondelta", importOptions = ImportOption.DoNotIncludeTests.class)
class LayeringGuardTest {
    @ArchTest
    static final ArchRule core_does_not_depend_on_outputs = noClasses()
            .that()
            .resideInAnyPackage(
                    "org.jsondelta.value..",
                    "org.jsondelta.path..",
                    "org.jsondelta.engine..",
                    "org.jsondelta.pattern..",
                    "org.jsondelta.obs..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("org.jsondelta.report..", "org.jsondelta.cli..");

    @ArchTest
    static final ArchRule value_model_stands_alone = noClasses()
            .that()
            .resideInAPackage("org.jsondelta.value..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "org.jsondelta.path..",
                    "org.jsondelta.engine..",
                    "org.jsondelta.pattern..",
                    "org.jsondelta.obs..");

    @ArchTest
    static final ArchRule addressing_does_not_depend_on_comparison = noClasses()
            .that()
            .resideInAPackage("org.jsondelta.path..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("org.jsondelta.engine..", "org.jsondelta.pattern..", "org.jsondelta.obs..");
}
