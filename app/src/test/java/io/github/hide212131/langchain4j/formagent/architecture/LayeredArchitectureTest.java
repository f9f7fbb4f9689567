package io.github.hide212131.langchain4j.formagent.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(
        packages = "io.github.hide212131.langchain4j.formagent",
        importOptions = ImportOption.DoNotIncludeTests.class)
class LayeredArchitectureTest {

    private static final String APP = "io.github.hide212131.langchain4j.formagent.app..";
    private static final String RUNTIME = "io.github.hide212131.langchain4j.formagent.runtime..";
    private static final String INFRA = "io.github.hide212131.langchain4j.formagent.infra..";
    private static final String AGENT = "io.github.hide212131.langchain4j.formagent.runtime.agent..";
    private static final String FORM = "io.github.hide212131.langchain4j.formagent.runtime.form..";

    @ArchTest
    static final ArchRule appModuleShouldOnlyDependOnAllowedLayers =
            classes()
                    .that()
                    .resideInAPackage(APP)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(
                            APP,
                            RUNTIME,
                            INFRA,
                            "java..",
                            "javax..",
                            "picocli..",
                            "com.fasterxml.jackson..");

    @ArchTest
    static final ArchRule runtimeModuleShouldNotDependOnAppNorOtherLayers =
            classes()
                    .that()
                    .resideInAPackage(RUNTIME)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(
                            RUNTIME,
                            INFRA,
                            "java..",
                            "javax..",
                            "org.slf4j..",
                            "dev.langchain4j..",
                            "io.opentelemetry..",
                            "io.github.cdimascio..",
                            "org.yaml..",
                            "com.fasterxml.jackson..");

    @ArchTest
    static final ArchRule infraModuleShouldBeLeafLayer =
            classes()
                    .that()
                    .resideInAPackage(INFRA)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(INFRA, "java..", "javax..", "org.slf4j..");

    @ArchTest
    static final ArchRule agentCoreShouldNotKnowConcreteIntegrations =
            noClasses()
                    .that()
                    .resideInAPackage(AGENT)
                    .should()
                    .dependOnClassesThat()
                    .resideInAnyPackage(
                            "io.github.hide212131.langchain4j.formagent.runtime.provider..",
                            "io.github.hide212131.langchain4j.formagent.runtime.provisioning..",
                            "io.github.hide212131.langchain4j.formagent.runtime.observability..",
                            "dev.langchain4j..",
                            "io.opentelemetry..");

    @ArchTest
    static final ArchRule formValidationShouldStayIndependentOfAgentRuntime =
            noClasses()
                    .that()
                    .resideInAPackage(FORM)
                    .should()
                    .dependOnClassesThat()
                    .resideInAnyPackage(AGENT, "dev.langchain4j..", "io.opentelemetry..");
}
