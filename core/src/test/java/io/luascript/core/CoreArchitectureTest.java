package io.luascript.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Stage boundaries of the compiler core.
 *
 * <p>Each stage may only see the stages before it; the IR model and the error types see nothing
 * else in the core. Only {@code engine} wires the stages together.
 */
@AnalyzeClasses(packages = "io.luascript.core", importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule irIsSelfContained = noClasses()
            .that()
            .resideInAPackage("io.luascript.core.ir..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.luascript.core.parse..",
                    "io.luascript.core.normalize..",
                    "io.luascript.core.lower..",
                    "io.luascript.core.validate..",
                    "io.luascript.core.emit..",
                    "io.luascript.core.engine..",
                    "io.luascript.core.error..")
            .because("the IR model is shared by every stage and must not depend on any of them");

    @ArchTest
    static final ArchRule errorsAreLeaves = noClasses()
            .that()
            .resideInAPackage("io.luascript.core.error..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.luascript.core.ir..", "io.luascript.core.parse..", "io.luascript.core.engine..")
            .because("exceptions are thrown from every stage");

    @ArchTest
    static final ArchRule frontEndIgnoresIr = noClasses()
            .that()
            .resideInAnyPackage("io.luascript.core.parse..", "io.luascript.core.normalize..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.luascript.core.ir..",
                    "io.luascript.core.lower..",
                    "io.luascript.core.emit..",
                    "io.luascript.core.engine..")
            .because("parsing and normalization work on source trees only");

    @ArchTest
    static final ArchRule emitterSeesOnlyIr = noClasses()
            .that()
            .resideInAPackage("io.luascript.core.emit..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.luascript.core.parse..",
                    "io.luascript.core.normalize..",
                    "io.luascript.core.lower..",
                    "io.luascript.core.engine..")
            .because("the emitter renders validated IR and knows nothing about the source language");

    @ArchTest
    static final ArchRule onlyEngineWiresStages = noClasses()
            .that()
            .resideOutsideOfPackage("io.luascript.core.engine..")
            .should()
            .dependOnClassesThat()
            .resideInAPackage("io.luascript.core.engine..")
            .because("the pipeline is the only entry point that runs every stage");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("the compiler core does not use reflection");

    @ArchTest
    static final ArchRule statelessStagesHaveFinalFields = classes()
            .that()
            .haveSimpleNameEndingWith("Emitter")
            .or()
            .haveSimpleNameEndingWith("Validator")
            .or()
            .haveSimpleName("CompilerPipeline")
            .should()
            .haveOnlyFinalFields()
            .because("stage objects are shared across compilations");
}
