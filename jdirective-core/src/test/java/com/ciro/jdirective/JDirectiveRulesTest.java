package com.ciro.jdirective;

import com.ciro.jdirective.error.TemplateException;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;
import org.slf4j.Logger;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.fields;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@AnalyzeClasses(packages = "com.ciro.jdirective", importOptions = ImportOption.DoNotIncludeTests.class)
public class JDirectiveRulesTest {

    // 1. El evaluador no sabe nada del árbol
    @ArchTest
    static final ArchRule expressions_must_not_touch_markup = noClasses()
            .that().resideInAPackage("..jdirective.template..")
            .should().dependOnClassesThat().resideInAPackage("org.jsoup..")
            .because("El gateway de expresiones es intercambiable y no conoce el DOM.");

    // 2. Errores sin dependencias de terceros
    @ArchTest
    static final ArchRule errors_are_plain = noClasses()
            .that().resideInAPackage("..jdirective.error..")
            .should().dependOnClassesThat().resideInAnyPackage("org.jsoup..", "com.fasterxml..", "org.slf4j..")
            .because("Los errores viajan en RenderResult hacia cualquier llamador.");

    // 3. Toda excepción del motor vive en el paquete error
    @ArchTest
    static final ArchRule exceptions_live_in_error_package = classes()
            .that().areAssignableTo(TemplateException.class)
            .should().resideInAPackage("..jdirective.error..");

    // 4. Loggers: private static final
    @ArchTest
    static final ArchRule loggers_are_private_static_final = fields()
            .that().haveRawType(Logger.class)
            .should().bePrivate()
            .andShould().beStatic()
            .andShould().beFinal()
            .because("Un logger por clase, como en el resto del proyecto.");

    // 5. Solo SLF4J
    @ArchTest
    static final ArchRule no_jul = noClasses()
            .should().dependOnClassesThat().resideInAPackage("java.util.logging..");
}
