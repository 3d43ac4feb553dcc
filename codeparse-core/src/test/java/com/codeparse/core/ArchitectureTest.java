package com.codeparse.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Language parsers extend the shared base class</li>
 *   <li>Parsers and their lexers are grouped by language family</li>
 *   <li>Value types are immutable records</li>
 *   <li>The parsing primitives never depend on language implementations</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.codeparse.core");
    }

    /**
     * Verifies every concrete language parser extends AbstractLanguageParser.
     */
    @Test
    void parsers_shouldExtendAbstractLanguageParser() {
        ArchRule rule = classes()
            .that().resideInAPackage("..parser.impl..")
            .and().haveSimpleNameEndingWith("Parser")
            .should().beAssignableTo("com.codeparse.core.parser.AbstractLanguageParser");

        rule.check(classes);
    }

    /**
     * Verifies lexers extend the shared Lexer.
     */
    @Test
    void lexers_shouldExtendLexer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..parser.impl..")
            .and().haveSimpleNameEndingWith("Lexer")
            .should().beAssignableTo("com.codeparse.core.lexical.Lexer");

        rule.check(classes);
    }

    @Test
    void parsers_shouldBeInLanguagePackages() {
        ArchRule rule = classes()
            .that().resideInAPackage("..parser.impl..")
            .should().resideInAnyPackage("..python..", "..javascript..", "..typescript..", "..cfamily..", "..rust..");

        rule.check(classes);
    }

    /**
     * Verifies token and diagnostic value types are records.
     */
    @Test
    void valueTypes_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAnyPackage("..token..", "..diagnostic..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the block, lexical and state layers stay independent of any language.
     */
    @Test
    void primitives_shouldNotDependOnParsers() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..block..", "..lexical..", "..state..", "..token..", "..symbol..")
            .should().dependOnClassesThat().resideInAPackage("..parser..");

        rule.check(classes);
    }

    @Test
    void ast_shouldNotDependOnParsers() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..ast..", "..query..")
            .should().dependOnClassesThat().resideInAnyPackage("..parser..", "..block..", "..lexical..");

        rule.check(classes);
    }

    /**
     * Verifies language implementations do not reach into each other, except TypeScript
     * which builds on the JavaScript parser.
     */
    @Test
    void languageFamilies_shouldBeIndependent() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..parser.impl.python..", "..parser.impl.cfamily..", "..parser.impl.javascript..", "..parser.impl.rust..")
            .should().dependOnClassesThat().resideInAnyPackage("..parser.impl.typescript..");

        rule.check(classes);
    }
}
