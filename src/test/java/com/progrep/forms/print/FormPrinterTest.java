package com.progrep.forms.print;

import com.progrep.forms.FormFixtures;
import com.progrep.forms.attribute.Attribute;
import com.progrep.forms.attribute.BasicAttribute;
import com.progrep.forms.declarator.CallableSpecies;
import com.progrep.forms.declarator.IdSpecies;
import com.progrep.forms.declarator.SimpleIndirector;
import com.progrep.forms.declarator.TermDeclarator;
import com.progrep.forms.flags.BindingMode;
import com.progrep.forms.flags.TypeQualifiers;
import com.progrep.forms.lexical.Token;
import com.progrep.forms.ref.OptionalRef;
import com.progrep.forms.semantic.Expr;
import com.progrep.forms.store.FormStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.progrep.forms.FormFixtures.identifier;
import static com.progrep.forms.FormFixtures.name;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FormPrinter.
 */
class FormPrinterTest {

    private final FormStore store = new FormStore("printer-test");
    private final FormPrinter printer = new FormPrinter(SemanticRenderer.usingToString());

    private IdSpecies id(String spelling) {
        return store.idSpecies(name(spelling));
    }

    @Test
    void testPrintAttributes() {
        Token ellipsis = FormFixtures.token("...", Token.TokenType.PUNCTUATOR);
        BasicAttribute deprecated = store.basicAttribute(identifier("deprecated"));
        BasicAttribute message = store.basicAttribute(FormFixtures.token("\"use g\"", Token.TokenType.STRING_LITERAL));

        assertThat(printer.print(deprecated)).isEqualTo("deprecated");
        assertThat(printer.print(store.scopedAttribute(identifier("gnu"), identifier("unused"))))
                .isEqualTo("gnu::unused");
        assertThat(printer.print(store.calledAttribute(deprecated, List.of(message))))
                .isEqualTo("deprecated(\"use g\")");
        assertThat(printer.print(store.labeledAttribute(identifier("msvc"), deprecated)))
                .isEqualTo("msvc: deprecated");
        assertThat(printer.print(store.expandedAttribute(ellipsis, deprecated)))
                .isEqualTo("deprecated...");
        assertThat(printer.print(store.elaboratedAttribute(name("pure"))))
                .isEqualTo("pure");
    }

    @Test
    void testPrintFactoredAttributeSequence() {
        Attribute factored = store.factoredAttribute(identifier("gnu"), List.of(
                store.basicAttribute(identifier("hot")),
                store.basicAttribute(identifier("always_inline"))));

        assertThat(printer.printAttributes(store.sequenceOf(factored)))
                .isEqualTo("[[using gnu: hot, always_inline]]");
        assertThat(printer.printAttributes(store.sequence(List.of()))).isEmpty();
    }

    @Test
    void testUnbracketedAttributes() {
        FormPrinter bare = new FormPrinter(SemanticRenderer.usingToString(),
                PrinterConfig.builder().bracketAttributes(false).listSeparator(",").build());
        BasicAttribute a = store.basicAttribute(identifier("a"));
        BasicAttribute b = store.basicAttribute(identifier("b"));

        assertThat(bare.printAttributes(store.sequenceOf(a, b))).isEqualTo("a,b");
    }

    @Test
    void testPrintPointerDeclarators() {
        TermDeclarator plain = store.termDeclarator(
                List.of(store.simpleIndirector(SimpleIndirector.Mode.DEREF)), id("p"));
        TermDeclarator constPointer = store.termDeclarator(
                List.of(store.simpleIndirector(SimpleIndirector.Mode.DEREF, TypeQualifiers.CONST, List.of())), id("p"));
        TermDeclarator rvalue = store.termDeclarator(
                List.of(store.simpleIndirector(SimpleIndirector.Mode.MOVE)), id("r"));
        TermDeclarator member = store.termDeclarator(
                List.of(store.memberIndirector(name("C"), TypeQualifiers.NONE)), id("pm"));

        assertThat(printer.print(plain)).isEqualTo("*p");
        assertThat(printer.print(constPointer)).isEqualTo("* const p");
        assertThat(printer.print(rvalue)).isEqualTo("&&r");
        assertThat(printer.print(member)).isEqualTo("C::*pm");
    }

    @Test
    void testPrintPointerToFunction() {
        TermDeclarator inner = store.termDeclarator(
                List.of(store.simpleIndirector(SimpleIndirector.Mode.DEREF)), id("fp"));
        CallableSpecies call = store.callableSpecies(List.of(store.parenthesizedSpecies(inner)),
                store.parameters(List.of(name("int"), name("char"))));

        assertThat(printer.print(store.termDeclarator(List.of(), call))).isEqualTo("(*fp)(int, char)");
    }

    @Test
    void testPrintArrays() {
        assertThat(printer.print(store.arraySpecies(List.of(id("a")), OptionalRef.of(name("3")))))
                .isEqualTo("a[3]");
        assertThat(printer.print(store.arraySpecies(List.of(id("a")), OptionalRef.absent())))
                .isEqualTo("a[]");
    }

    @Test
    void testPrintQualifiedCallable() {
        Expr noexcept = name("noexcept");
        CallableSpecies method = store.callableSpecies(List.of(id("get")), store.parameters(List.of()),
                TypeQualifiers.CONST, BindingMode.REFERENCE, OptionalRef.of(noexcept));

        assertThat(printer.print(method)).isEqualTo("get() const & noexcept");
    }

    @Test
    void testPrintTrailingReturnType() {
        CallableSpecies call = store.callableSpecies(List.of(id("f")), store.parameters(List.of(name("int"))));

        assertThat(printer.print(store.targetedDeclarator(call, name("long")))).isEqualTo("f(int) -> long");
    }

    @Test
    void testPrintProclamators() {
        BasicAttribute unused = store.basicAttribute(identifier("maybe_unused"));
        TermDeclarator x = store.termDeclarator(List.of(), id("x"), List.of(unused));
        CallableSpecies call = store.callableSpecies(List.of(id("g")), store.parameters(List.of(name("T"))));
        TermDeclarator g = store.termDeclarator(List.of(), call);

        assertThat(printer.print(store.initializedProclamator(x, name("x"), OptionalRef.of(name("42")))))
                .isEqualTo("x [[maybe_unused]] = 42");
        assertThat(printer.print(store.initializedProclamator(x, name("x"), OptionalRef.absent())))
                .isEqualTo("x [[maybe_unused]]");
        assertThat(printer.print(store.constrainedProclamator(g, name("g"), name("C<T>"))))
                .isEqualTo("g(T) requires C<T>");
    }

    @Test
    void testIndirectorAttributes() {
        SimpleIndirector pointer = store.simpleIndirector(SimpleIndirector.Mode.DEREF, TypeQualifiers.VOLATILE,
                List.of(store.basicAttribute(identifier("aligned"))));

        assertThat(printer.print(store.termDeclarator(List.of(pointer), id("q"))))
                .isEqualTo("* [[aligned]] volatile q");
    }

    @Test
    void testUnbracketedConfigKeepsDeclaratorSpecifiers() {
        FormPrinter bare = new FormPrinter(SemanticRenderer.usingToString(),
                PrinterConfig.builder().bracketAttributes(false).build());
        BasicAttribute unused = store.basicAttribute(identifier("maybe_unused"));
        SimpleIndirector pointer = store.simpleIndirector(SimpleIndirector.Mode.DEREF, TypeQualifiers.NONE,
                List.of(store.basicAttribute(identifier("aligned"))));

        assertThat(bare.print(store.termDeclarator(List.of(), id("x"), List.of(unused))))
                .isEqualTo("x [[maybe_unused]]");
        assertThat(bare.print(store.termDeclarator(List.of(pointer), id("q"))))
                .isEqualTo("* [[aligned]] q");
        assertThat(bare.printAttributes(store.sequenceOf(unused))).isEqualTo("maybe_unused");
    }

    @Test
    void testIndirectorsPrintAheadOfCallable() {
        CallableSpecies call = store.callableSpecies(List.of(), store.parameters(List.of(name("int"))));
        TermDeclarator returnsPointer = store.termDeclarator(
                List.of(store.simpleIndirector(SimpleIndirector.Mode.DEREF)), call);

        assertThat(printer.print(returnsPointer)).isEqualTo("*(int)");
    }

    @Test
    void testPrintIndirectorAndSpeciesAlone() {
        SimpleIndirector reference = store.simpleIndirector(SimpleIndirector.Mode.BIND);
        CallableSpecies call = store.callableSpecies(List.of(id("h")), store.parameters(List.of()));

        assertThat(printer.print(reference)).isEqualTo("&");
        assertThat(printer.print(id("v"))).isEqualTo("v");
        assertThat(printer.print(call)).isEqualTo("h()");
    }
}
