package com.progrep.forms.ref;

import com.progrep.forms.FormFixtures;
import com.progrep.forms.FormFixtures.Name;
import com.progrep.forms.exception.EmptyReferenceException;
import com.progrep.forms.semantic.Expr;
import com.progrep.forms.semantic.Type;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OptionalRef.
 */
class OptionalRefTest {

    @Test
    void testAbsentReference() {
        OptionalRef<Expr> ref = OptionalRef.absent();

        assertThat(ref.isValid()).isFalse();
        assertThat(ref.toOptional()).isEmpty();
        assertThatThrownBy(ref::get).isInstanceOf(EmptyReferenceException.class);
    }

    @Test
    void testNullHandleIsAbsent() {
        OptionalRef<Expr> ref = OptionalRef.ofNullable(null);

        assertThat(ref.isValid()).isFalse();
        assertThat(ref).isEqualTo(OptionalRef.absent());
    }

    @Test
    void testPresentReferenceKeepsIdentity() {
        Name x = FormFixtures.name("x");
        OptionalRef<Name> byHandle = OptionalRef.ofNullable(x);
        OptionalRef<Name> byReference = OptionalRef.of(x);

        assertThat(byHandle.isValid()).isTrue();
        assertThat(byHandle.get()).isSameAs(x);
        assertThat(byReference.get()).isSameAs(x);
        assertThat(byHandle).isEqualTo(byReference);
    }

    @Test
    void testReferencePathRejectsNull() {
        assertThatThrownBy(() -> OptionalRef.of(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void testEqualityIsByIdentity() {
        Name first = FormFixtures.name("x");
        Name second = FormFixtures.name("x");

        assertThat(OptionalRef.of(first)).isNotEqualTo(OptionalRef.of(second));
    }

    @Test
    void testWideningPreservesValidity() {
        Name type = FormFixtures.name("int");
        OptionalRef<Name> present = OptionalRef.of(type);
        OptionalRef<Name> absent = OptionalRef.absent();

        OptionalRef<Type> widenedPresent = OptionalRef.widen(present);
        OptionalRef<Expr> widenedTwice = OptionalRef.widen(widenedPresent);
        OptionalRef<Expr> widenedAbsent = OptionalRef.widen(absent);

        assertThat(widenedPresent.get()).isSameAs(type);
        assertThat(widenedTwice.get()).isSameAs(type);
        assertThat(widenedAbsent.isValid()).isFalse();
    }

    @Test
    void testIfValid() {
        List<Expr> seen = new ArrayList<>();
        Name x = FormFixtures.name("x");

        OptionalRef.<Expr>absent().ifValid(seen::add);
        OptionalRef.<Expr>of(x).ifValid(seen::add);

        assertThat(seen).containsExactly(x);
    }
}
