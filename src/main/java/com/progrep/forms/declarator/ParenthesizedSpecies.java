package com.progrep.forms.declarator;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A term declarator in parentheses, written only to override the default
 * binding of ptr-operators: the {@code (*fp)} in {@code int (*fp)(int)}.
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class ParenthesizedSpecies extends SpeciesDeclarator {
    @NonNull
    private final TermDeclarator term;

    @Override
    public void accept(SpeciesVisitor visitor) {
        visitor.visit(this);
    }
}
