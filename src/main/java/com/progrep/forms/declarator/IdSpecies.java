package com.progrep.forms.declarator;

import com.progrep.forms.semantic.Expr;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * The declared name itself. The name expression may be a pack expansion
 * ({@code ...args}).
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class IdSpecies extends SpeciesDeclarator {
    @NonNull
    private final Expr name;

    @Override
    public void accept(SpeciesVisitor visitor) {
        visitor.visit(this);
    }
}
