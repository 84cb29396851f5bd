package com.progrep.forms.declarator;

import com.progrep.forms.ref.OptionalRef;
import com.progrep.forms.semantic.Expr;
import com.progrep.forms.view.IndexedView;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * An array declarator suffix: {@code prefix [ bound ]}. The bound is absent for
 * arrays of unknown bound.
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class ArraySpecies extends SpeciesDeclarator {
    @NonNull
    private final IndexedView<SpeciesDeclarator> prefix;
    @NonNull
    private final OptionalRef<Expr> bound;

    @Override
    public void accept(SpeciesVisitor visitor) {
        visitor.visit(this);
    }
}
