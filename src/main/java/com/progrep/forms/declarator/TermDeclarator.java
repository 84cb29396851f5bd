package com.progrep.forms.declarator;

import com.progrep.forms.attribute.Attribute;
import com.progrep.forms.view.IndexedView;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * The general declarator: zero or more indirectors applied, left to right, to
 * one species. {@code * const & x[4]} is a term.
 */
@Getter
@ToString(callSuper = true)
public final class TermDeclarator extends Declarator {
    private final IndexedView<Indirector> indirectors;
    private final SpeciesDeclarator species;

    public TermDeclarator(@NonNull IndexedView<Attribute> attributes, @NonNull IndexedView<Indirector> indirectors,
                          @NonNull SpeciesDeclarator species) {
        super(attributes);
        this.indirectors = indirectors;
        this.species = species;
    }

    @Override
    public void accept(DeclaratorVisitor visitor) {
        visitor.visit(this);
    }
}
