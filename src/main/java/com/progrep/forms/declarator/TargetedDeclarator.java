package com.progrep.forms.declarator;

import com.progrep.forms.attribute.Attribute;
import com.progrep.forms.semantic.Type;
import com.progrep.forms.view.IndexedView;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A declarator with a trailing return type: {@code f(int) -> long}.
 *
 * The callable species comes first and the target type follows it. A targeted
 * declarator has no indirectors; the target type stands where they would be.
 */
@Getter
@ToString(callSuper = true)
public final class TargetedDeclarator extends Declarator {
    private final CallableSpecies species;
    private final Type target;

    public TargetedDeclarator(@NonNull IndexedView<Attribute> attributes, @NonNull CallableSpecies species,
                              @NonNull Type target) {
        super(attributes);
        this.species = species;
        this.target = target;
    }

    @Override
    public void accept(DeclaratorVisitor visitor) {
        visitor.visit(this);
    }
}
