package com.progrep.forms.declarator;

import com.progrep.forms.attribute.Attribute;
import com.progrep.forms.view.IndexedView;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A declarator, with the attributes that appertain to it.
 */
@Getter
@ToString
public abstract sealed class Declarator permits TermDeclarator, TargetedDeclarator {
    private final IndexedView<Attribute> attributes;

    protected Declarator(@NonNull IndexedView<Attribute> attributes) {
        this.attributes = attributes;
    }

    public abstract void accept(DeclaratorVisitor visitor);
}
