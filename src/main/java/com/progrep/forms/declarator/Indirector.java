package com.progrep.forms.declarator;

import com.progrep.forms.attribute.Attribute;
import com.progrep.forms.view.IndexedView;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * One ptr-operator of a declarator, written before the declared name.
 * Every indirector carries the attributes that appertain to it, possibly none.
 */
@Getter
@ToString
public abstract sealed class Indirector permits SimpleIndirector, MemberIndirector {
    private final IndexedView<Attribute> attributes;

    protected Indirector(@NonNull IndexedView<Attribute> attributes) {
        this.attributes = attributes;
    }

    public abstract void accept(IndirectorVisitor visitor);
}
