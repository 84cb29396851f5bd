package com.progrep.forms.declarator;

import com.progrep.forms.attribute.Attribute;
import com.progrep.forms.flags.TypeQualifiers;
import com.progrep.forms.semantic.ScopeRef;
import com.progrep.forms.view.IndexedView;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A pointer-to-member ptr-operator: {@code C::* const}. The scope is the class
 * the member belongs to.
 */
@Getter
@ToString(callSuper = true)
public final class MemberIndirector extends Indirector {
    private final ScopeRef scope;
    private final TypeQualifiers qualifiers;

    public MemberIndirector(@NonNull IndexedView<Attribute> attributes, @NonNull ScopeRef scope,
                            @NonNull TypeQualifiers qualifiers) {
        super(attributes);
        this.scope = scope;
        this.qualifiers = qualifiers;
    }

    @Override
    public void accept(IndirectorVisitor visitor) {
        visitor.visit(this);
    }
}
