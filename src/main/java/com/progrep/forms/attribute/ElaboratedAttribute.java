package com.progrep.forms.attribute;

import com.progrep.forms.semantic.Expr;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * An attribute whose meaning has been fully elaborated into a semantic
 * expression.
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class ElaboratedAttribute extends Attribute {
    @NonNull
    private final Expr expression;

    @Override
    public void accept(AttributeVisitor visitor) {
        visitor.visit(this);
    }
}
