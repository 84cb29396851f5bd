package com.progrep.forms.attribute;

import com.progrep.forms.lexical.Token;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A pack expansion of an attribute: {@code attribute ...}. The expander is the
 * ellipsis token.
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class ExpandedAttribute extends Attribute {
    @NonNull
    private final Token expander;
    @NonNull
    private final Attribute operand;

    @Override
    public void accept(AttributeVisitor visitor) {
        visitor.visit(this);
    }
}
