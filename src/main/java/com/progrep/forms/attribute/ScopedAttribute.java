package com.progrep.forms.attribute;

import com.progrep.forms.lexical.Token;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * An attribute qualified by an attribute namespace: {@code [[gnu::unused]]}.
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class ScopedAttribute extends Attribute {
    @NonNull
    private final Token scope;
    @NonNull
    private final Token member;

    @Override
    public void accept(AttributeVisitor visitor) {
        visitor.visit(this);
    }
}
