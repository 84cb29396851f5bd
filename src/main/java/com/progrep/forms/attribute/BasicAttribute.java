package com.progrep.forms.attribute;

import com.progrep.forms.lexical.Token;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * An attribute written as a single token: {@code [[noreturn]]}.
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class BasicAttribute extends Attribute {
    @NonNull
    private final Token token;

    @Override
    public void accept(AttributeVisitor visitor) {
        visitor.visit(this);
    }
}
