package com.progrep.forms.attribute;

import com.progrep.forms.lexical.Token;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * An attribute preceded by a label: {@code label: attribute}.
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class LabeledAttribute extends Attribute {
    @NonNull
    private final Token label;
    @NonNull
    private final Attribute attribute;

    @Override
    public void accept(AttributeVisitor visitor) {
        visitor.visit(this);
    }
}
