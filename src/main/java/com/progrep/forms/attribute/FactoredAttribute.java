package com.progrep.forms.attribute;

import com.progrep.forms.lexical.Token;
import com.progrep.forms.view.IndexedView;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * An attribute list with a factored namespace:
 * {@code [[using gnu: hot, always_inline]]}. The factor is the namespace token,
 * the terms are the attributes it applies to, in source order.
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class FactoredAttribute extends Attribute {
    @NonNull
    private final Token factor;
    @NonNull
    private final IndexedView<Attribute> terms;

    @Override
    public void accept(AttributeVisitor visitor) {
        visitor.visit(this);
    }
}
