package com.progrep.forms.attribute;

import com.progrep.forms.view.IndexedView;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * An attribute with an argument clause: {@code [[deprecated("use g")]]}.
 * Arguments are kept in source order.
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class CalledAttribute extends Attribute {
    @NonNull
    private final Attribute function;
    @NonNull
    private final IndexedView<Attribute> arguments;

    @Override
    public void accept(AttributeVisitor visitor) {
        visitor.visit(this);
    }
}
