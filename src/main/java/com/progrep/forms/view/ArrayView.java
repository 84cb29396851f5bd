package com.progrep.forms.view;

import lombok.NonNull;

/**
 * View over an array, or over a slice of one.
 */
public final class ArrayView<T> extends IndexedView<T> {

    private final T[] elements;
    private final int offset;
    private final int length;

    public ArrayView(@NonNull T[] elements) {
        this(elements, 0, elements.length);
    }

    public ArrayView(@NonNull T[] elements, int offset, int length) {
        if (offset < 0 || length < 0 || offset > elements.length - length) {
            throw new IllegalArgumentException(
                    "Slice [" + offset + ", " + offset + "+" + length + ") does not fit an array of length " + elements.length);
        }
        this.elements = elements;
        this.offset = offset;
        this.length = length;
    }

    @Override
    public int size() {
        return length;
    }

    @Override
    protected T get(int index) {
        return elements[offset + index];
    }
}
