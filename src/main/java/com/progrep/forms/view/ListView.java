package com.progrep.forms.view;

import lombok.NonNull;

import java.util.List;

/**
 * View over a {@link List}. The list is not copied; callers hand over a list
 * nobody mutates for as long as the view is in use.
 */
public final class ListView<T> extends IndexedView<T> {

    private final List<T> elements;

    public ListView(@NonNull List<T> elements) {
        this.elements = elements;
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    protected T get(int index) {
        return elements.get(index);
    }
}
