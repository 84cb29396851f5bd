package com.progrep.forms.view;

import lombok.Getter;

/**
 * A position in an {@link IndexedView}: the view it belongs to and an index.
 *
 * Positions are immutable. {@link #next()} and {@link #previous()} do not check
 * bounds; only {@link #get()} does. Two positions are equal when they refer to
 * the same view instance and carry the same index.
 *
 * @param <T> element type of the view
 */
@Getter
public final class ViewIterator<T> {

    private final IndexedView<T> view;
    private final int index;

    ViewIterator(IndexedView<T> view, int index) {
        this.view = view;
        this.index = index;
    }

    /**
     * Element at this position.
     *
     * @throws com.progrep.forms.exception.ViewIndexOutOfRangeException if the index is outside {@code [0, size())}
     */
    public T get() {
        return view.read(index);
    }

    public ViewIterator<T> next() {
        return new ViewIterator<>(view, index + 1);
    }

    public ViewIterator<T> previous() {
        return new ViewIterator<>(view, index - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ViewIterator<?> other)) {
            return false;
        }
        return view == other.view && index == other.index;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(view) + index;
    }

    @Override
    public String toString() {
        return "ViewIterator(index=" + index + ", size=" + view.size() + ")";
    }
}
