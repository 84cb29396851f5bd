package com.progrep.forms.view;

/**
 * The view with no elements.
 */
public final class EmptyView<T> extends IndexedView<T> {

    private static final EmptyView<?> INSTANCE = new EmptyView<>();

    private EmptyView() {
    }

    @SuppressWarnings("unchecked")
    public static <T> EmptyView<T> instance() {
        return (EmptyView<T>) INSTANCE;
    }

    @Override
    public int size() {
        return 0;
    }

    @Override
    protected T get(int index) {
        throw new IllegalStateException("Empty view has no element " + index);
    }
}
