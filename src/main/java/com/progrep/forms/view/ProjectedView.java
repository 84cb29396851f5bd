package com.progrep.forms.view;

import lombok.NonNull;

import java.util.function.Function;

/**
 * Computed view: element {@code i} is {@code projection(source[i])}.
 * Nothing is cached; every read goes through the projection.
 *
 * @param <S> element type of the source view
 * @param <T> element type exposed by this view
 */
public final class ProjectedView<S, T> extends IndexedView<T> {

    private final IndexedView<S> source;
    private final Function<? super S, ? extends T> projection;

    public ProjectedView(@NonNull IndexedView<S> source, @NonNull Function<? super S, ? extends T> projection) {
        this.source = source;
        this.projection = projection;
    }

    @Override
    public int size() {
        return source.size();
    }

    @Override
    protected T get(int index) {
        return projection.apply(source.get(index));
    }
}
