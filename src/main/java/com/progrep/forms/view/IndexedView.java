package com.progrep.forms.view;

import com.progrep.forms.exception.ViewIndexOutOfRangeException;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Read-only, ordered, indexed sequence of elements.
 *
 * A view owns nothing: it reads through to a backing store (a list, an array,
 * a computed projection) that must outlive the view and every position taken
 * from it. Valid element indices are exactly {@code [0, size())}; elements are
 * reached through {@link #position(int)}, {@link #begin()} and {@link #end()},
 * or through plain iteration.
 *
 * @param <T> element type
 */
public abstract class IndexedView<T> implements Iterable<T> {

    /**
     * Number of elements in the view.
     */
    public abstract int size();

    /**
     * Element at {@code index}. Only called with an index already checked
     * against {@link #size()}.
     */
    protected abstract T get(int index);

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Position of the element at {@code index}. {@code index == size()} is the
     * one-past-the-last sentinel and is accepted; it must never be dereferenced.
     *
     * @throws ViewIndexOutOfRangeException if {@code index} is negative or greater than {@link #size()}
     */
    public ViewIterator<T> position(int index) {
        int size = size();
        if (index < 0 || index > size) {
            throw new ViewIndexOutOfRangeException(index, size);
        }
        return new ViewIterator<>(this, index);
    }

    public ViewIterator<T> begin() {
        return position(0);
    }

    public ViewIterator<T> end() {
        return position(size());
    }

    /**
     * Checked read used by positions.
     */
    final T read(int index) {
        int size = size();
        if (index < 0 || index >= size) {
            throw new ViewIndexOutOfRangeException(index, size);
        }
        return get(index);
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private ViewIterator<T> current = begin();
            private final ViewIterator<T> last = end();

            @Override
            public boolean hasNext() {
                return !current.equals(last);
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                T element = current.get();
                current = current.next();
                return element;
            }
        };
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (ViewIterator<T> it = begin(); !it.equals(end()); it = it.next()) {
            if (it.getIndex() > 0) {
                sb.append(", ");
            }
            sb.append(it.get());
        }
        return sb.append(']').toString();
    }
}
