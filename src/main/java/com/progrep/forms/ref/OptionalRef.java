package com.progrep.forms.ref;

import com.progrep.forms.exception.EmptyReferenceException;
import lombok.NonNull;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * A non-owning reference that may be absent.
 *
 * Unlike {@link Optional} there is no fallback value: reading an absent
 * reference with {@link #get()} is an error. Callers branch on
 * {@link #isValid()} first.
 *
 * Two construction paths exist. {@link #ofNullable(Object)} takes a handle that
 * may be null and yields an absent reference for null. {@link #of(Object)}
 * takes a reference that must be present and rejects null on the spot.
 *
 * @param <T> type of the referenced element
 */
public final class OptionalRef<T> {

    private static final OptionalRef<?> ABSENT = new OptionalRef<>(null);

    private final T referent;

    private OptionalRef(T referent) {
        this.referent = referent;
    }

    @SuppressWarnings("unchecked")
    public static <T> OptionalRef<T> absent() {
        return (OptionalRef<T>) ABSENT;
    }

    public static <T> OptionalRef<T> ofNullable(T handle) {
        return handle == null ? absent() : new OptionalRef<>(handle);
    }

    public static <T> OptionalRef<T> of(@NonNull T reference) {
        return new OptionalRef<>(reference);
    }

    /**
     * Widens a reference to a base type. Absent stays absent; a present
     * reference keeps pointing at the same object.
     */
    @SuppressWarnings("unchecked")
    public static <B, D extends B> OptionalRef<B> widen(OptionalRef<D> ref) {
        return (OptionalRef<B>) ref;
    }

    public boolean isValid() {
        return referent != null;
    }

    /**
     * @throws EmptyReferenceException if the reference is absent
     */
    public T get() {
        if (referent == null) {
            throw new EmptyReferenceException();
        }
        return referent;
    }

    public void ifValid(Consumer<? super T> action) {
        if (referent != null) {
            action.accept(referent);
        }
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(referent);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof OptionalRef<?> other && referent == other.referent;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(referent);
    }

    @Override
    public String toString() {
        return referent == null ? "OptionalRef.absent" : "OptionalRef[" + referent + "]";
    }
}
