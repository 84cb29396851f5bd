package com.progrep.forms.flags;

/**
 * Base for immutable bit-set values with named combinators.
 *
 * Subclasses fix the meaning of each bit and supply {@link #withMask(int)} so
 * that combinators return the subclass type. Values of different subclasses
 * never compare equal, even when their masks match.
 *
 * @param <F> concrete flag type
 */
public abstract class BitFlags<F extends BitFlags<F>> {

    private final int mask;

    protected BitFlags(int mask) {
        this.mask = mask;
    }

    protected abstract F withMask(int mask);

    public int getMask() {
        return mask;
    }

    public F or(F other) {
        return withMask(mask | other.getMask());
    }

    public F and(F other) {
        return withMask(mask & other.getMask());
    }

    public F xor(F other) {
        return withMask(mask ^ other.getMask());
    }

    /**
     * True when every bit set in {@code other} is also set here.
     */
    public boolean implies(F other) {
        return (mask & other.getMask()) == other.getMask();
    }

    /**
     * True when at least one bit of {@code other} is set here.
     */
    public boolean contains(F other) {
        return (mask & other.getMask()) != 0;
    }

    public boolean isEmpty() {
        return mask == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o != null && o.getClass() == getClass() && ((BitFlags<?>) o).mask == mask;
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + mask;
    }
}
