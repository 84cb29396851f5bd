package com.progrep.forms.flags;

/**
 * Translation stages, used by upper layers to say when a construct is
 * meaningful or was produced.
 */
public final class Phases extends BitFlags<Phases> {

    public static final Phases UNKNOWN = new Phases(0);
    public static final Phases READING = new Phases(1 << 0);
    public static final Phases LEXING = new Phases(1 << 1);
    public static final Phases PREPROCESSING = new Phases(1 << 2);
    public static final Phases PARSING = new Phases(1 << 3);
    public static final Phases NAME_RESOLUTION = new Phases(1 << 4);
    public static final Phases TYPING = new Phases(1 << 5);
    public static final Phases EVALUATION = new Phases(1 << 6);
    public static final Phases INSTANTIATION = new Phases(1 << 7);
    public static final Phases CODE_GENERATION = new Phases(1 << 8);
    public static final Phases LINKING = new Phases(1 << 9);
    public static final Phases LOADING = new Phases(1 << 10);
    public static final Phases EXECUTION = new Phases(1 << 11);

    public static final Phases ELABORATION =
            NAME_RESOLUTION.or(TYPING).or(EVALUATION).or(INSTANTIATION);
    public static final Phases ALL = new Phases(~0);

    private Phases(int mask) {
        super(mask);
    }

    public static Phases fromMask(int mask) {
        return new Phases(mask);
    }

    @Override
    protected Phases withMask(int mask) {
        return new Phases(mask);
    }

    @Override
    public String toString() {
        return "Phases(0x" + Integer.toHexString(getMask()) + ")";
    }
}
