package com.progrep.forms.flags;

import java.util.ArrayList;
import java.util.List;

/**
 * cv-qualifiers and {@code restrict}, as attached to a type, a member
 * indirector or a callable species.
 */
public final class TypeQualifiers extends BitFlags<TypeQualifiers> {

    public static final TypeQualifiers NONE = new TypeQualifiers(0);
    public static final TypeQualifiers CONST = new TypeQualifiers(0x1);
    public static final TypeQualifiers VOLATILE = new TypeQualifiers(0x2);
    public static final TypeQualifiers RESTRICT = new TypeQualifiers(0x4);

    private static final int ALL_BITS = 0x7;

    private TypeQualifiers(int mask) {
        super(mask);
    }

    public static TypeQualifiers fromMask(int mask) {
        if ((mask & ~ALL_BITS) != 0) {
            throw new IllegalArgumentException("Unknown qualifier bits: 0x" + Integer.toHexString(mask & ~ALL_BITS));
        }
        return new TypeQualifiers(mask);
    }

    @Override
    protected TypeQualifiers withMask(int mask) {
        return fromMask(mask);
    }

    /**
     * Source spelling, e.g. {@code "const volatile"}. Empty for {@link #NONE}.
     */
    public String spelling() {
        List<String> words = new ArrayList<>();
        if (implies(CONST)) words.add("const");
        if (implies(VOLATILE)) words.add("volatile");
        if (implies(RESTRICT)) words.add("restrict");
        return String.join(" ", words);
    }

    @Override
    public String toString() {
        return isEmpty() ? "TypeQualifiers(none)" : "TypeQualifiers(" + spelling() + ")";
    }
}
