package com.progrep.forms.flags;

/**
 * How the implicit object argument of a callable binds: the ref-qualifier of a
 * member function declarator.
 */
public enum BindingMode {
    /**
     * No ref-qualifier.
     */
    COPY(""),

    /**
     * {@code &}
     */
    REFERENCE("&"),

    /**
     * {@code &&}
     */
    MOVE("&&");

    private final String spelling;

    BindingMode(String spelling) {
        this.spelling = spelling;
    }

    public String getSpelling() {
        return spelling;
    }
}
