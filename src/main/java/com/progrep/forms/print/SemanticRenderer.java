package com.progrep.forms.print;

import com.progrep.forms.semantic.Expr;

/**
 * Source text for the semantic entities a form refers to. The semantic layer
 * supplies one; forms cannot spell expressions, types or declarations
 * themselves.
 */
@FunctionalInterface
public interface SemanticRenderer {

    String render(Expr expr);

    /**
     * Renders every entity with its {@code toString()}.
     */
    static SemanticRenderer usingToString() {
        return String::valueOf;
    }
}
