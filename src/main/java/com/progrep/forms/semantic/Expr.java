package com.progrep.forms.semantic;

/**
 * An expression of the semantic layer. Forms hold expressions by reference and
 * rely on nothing but their identity.
 */
public interface Expr {
}
