package com.progrep.forms.semantic;

/**
 * Reference to a scope, e.g. the class {@code C} in {@code C::*}.
 */
public interface ScopeRef extends Expr {
}
