package com.progrep.forms.semantic;

/**
 * A declaration of the semantic layer, as introduced by a proclamator.
 */
public interface Decl extends Expr {
}
