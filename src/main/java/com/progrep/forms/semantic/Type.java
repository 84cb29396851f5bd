package com.progrep.forms.semantic;

/**
 * A type of the semantic layer.
 */
public interface Type extends Expr {
}
