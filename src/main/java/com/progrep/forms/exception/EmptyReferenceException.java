package com.progrep.forms.exception;

/**
 * Raised when an absent {@link com.progrep.forms.ref.OptionalRef} is dereferenced.
 */
public class EmptyReferenceException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

    public EmptyReferenceException() {
        super("Access to an absent reference");
    }
}
