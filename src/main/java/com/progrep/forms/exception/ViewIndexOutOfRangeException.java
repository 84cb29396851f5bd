package com.progrep.forms.exception;

/**
 * Raised when a view or one of its positions is read outside the range the view allows.
 */
public class ViewIndexOutOfRangeException extends IndexOutOfBoundsException {

	private static final long serialVersionUID = 1L;
	private final int index;
	private final int size;

    public ViewIndexOutOfRangeException(int index, int size) {
        super("Index " + index + " out of range for view of size " + size);
        this.index = index;
        this.size = size;
    }

    public int getIndex() {
        return index;
    }

    public int getSize() {
        return size;
    }
}
