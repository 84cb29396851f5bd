package com.progrep.forms.lexical;

import lombok.NonNull;
import lombok.Value;

/**
 * Position of a lexeme in a source file.
 */
@Value
public class SourceLocation {
    @NonNull
    String file;
    int line;
    int column;

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
