package com.progrep.forms.lexical;

import lombok.NonNull;
import lombok.Value;

/**
 * A piece of source text and where it was read.
 */
@Value
public class Lexeme {
    @NonNull
    String spelling;
    @NonNull
    SourceLocation location;
}
