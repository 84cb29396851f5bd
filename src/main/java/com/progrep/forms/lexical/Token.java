package com.progrep.forms.lexical;

import lombok.NonNull;
import lombok.Value;

/**
 * A token handed over by the lexer. Forms only reference tokens; they never
 * create or change them.
 */
@Value
public class Token {
    @NonNull
    Lexeme lexeme;
    @NonNull
    TokenType type;

    public enum TokenType {
        IDENTIFIER,
        KEYWORD,
        INTEGER_LITERAL,
        FLOATING_LITERAL,
        CHARACTER_LITERAL,
        STRING_LITERAL,
        PUNCTUATOR,
        OPERATOR,
        UNKNOWN
    }

    public String getSpelling() {
        return lexeme.getSpelling();
    }

    public SourceLocation getLocation() {
        return lexeme.getLocation();
    }

    public boolean isLiteral() {
        return type == TokenType.INTEGER_LITERAL || type == TokenType.FLOATING_LITERAL ||
               type == TokenType.CHARACTER_LITERAL || type == TokenType.STRING_LITERAL;
    }
}
