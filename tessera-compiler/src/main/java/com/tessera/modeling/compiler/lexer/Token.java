package com.tessera.modeling.compiler.lexer;

import com.tessera.modeling.api.exceptions.SourceLocation;

/**
 * A lexical token. {@code number} is only meaningful for {@link TokenType#NUMBER}.
 */
public record Token(TokenType type, String text, double number, int line, int column) {

    public SourceLocation location() {
        return new SourceLocation(line, column);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
