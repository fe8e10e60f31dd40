package com.tessera.modeling.compiler.parser;

import com.tessera.modeling.api.exceptions.ModelSyntaxException;
import com.tessera.modeling.compiler.lexer.Token;
import com.tessera.modeling.compiler.lexer.TokenType;

import java.util.List;

/**
 * Position in a token list, shared by the model and data parsers.
 */
final class TokenCursor {

    private final List<Token> tokens;
    private int pos;

    TokenCursor(List<Token> tokens) {
        this.tokens = tokens;
    }

    Token peek() {
        return tokens.get(pos);
    }

    Token peek(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    boolean at(TokenType type) {
        return peek().type() == type;
    }

    boolean atIdent(String text) {
        return at(TokenType.IDENT) && peek().text().equals(text);
    }

    boolean atEnd() {
        return at(TokenType.EOF);
    }

    Token advance() {
        Token token = tokens.get(pos);
        if (token.type() != TokenType.EOF) {
            pos++;
        }
        return token;
    }

    boolean match(TokenType type) {
        if (at(type)) {
            advance();
            return true;
        }
        return false;
    }

    Token expect(TokenType type) {
        if (!at(type)) {
            throw unexpected(type.describe());
        }
        return advance();
    }

    ModelSyntaxException unexpected(String expected) {
        Token token = peek();
        return new ModelSyntaxException("Unexpected " + token, token.location(), expected);
    }
}
