package com.tessera.modeling.compiler.lexer;

import com.tessera.modeling.api.exceptions.ModelSyntaxException;
import com.tessera.modeling.api.exceptions.SourceLocation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns model or data text into tokens. Block comments {@code /* ... *}{@code /} and line
 * comments starting with {@code #} are discarded.
 */
public final class Lexer {

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : TokenType.values()) {
            if (type.isKeyword() && type != TokenType.KW_SUBJECT_TO) {
                KEYWORDS.put(type.describe().replace("'", ""), type);
            }
        }
        KEYWORDS.put("maximise", TokenType.KW_MAXIMIZE);
        KEYWORDS.put("minimise", TokenType.KW_MINIMIZE);
    }

    private final String text;
    private int pos;
    private int line = 1;
    private int column = 1;

    public Lexer(String text) {
        this.text = text;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= text.length()) {
                tokens.add(new Token(TokenType.EOF, "", 0, line, column));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int startLine = line;
        int startColumn = column;
        char c = text.charAt(pos);

        if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
            return number(startLine, startColumn);
        }
        if (Character.isLetter(c) || c == '_') {
            return word(startLine, startColumn);
        }
        if (c == '\'' || c == '"') {
            return string(c, startLine, startColumn);
        }

        switch (c) {
            case '{': return symbol(TokenType.LBRACE, 1, startLine, startColumn);
            case '}': return symbol(TokenType.RBRACE, 1, startLine, startColumn);
            case '(': return symbol(TokenType.LPAREN, 1, startLine, startColumn);
            case ')': return symbol(TokenType.RPAREN, 1, startLine, startColumn);
            case '[': return symbol(TokenType.LBRACKET, 1, startLine, startColumn);
            case ']': return symbol(TokenType.RBRACKET, 1, startLine, startColumn);
            case ',': return symbol(TokenType.COMMA, 1, startLine, startColumn);
            case ';': return symbol(TokenType.SEMICOLON, 1, startLine, startColumn);
            case '+': return symbol(TokenType.PLUS, 1, startLine, startColumn);
            case '-': return symbol(TokenType.MINUS, 1, startLine, startColumn);
            case '/': return symbol(TokenType.SLASH, 1, startLine, startColumn);
            case '^': return symbol(TokenType.CARET, 1, startLine, startColumn);
            case '*':
                return peekIs(1, '*')
                        ? symbol(TokenType.CARET, 2, startLine, startColumn)
                        : symbol(TokenType.STAR, 1, startLine, startColumn);
            case ':':
                return peekIs(1, '=')
                        ? symbol(TokenType.ASSIGN, 2, startLine, startColumn)
                        : symbol(TokenType.COLON, 1, startLine, startColumn);
            case '=':
                return peekIs(1, '=')
                        ? symbol(TokenType.EQ, 2, startLine, startColumn)
                        : symbol(TokenType.EQ, 1, startLine, startColumn);
            case '<':
                if (peekIs(1, '=')) return symbol(TokenType.LE, 2, startLine, startColumn);
                if (peekIs(1, '>')) return symbol(TokenType.NE, 2, startLine, startColumn);
                return symbol(TokenType.LT, 1, startLine, startColumn);
            case '>':
                return peekIs(1, '=')
                        ? symbol(TokenType.GE, 2, startLine, startColumn)
                        : symbol(TokenType.GT, 1, startLine, startColumn);
            case '!':
                return peekIs(1, '=')
                        ? symbol(TokenType.NE, 2, startLine, startColumn)
                        : symbol(TokenType.KW_NOT, 1, startLine, startColumn);
            case '&':
                if (peekIs(1, '&')) return symbol(TokenType.KW_AND, 2, startLine, startColumn);
                break;
            case '|':
                if (peekIs(1, '|')) return symbol(TokenType.KW_OR, 2, startLine, startColumn);
                break;
            case '.':
                return peekIs(1, '.')
                        ? symbol(TokenType.DOTDOT, 2, startLine, startColumn)
                        : symbol(TokenType.DOT, 1, startLine, startColumn);
            default:
                break;
        }
        throw new ModelSyntaxException("Unexpected character '" + c + "'", new SourceLocation(startLine, startColumn));
    }

    private Token number(int startLine, int startColumn) {
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) advance();
        // A '.' only belongs to the number when a digit follows, so "1..n" lexes as 1 .. n
        if (peekIs(0, '.') && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1))) {
            advance();
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) advance();
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int save = pos;
            int offset = 1;
            if (peekIs(1, '+') || peekIs(1, '-')) offset = 2;
            if (pos + offset < text.length() && Character.isDigit(text.charAt(pos + offset))) {
                for (int i = 0; i < offset; i++) advance();
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) advance();
            } else {
                pos = save;
            }
        }
        String literal = text.substring(start, pos);
        return new Token(TokenType.NUMBER, literal, Double.parseDouble(literal), startLine, startColumn);
    }

    private Token word(int startLine, int startColumn) {
        // "s.t." is the only keyword containing dots
        if (text.startsWith("s.t.", pos) && (pos + 4 >= text.length() || !isWordChar(text.charAt(pos + 4)))) {
            for (int i = 0; i < 4; i++) advance();
            return new Token(TokenType.KW_SUBJECT_TO, "s.t.", 0, startLine, startColumn);
        }
        int start = pos;
        while (pos < text.length() && isWordChar(text.charAt(pos))) advance();
        String word = text.substring(start, pos);
        if (word.equals("Infinity")) {
            return new Token(TokenType.NUMBER, word, Double.POSITIVE_INFINITY, startLine, startColumn);
        }
        TokenType keyword = KEYWORDS.get(word);
        return new Token(keyword != null ? keyword : TokenType.IDENT, word, 0, startLine, startColumn);
    }

    private Token string(char quote, int startLine, int startColumn) {
        StringBuilder value = new StringBuilder();
        advance();
        while (true) {
            if (pos >= text.length() || text.charAt(pos) == '\n') {
                throw new ModelSyntaxException("Unterminated string literal", new SourceLocation(startLine, startColumn));
            }
            char c = text.charAt(pos);
            if (c == quote) {
                if (peekIs(1, quote)) {
                    value.append(quote);
                    advance();
                    advance();
                    continue;
                }
                advance();
                return new Token(TokenType.STRING, value.toString(), 0, startLine, startColumn);
            }
            value.append(c);
            advance();
        }
    }

    private Token symbol(TokenType type, int length, int startLine, int startColumn) {
        String literal = text.substring(pos, pos + length);
        for (int i = 0; i < length; i++) advance();
        return new Token(type, literal, 0, startLine, startColumn);
    }

    private void skipWhitespaceAndComments() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '#') {
                while (pos < text.length() && text.charAt(pos) != '\n') advance();
            } else if (c == '/' && peekIs(1, '*')) {
                SourceLocation start = new SourceLocation(line, column);
                advance();
                advance();
                while (!(peekIs(0, '*') && peekIs(1, '/'))) {
                    if (pos >= text.length()) {
                        throw new ModelSyntaxException("Unterminated block comment", start, "'*/'");
                    }
                    advance();
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private boolean peekIs(int offset, char expected) {
        return pos + offset < text.length() && text.charAt(pos + offset) == expected;
    }

    private void advance() {
        if (text.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }
}
