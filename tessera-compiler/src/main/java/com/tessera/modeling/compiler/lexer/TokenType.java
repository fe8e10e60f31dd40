package com.tessera.modeling.compiler.lexer;

public enum TokenType {
    IDENT,
    NUMBER,
    STRING,

    // Keywords
    KW_SET("set"),
    KW_PARAM("param"),
    KW_VAR("var"),
    KW_SUBJECT_TO("s.t."),
    KW_MAXIMIZE("maximize"),
    KW_MINIMIZE("minimize"),
    KW_SOLVE("solve"),
    KW_END("end"),
    KW_DATA("data"),
    KW_IN("in"),
    KW_INTEGER("integer"),
    KW_BINARY("binary"),
    KW_SYMBOLIC("symbolic"),
    KW_DEFAULT("default"),
    KW_DIMEN("dimen"),
    KW_SUM("sum"),
    KW_IF("if"),
    KW_THEN("then"),
    KW_ELSE("else"),
    KW_AND("and"),
    KW_OR("or"),
    KW_NOT("not"),
    KW_UNION("union"),
    KW_DIFF("diff"),
    KW_INTER("inter"),
    KW_CROSS("cross"),
    KW_BY("by"),
    KW_MOD("mod"),
    KW_DIV("div"),

    // Punctuation and operators
    LBRACE("{"),
    RBRACE("}"),
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    COMMA(","),
    SEMICOLON(";"),
    COLON(":"),
    ASSIGN(":="),
    EQ("="),
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    CARET("^"),
    DOTDOT(".."),
    DOT("."),

    EOF("end of input");

    private final String display;

    TokenType() {
        this.display = null;
    }

    TokenType(String display) {
        this.display = display;
    }

    /**
     * Human-readable form used in "expected ..." diagnostics.
     */
    public String describe() {
        if (display == null) {
            return name().toLowerCase();
        }
        return this == EOF ? display : "'" + display + "'";
    }

    public boolean isKeyword() {
        return name().startsWith("KW_");
    }
}
