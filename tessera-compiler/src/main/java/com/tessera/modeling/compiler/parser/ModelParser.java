package com.tessera.modeling.compiler.parser;

import com.tessera.modeling.api.exceptions.ModelSyntaxException;
import com.tessera.modeling.api.model.ObjectiveDirection;
import com.tessera.modeling.api.model.RowSense;
import com.tessera.modeling.api.model.VariableDomain;
import com.tessera.modeling.compiler.ast.DataSection;
import com.tessera.modeling.compiler.ast.Declaration;
import com.tessera.modeling.compiler.ast.Declaration.Check;
import com.tessera.modeling.compiler.ast.Expr;
import com.tessera.modeling.compiler.ast.Expr.BinaryOp;
import com.tessera.modeling.compiler.ast.Indexing;
import com.tessera.modeling.compiler.ast.ModelDeclarations;
import com.tessera.modeling.compiler.ast.SetExpr;
import com.tessera.modeling.compiler.lexer.Lexer;
import com.tessera.modeling.compiler.lexer.Token;
import com.tessera.modeling.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the model section of the modeling language.
 *
 * <p>Operator precedence, lowest first: {@code or}, {@code and}, {@code not}, comparisons
 * and {@code in}, {@code + -}, {@code * / mod div}, unary sign, {@code ^} (right associative).
 * An iterated {@code sum} binds its body at the multiplicative level, so
 * {@code sum{i in I} c[i] * x[i] + y} sums only the product.
 *
 * <p>The parser is single-use and not thread-safe.
 */
public final class ModelParser {

    private final TokenCursor in;
    private final List<Declaration> declarations = new ArrayList<>();
    private Token objectiveToken;

    private ModelParser(String text) {
        this.in = new TokenCursor(new Lexer(text).tokenize());
    }

    /**
     * Parses model text, including a trailing {@code data;} block when present.
     *
     * @throws ModelSyntaxException on the first syntax error
     */
    public static ModelDeclarations parse(String modelText) {
        return new ModelParser(modelText).parseModel();
    }

    /**
     * Parses a standalone data text. The leading {@code data;} and trailing {@code end;} are optional.
     */
    public static DataSection parseData(String dataText) {
        TokenCursor cursor = new TokenCursor(new Lexer(dataText).tokenize());
        if (cursor.match(TokenType.KW_DATA)) {
            cursor.expect(TokenType.SEMICOLON);
        }
        return new DataSectionParser(cursor).parse();
    }

    private ModelDeclarations parseModel() {
        DataSection data = DataSection.EMPTY;
        while (!in.atEnd()) {
            Token token = in.peek();
            switch (token.type()) {
                case KW_SET -> parseSet();
                case KW_PARAM -> parseParam();
                case KW_VAR -> parseVar();
                case KW_SUBJECT_TO -> {
                    in.advance();
                    parseConstraint();
                }
                case KW_MAXIMIZE -> parseObjective(ObjectiveDirection.MAXIMIZE);
                case KW_MINIMIZE -> parseObjective(ObjectiveDirection.MINIMIZE);
                case KW_SOLVE -> {
                    in.advance();
                    in.expect(TokenType.SEMICOLON);
                }
                case KW_DATA -> {
                    in.advance();
                    in.expect(TokenType.SEMICOLON);
                    data = new DataSectionParser(in).parse();
                }
                case KW_END -> {
                    in.advance();
                    in.match(TokenType.SEMICOLON);
                    return new ModelDeclarations(declarations, data);
                }
                case IDENT -> {
                    if (token.text().equals("subject") && in.peek(1).type() == TokenType.IDENT
                            && in.peek(1).text().equals("to")) {
                        in.advance();
                        in.advance();
                        parseConstraint();
                    } else if (in.peek(1).type() == TokenType.COLON || in.peek(1).type() == TokenType.LBRACE) {
                        // "s.t." may be omitted before a named constraint
                        parseConstraint();
                    } else {
                        throw new ModelSyntaxException("Unknown statement '" + token.text() + "'",
                                token.location(), "a declaration or statement");
                    }
                }
                default -> throw in.unexpected("a declaration or statement");
            }
        }
        return new ModelDeclarations(declarations, data);
    }

    // ------------------------------------------------------------------------
    // Declarations
    // ------------------------------------------------------------------------

    private void parseSet() {
        Token keyword = in.advance();
        String name = expectName();
        if (in.at(TokenType.LBRACE)) {
            throw new ModelSyntaxException("Indexed set '" + name + "' is not supported", in.peek().location());
        }
        int dimen = 0;
        SetExpr definition = null;
        while (!in.at(TokenType.SEMICOLON)) {
            if (in.match(TokenType.COMMA)) {
                continue;
            }
            if (in.match(TokenType.KW_DIMEN)) {
                Token n = in.expect(TokenType.NUMBER);
                if (n.number() < 1 || n.number() != Math.floor(n.number())) {
                    throw new ModelSyntaxException("dimen must be a positive integer", n.location());
                }
                dimen = (int) n.number();
            } else if (in.match(TokenType.ASSIGN) || in.match(TokenType.EQ)) {
                definition = parseSetExpression();
            } else {
                throw in.unexpected("'dimen', ':=' or ';'");
            }
        }
        in.expect(TokenType.SEMICOLON);
        declarations.add(new Declaration.SetDecl(declarations.size(), name, dimen, definition, keyword.location()));
    }

    private void parseParam() {
        Token keyword = in.advance();
        String name = expectName();
        Indexing indexing = in.at(TokenType.LBRACE) ? parseIndexing() : null;
        boolean symbolic = false;
        boolean integer = false;
        boolean binary = false;
        List<Check> checks = new ArrayList<>();
        Expr defaultValue = null;
        Expr definition = null;
        while (!in.at(TokenType.SEMICOLON)) {
            Token token = in.peek();
            switch (token.type()) {
                case COMMA -> in.advance();
                case KW_SYMBOLIC -> {
                    in.advance();
                    symbolic = true;
                }
                case KW_INTEGER -> {
                    in.advance();
                    integer = true;
                }
                case KW_BINARY -> {
                    in.advance();
                    binary = true;
                }
                case KW_DEFAULT -> {
                    in.advance();
                    defaultValue = parseExpression();
                }
                case ASSIGN -> {
                    in.advance();
                    definition = parseExpression();
                }
                case EQ, NE, LT, LE, GT, GE -> {
                    in.advance();
                    checks.add(new Check(comparisonOf(token.type()), parseAdditive()));
                }
                default -> throw in.unexpected("a parameter attribute or ';'");
            }
        }
        in.expect(TokenType.SEMICOLON);
        if (symbolic && (integer || binary)) {
            throw new ModelSyntaxException("Symbolic parameter '" + name + "' cannot be integer or binary",
                    keyword.location());
        }
        declarations.add(new Declaration.ParamDecl(declarations.size(), name, indexing, symbolic, integer, binary,
                checks, defaultValue, definition, keyword.location()));
    }

    private void parseVar() {
        Token keyword = in.advance();
        String name = expectName();
        Indexing indexing = in.at(TokenType.LBRACE) ? parseIndexing() : null;
        VariableDomain domain = VariableDomain.CONTINUOUS;
        Expr lower = null;
        Expr upper = null;
        while (!in.at(TokenType.SEMICOLON)) {
            Token token = in.peek();
            switch (token.type()) {
                case COMMA -> in.advance();
                case KW_INTEGER -> {
                    in.advance();
                    if (domain != VariableDomain.BINARY) {
                        domain = VariableDomain.INTEGER;
                    }
                }
                case KW_BINARY -> {
                    in.advance();
                    domain = VariableDomain.BINARY;
                }
                case GE -> {
                    in.advance();
                    lower = parseAdditive();
                }
                case LE -> {
                    in.advance();
                    upper = parseAdditive();
                }
                case EQ -> {
                    in.advance();
                    lower = parseAdditive();
                    upper = lower;
                }
                default -> throw in.unexpected("'integer', 'binary', '>=', '<=', '=' or ';'");
            }
        }
        in.expect(TokenType.SEMICOLON);
        declarations.add(new Declaration.VarDecl(declarations.size(), name, indexing, domain, lower, upper,
                keyword.location()));
    }

    private void parseConstraint() {
        Token nameToken = in.peek();
        String name = expectName();
        Indexing indexing = in.at(TokenType.LBRACE) ? parseIndexing() : null;
        in.expect(TokenType.COLON);
        Expr lhs = parseAdditive();
        Token op = in.peek();
        RowSense sense = switch (op.type()) {
            case EQ -> RowSense.EQUAL;
            case LE -> RowSense.LESS_OR_EQUAL;
            case GE -> RowSense.GREATER_OR_EQUAL;
            default -> throw in.unexpected("'=', '<=' or '>='");
        };
        in.advance();
        Expr rhs = parseAdditive();
        in.expect(TokenType.SEMICOLON);
        declarations.add(new Declaration.ConstraintDecl(declarations.size(), name, indexing, lhs, sense, rhs,
                nameToken.location()));
    }

    private void parseObjective(ObjectiveDirection direction) {
        Token keyword = in.advance();
        if (objectiveToken != null) {
            throw new ModelSyntaxException("Only one objective is allowed; the first is declared at "
                    + objectiveToken.location(), keyword.location());
        }
        objectiveToken = keyword;
        String name = expectName();
        if (in.at(TokenType.LBRACE)) {
            throw new ModelSyntaxException("Objective '" + name + "' cannot be indexed", in.peek().location());
        }
        in.expect(TokenType.COLON);
        Expr expression = parseAdditive();
        in.expect(TokenType.SEMICOLON);
        declarations.add(new Declaration.ObjectiveDecl(declarations.size(), name, direction, expression,
                keyword.location()));
    }

    private String expectName() {
        return in.expect(TokenType.IDENT).text();
    }

    // ------------------------------------------------------------------------
    // Indexing and set expressions
    // ------------------------------------------------------------------------

    private Indexing parseIndexing() {
        Token open = in.expect(TokenType.LBRACE);
        List<Indexing.Entry> entries = new ArrayList<>();
        do {
            entries.add(parseIndexEntry());
        } while (in.match(TokenType.COMMA));
        Expr filter = null;
        if (in.match(TokenType.COLON)) {
            filter = parseExpression();
        }
        in.expect(TokenType.RBRACE);
        return new Indexing(entries, filter, open.location());
    }

    private Indexing.Entry parseIndexEntry() {
        Token start = in.peek();
        if (start.is(TokenType.IDENT) && in.peek(1).is(TokenType.KW_IN)) {
            in.advance();
            in.advance();
            return new Indexing.Entry(List.of(start.text()), parseSetExpression(), start.location());
        }
        if (start.is(TokenType.LPAREN) && isDummyTuple(0)) {
            in.advance();
            List<String> dummies = new ArrayList<>();
            do {
                dummies.add(expectName());
            } while (in.match(TokenType.COMMA));
            in.expect(TokenType.RPAREN);
            in.expect(TokenType.KW_IN);
            return new Indexing.Entry(dummies, parseSetExpression(), start.location());
        }
        return new Indexing.Entry(List.of(), parseSetExpression(), start.location());
    }

    /**
     * True when the token at {@code start} opens {@code (a, b, ...) in}.
     */
    private boolean isDummyTuple(int start) {
        int offset = start + 1;
        while (true) {
            if (!in.peek(offset).is(TokenType.IDENT)) {
                return false;
            }
            Token next = in.peek(offset + 1);
            if (next.is(TokenType.RPAREN)) {
                return in.peek(offset + 2).is(TokenType.KW_IN);
            }
            if (!next.is(TokenType.COMMA)) {
                return false;
            }
            offset += 2;
        }
    }

    SetExpr parseSetExpression() {
        SetExpr left = parseSetIntersection();
        while (in.at(TokenType.KW_UNION) || in.at(TokenType.KW_DIFF)) {
            Token op = in.advance();
            SetExpr right = parseSetIntersection();
            SetExpr.SetOp setOp = op.is(TokenType.KW_UNION) ? SetExpr.SetOp.UNION : SetExpr.SetOp.DIFF;
            left = new SetExpr.Operation(setOp, left, right, op.location());
        }
        return left;
    }

    private SetExpr parseSetIntersection() {
        SetExpr left = parseSetCross();
        while (in.at(TokenType.KW_INTER)) {
            Token op = in.advance();
            left = new SetExpr.Operation(SetExpr.SetOp.INTER, left, parseSetCross(), op.location());
        }
        return left;
    }

    private SetExpr parseSetCross() {
        SetExpr left = parseSetPrimary();
        while (in.at(TokenType.KW_CROSS)) {
            Token op = in.advance();
            left = new SetExpr.Operation(SetExpr.SetOp.CROSS, left, parseSetPrimary(), op.location());
        }
        return left;
    }

    private SetExpr parseSetPrimary() {
        Token start = in.peek();
        if (start.is(TokenType.LBRACE)) {
            return parseBraceSet();
        }
        Expr from = parseAdditive();
        if (in.match(TokenType.DOTDOT)) {
            Expr to = parseAdditive();
            Expr step = in.match(TokenType.KW_BY) ? parseAdditive() : null;
            return new SetExpr.Range(from, to, step, start.location());
        }
        if (from instanceof Expr.Reference ref && !ref.isSubscripted()) {
            return new SetExpr.NamedSet(ref.name(), ref.location());
        }
        throw new ModelSyntaxException("Expression is not a set", start.location(), "a set name, range or '{'");
    }

    /**
     * {@code {}} and {@code {a, b}} are enumerations; {@code {i in S ...}} is a set builder.
     */
    private SetExpr parseBraceSet() {
        Token open = in.peek();
        Token first = in.peek(1);
        boolean builder = (first.is(TokenType.IDENT) && in.peek(2).is(TokenType.KW_IN))
                || (first.is(TokenType.LPAREN) && isDummyTuple(1));
        if (builder) {
            return new SetExpr.Builder(parseIndexing(), open.location());
        }
        in.advance();
        List<List<Expr>> elements = new ArrayList<>();
        if (!in.at(TokenType.RBRACE)) {
            do {
                elements.add(parseTupleOrScalar());
            } while (in.match(TokenType.COMMA));
        }
        in.expect(TokenType.RBRACE);
        return new SetExpr.Enumeration(elements, open.location());
    }

    private List<Expr> parseTupleOrScalar() {
        if (in.at(TokenType.LPAREN)) {
            in.advance();
            List<Expr> parts = new ArrayList<>();
            do {
                parts.add(parseExpression());
            } while (in.match(TokenType.COMMA));
            in.expect(TokenType.RPAREN);
            return parts;
        }
        return List.of(parseAdditive());
    }

    // ------------------------------------------------------------------------
    // Scalar expressions
    // ------------------------------------------------------------------------

    Expr parseExpression() {
        Expr left = parseAnd();
        while (in.at(TokenType.KW_OR)) {
            Token op = in.advance();
            left = new Expr.Binary(BinaryOp.OR, left, parseAnd(), op.location());
        }
        return left;
    }

    private Expr parseAnd() {
        Expr left = parseNot();
        while (in.at(TokenType.KW_AND)) {
            Token op = in.advance();
            left = new Expr.Binary(BinaryOp.AND, left, parseNot(), op.location());
        }
        return left;
    }

    private Expr parseNot() {
        if (in.at(TokenType.KW_NOT) && !in.peek(1).is(TokenType.KW_IN)) {
            Token op = in.advance();
            return new Expr.Unary(Expr.UnaryOp.NOT, parseNot(), op.location());
        }
        return parseRelational();
    }

    private Expr parseRelational() {
        Token start = in.peek();
        List<Expr> tuple = null;
        Expr left;
        if (start.is(TokenType.LPAREN) && looksLikeTupleMembership()) {
            tuple = parseTupleOrScalar();
            left = null;
        } else {
            left = parseAdditive();
        }
        Token op = in.peek();
        if (op.is(TokenType.KW_IN)) {
            in.advance();
            return new Expr.Membership(tuple != null ? tuple : List.of(left), parseSetExpression(), false,
                    start.location());
        }
        if (op.is(TokenType.KW_NOT) && in.peek(1).is(TokenType.KW_IN)) {
            in.advance();
            in.advance();
            return new Expr.Membership(tuple != null ? tuple : List.of(left), parseSetExpression(), true,
                    start.location());
        }
        if (tuple != null) {
            throw in.unexpected("'in'");
        }
        if (isComparison(op.type())) {
            in.advance();
            return new Expr.Binary(comparisonOf(op.type()), left, parseAdditive(), op.location());
        }
        return left;
    }

    /**
     * True when the cursor is at a parenthesized list containing a top-level comma.
     */
    private boolean looksLikeTupleMembership() {
        int depth = 0;
        for (int offset = 0; ; offset++) {
            Token token = in.peek(offset);
            switch (token.type()) {
                case LPAREN, LBRACKET, LBRACE -> depth++;
                case RPAREN, RBRACKET, RBRACE -> {
                    depth--;
                    if (depth == 0) {
                        return false;
                    }
                }
                case COMMA -> {
                    if (depth == 1) {
                        return true;
                    }
                }
                case SEMICOLON, EOF -> {
                    return false;
                }
                default -> {
                }
            }
        }
    }

    private Expr parseAdditive() {
        Expr left = parseTerm();
        while (in.at(TokenType.PLUS) || in.at(TokenType.MINUS)) {
            Token op = in.advance();
            BinaryOp binaryOp = op.is(TokenType.PLUS) ? BinaryOp.ADD : BinaryOp.SUBTRACT;
            left = new Expr.Binary(binaryOp, left, parseTerm(), op.location());
        }
        return left;
    }

    private Expr parseTerm() {
        Expr left = parseUnary();
        while (true) {
            Token op = in.peek();
            BinaryOp binaryOp = switch (op.type()) {
                case STAR -> BinaryOp.MULTIPLY;
                case SLASH -> BinaryOp.DIVIDE;
                case KW_MOD -> BinaryOp.MODULO;
                case KW_DIV -> BinaryOp.INT_DIVIDE;
                default -> null;
            };
            if (binaryOp == null) {
                return left;
            }
            in.advance();
            left = new Expr.Binary(binaryOp, left, parseUnary(), op.location());
        }
    }

    private Expr parseUnary() {
        Token op = in.peek();
        if (op.is(TokenType.MINUS)) {
            in.advance();
            return new Expr.Unary(Expr.UnaryOp.NEGATE, parseUnary(), op.location());
        }
        if (op.is(TokenType.PLUS)) {
            in.advance();
            return new Expr.Unary(Expr.UnaryOp.PLUS, parseUnary(), op.location());
        }
        return parsePower();
    }

    private Expr parsePower() {
        Expr base = parsePrimary();
        if (in.at(TokenType.CARET)) {
            Token op = in.advance();
            return new Expr.Binary(BinaryOp.POWER, base, parseUnary(), op.location());
        }
        return base;
    }

    private Expr parsePrimary() {
        Token token = in.peek();
        switch (token.type()) {
            case NUMBER -> {
                in.advance();
                return new Expr.NumberLiteral(token.number(), token.location());
            }
            case STRING -> {
                in.advance();
                return new Expr.StringLiteral(token.text(), token.location());
            }
            case LPAREN -> {
                in.advance();
                Expr inner = parseExpression();
                in.expect(TokenType.RPAREN);
                return inner;
            }
            case KW_SUM -> {
                in.advance();
                Indexing indexing = parseIndexing();
                return new Expr.Sum(indexing, parseTerm(), token.location());
            }
            case KW_IF -> {
                in.advance();
                Expr condition = parseExpression();
                in.expect(TokenType.KW_THEN);
                Expr whenTrue = parseAdditive();
                Expr whenFalse = in.match(TokenType.KW_ELSE) ? parseAdditive() : null;
                return new Expr.Conditional(condition, whenTrue, whenFalse, token.location());
            }
            case IDENT -> {
                in.advance();
                if (in.at(TokenType.LPAREN)) {
                    return parseCall(token);
                }
                List<Expr> subscripts = new ArrayList<>();
                if (in.match(TokenType.LBRACKET)) {
                    do {
                        subscripts.add(parseAdditive());
                    } while (in.match(TokenType.COMMA));
                    in.expect(TokenType.RBRACKET);
                }
                return new Expr.Reference(token.text(), subscripts, token.location());
            }
            default -> throw in.unexpected("an expression");
        }
    }

    private Expr parseCall(Token name) {
        in.expect(TokenType.LPAREN);
        if (name.text().equals("card")) {
            SetExpr set = parseSetExpression();
            in.expect(TokenType.RPAREN);
            return new Expr.Cardinality(set, name.location());
        }
        Expr.Function function = Expr.Function.byName(name.text());
        if (function == null) {
            throw new ModelSyntaxException("Unknown function '" + name.text() + "'", name.location(),
                    "one of card, abs, min, max, floor, ceil");
        }
        List<Expr> arguments = new ArrayList<>();
        do {
            arguments.add(parseExpression());
        } while (in.match(TokenType.COMMA));
        in.expect(TokenType.RPAREN);
        int expected = function == Expr.Function.MIN || function == Expr.Function.MAX ? -1 : 1;
        if (expected > 0 && arguments.size() != expected) {
            throw new ModelSyntaxException(name.text() + " takes exactly one argument", name.location());
        }
        return new Expr.FunctionCall(function, arguments, name.location());
    }

    private static boolean isComparison(TokenType type) {
        return switch (type) {
            case EQ, NE, LT, LE, GT, GE -> true;
            default -> false;
        };
    }

    private static BinaryOp comparisonOf(TokenType type) {
        return switch (type) {
            case EQ -> BinaryOp.EQ;
            case NE -> BinaryOp.NE;
            case LT -> BinaryOp.LT;
            case LE -> BinaryOp.LE;
            case GT -> BinaryOp.GT;
            case GE -> BinaryOp.GE;
            default -> throw new IllegalArgumentException("Not a comparison: " + type);
        };
    }
}
