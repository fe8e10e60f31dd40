package com.tessera.modeling.compiler.parser;

import com.tessera.modeling.api.exceptions.ModelSyntaxException;
import com.tessera.modeling.api.model.Atom;
import com.tessera.modeling.api.model.Tuple;
import com.tessera.modeling.compiler.ast.DataSection;
import com.tessera.modeling.compiler.ast.DataSection.Value;
import com.tessera.modeling.compiler.lexer.Token;
import com.tessera.modeling.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses data statements up to {@code end;} or end of input.
 */
final class DataSectionParser {

    private final TokenCursor in;

    DataSectionParser(TokenCursor in) {
        this.in = in;
    }

    DataSection parse() {
        List<DataSection.Statement> statements = new ArrayList<>();
        while (!in.atEnd()) {
            if (in.match(TokenType.KW_END)) {
                in.match(TokenType.SEMICOLON);
                break;
            }
            if (in.at(TokenType.KW_SET)) {
                statements.add(parseSet());
            } else if (in.at(TokenType.KW_PARAM)) {
                statements.add(parseParam());
            } else {
                throw in.unexpected("'set', 'param' or 'end'");
            }
        }
        if (!in.atEnd()) {
            throw in.unexpected("end of input after 'end;'");
        }
        return new DataSection(statements);
    }

    private DataSection.SetData parseSet() {
        Token keyword = in.advance();
        String name = in.expect(TokenType.IDENT).text();
        in.expect(TokenType.ASSIGN);
        List<DataSection.Item> items = new ArrayList<>();
        while (!in.at(TokenType.SEMICOLON)) {
            if (in.match(TokenType.COMMA)) {
                continue;
            }
            Token start = in.peek();
            if (in.match(TokenType.LPAREN)) {
                List<Atom> atoms = new ArrayList<>();
                do {
                    atoms.add(requireAtom(parseValue()));
                } while (in.match(TokenType.COMMA));
                in.expect(TokenType.RPAREN);
                items.add(new DataSection.Item(new Tuple(atoms), start.location()));
            } else {
                items.add(new DataSection.Item(Tuple.of(requireAtom(parseValue())), start.location()));
            }
        }
        in.expect(TokenType.SEMICOLON);
        return new DataSection.SetData(name, items, keyword.location());
    }

    private DataSection.Statement parseParam() {
        Token keyword = in.advance();
        if (in.match(TokenType.COLON)) {
            return parseTabbing(keyword);
        }
        String name = in.expect(TokenType.IDENT).text();
        Atom defaultValue = null;
        if (in.match(TokenType.KW_DEFAULT)) {
            defaultValue = requireAtom(parseValue());
        }
        List<Value> flat = new ArrayList<>();
        List<DataSection.Table> tables = new ArrayList<>();
        if (in.match(TokenType.ASSIGN) || in.at(TokenType.COLON)) {
            while (!in.at(TokenType.SEMICOLON)) {
                if (in.match(TokenType.COMMA)) {
                    continue;
                }
                if (in.at(TokenType.COLON)) {
                    tables.add(parseTable());
                } else {
                    flat.add(parseValue());
                }
            }
        }
        in.expect(TokenType.SEMICOLON);
        return new DataSection.ParamData(name, defaultValue, flat, tables, keyword.location());
    }

    private DataSection.Table parseTable() {
        Token colon = in.expect(TokenType.COLON);
        List<Atom> columns = new ArrayList<>();
        while (!in.at(TokenType.ASSIGN)) {
            if (in.match(TokenType.COMMA)) {
                continue;
            }
            columns.add(requireAtom(parseValue()));
        }
        in.expect(TokenType.ASSIGN);
        if (columns.isEmpty()) {
            throw new ModelSyntaxException("Table has no column keys", colon.location());
        }
        List<Value> cells = new ArrayList<>();
        while (!in.at(TokenType.SEMICOLON) && !in.at(TokenType.COLON)) {
            if (in.match(TokenType.COMMA)) {
                continue;
            }
            cells.add(parseValue());
        }
        return new DataSection.Table(columns, cells, colon.location());
    }

    private DataSection.TabbingData parseTabbing(Token keyword) {
        List<String> parameters = new ArrayList<>();
        while (!in.at(TokenType.ASSIGN)) {
            if (in.match(TokenType.COMMA)) {
                continue;
            }
            parameters.add(in.expect(TokenType.IDENT).text());
        }
        in.expect(TokenType.ASSIGN);
        if (parameters.isEmpty()) {
            throw new ModelSyntaxException("Tabbing data names no parameters", keyword.location());
        }
        List<Value> flat = new ArrayList<>();
        while (!in.at(TokenType.SEMICOLON)) {
            if (in.match(TokenType.COMMA)) {
                continue;
            }
            flat.add(parseValue());
        }
        in.expect(TokenType.SEMICOLON);
        return new DataSection.TabbingData(parameters, flat, keyword.location());
    }

    private Value parseValue() {
        Token token = in.peek();
        switch (token.type()) {
            case NUMBER -> {
                in.advance();
                return new Value(Atom.of(token.number()), token.location());
            }
            case MINUS, PLUS -> {
                in.advance();
                Token number = in.expect(TokenType.NUMBER);
                double value = token.is(TokenType.MINUS) ? -number.number() : number.number();
                return new Value(Atom.of(value), token.location());
            }
            case IDENT, STRING -> {
                in.advance();
                return new Value(Atom.of(token.text()), token.location());
            }
            case DOT -> {
                in.advance();
                return new Value(null, token.location());
            }
            default -> throw in.unexpected("a number, symbol or '.'");
        }
    }

    private static Atom requireAtom(Value value) {
        if (value.isMissing()) {
            throw new ModelSyntaxException("'.' is only allowed in parameter tables", value.location());
        }
        return value.atom();
    }
}
