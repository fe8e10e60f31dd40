/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Traceable name of a generated row: the template name plus the header tuple, keyed by
 * the header's dummy names, e.g. {@code ProdCapacity[month=3,plant=2]}.
 *
 * <p>{@link #parse(String)} inverts {@link #format()} exactly. Symbols that are not plain
 * identifiers are single-quoted (with {@code ''} escaping) so that they survive the round trip.
 */
public record RowLabel(String template, List<String> keys, Tuple tuple) implements Serializable {

    private static final Pattern BARE_SYMBOL = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern NUMERIC = Pattern.compile("-?(\\d+(\\.\\d+)?(E-?\\d+)?|Infinity)");

    public RowLabel {
        keys = List.copyOf(keys);
        if (keys.size() != tuple.arity()) {
            throw new IllegalArgumentException("Label keys " + keys + " do not match tuple " + tuple);
        }
    }

    public static RowLabel of(String template) {
        return new RowLabel(template, List.of(), Tuple.EMPTY);
    }

    public String format() {
        if (keys.isEmpty()) {
            return template;
        }
        StringBuilder sb = new StringBuilder(template).append('[');
        for (int i = 0; i < keys.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(keys.get(i)).append('=');
            appendValue(sb, tuple.get(i));
        }
        return sb.append(']').toString();
    }

    private static void appendValue(StringBuilder sb, Atom atom) {
        if (atom.isNumeric()) {
            sb.append(atom);
        } else if (BARE_SYMBOL.matcher(atom.symbol()).matches() && !NUMERIC.matcher(atom.symbol()).matches()) {
            sb.append(atom.symbol());
        } else {
            sb.append('\'').append(atom.symbol().replace("'", "''")).append('\'');
        }
    }

    /**
     * Parses a label produced by {@link #format()}.
     *
     * @throws IllegalArgumentException if the text is not a well-formed label
     */
    public static RowLabel parse(String text) {
        int open = text.indexOf('[');
        if (open < 0) {
            return of(text);
        }
        if (!text.endsWith("]")) {
            throw new IllegalArgumentException("Unterminated row label: " + text);
        }
        String template = text.substring(0, open);
        List<String> keys = new ArrayList<>();
        List<Atom> atoms = new ArrayList<>();
        int pos = open + 1;
        int end = text.length() - 1;
        while (pos < end) {
            int eq = text.indexOf('=', pos);
            if (eq < 0 || eq > end) {
                throw new IllegalArgumentException("Missing '=' in row label: " + text);
            }
            keys.add(text.substring(pos, eq));
            pos = eq + 1;
            if (pos < end && text.charAt(pos) == '\'') {
                StringBuilder value = new StringBuilder();
                pos++;
                while (true) {
                    if (pos >= end) {
                        throw new IllegalArgumentException("Unterminated quoted value in row label: " + text);
                    }
                    char c = text.charAt(pos);
                    if (c == '\'') {
                        if (pos + 1 < end && text.charAt(pos + 1) == '\'') {
                            value.append('\'');
                            pos += 2;
                            continue;
                        }
                        pos++;
                        break;
                    }
                    value.append(c);
                    pos++;
                }
                atoms.add(Atom.of(value.toString()));
            } else {
                int comma = text.indexOf(',', pos);
                int stop = comma < 0 || comma > end ? end : comma;
                String raw = text.substring(pos, stop);
                atoms.add(NUMERIC.matcher(raw).matches() ? Atom.of(Double.parseDouble(raw)) : Atom.of(raw));
                pos = stop;
            }
            if (pos < end) {
                if (text.charAt(pos) != ',') {
                    throw new IllegalArgumentException("Expected ',' at offset " + pos + " in row label: " + text);
                }
                pos++;
            }
        }
        return new RowLabel(template, keys, new Tuple(atoms));
    }

    @Override
    public String toString() {
        return format();
    }
}
