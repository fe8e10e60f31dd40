package com.tessera.modeling.generator.io;

import com.tessera.modeling.api.model.Column;
import com.tessera.modeling.api.model.Instance;
import com.tessera.modeling.api.model.ObjectiveDirection;
import com.tessera.modeling.api.model.ObjectiveRow;
import com.tessera.modeling.api.model.Row;
import com.tessera.modeling.api.model.VariableDomain;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes an instance in CPLEX LP text format.
 *
 * <p>Output is a pure function of the instance: equal instances give byte-identical text.
 * Names are derived from labels with characters outside the LP name alphabet replaced,
 * e.g. {@code x[1,'a b']} becomes {@code x(1,a_b)}; a clash gets a {@code ~n} suffix.
 */
public final class LpFormatWriter {

    private static final int TERMS_PER_LINE = 8;

    private LpFormatWriter() {
    }

    public static String toString(Instance instance) {
        StringWriter out = new StringWriter();
        write(instance, out);
        return out.toString();
    }

    public static void write(Instance instance, Writer out) {
        try {
            new Output(instance, out).write();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static final class Output {
        private final Instance instance;
        private final Writer out;
        private final String[] columnNames;

        Output(Instance instance, Writer out) {
            this.instance = instance;
            this.out = out;
            this.columnNames = new String[instance.columnCount()];
            Set<String> used = new HashSet<>();
            for (Column column : instance.columns()) {
                columnNames[column.index()] = unique(sanitize(column.name(), column.tuple().atoms().stream()
                        .map(Object::toString).toList()), used);
            }
        }

        void write() throws IOException {
            ObjectiveRow objective = instance.objective();
            out.write("\\ Model: " + instance.modelName() + "\n");
            if (objective.constant() != 0.0) {
                out.write("\\ Objective offset: " + number(objective.constant()) + "\n");
            }
            out.write(objective.direction() == ObjectiveDirection.MAXIMIZE ? "Maximize\n" : "Minimize\n");
            out.write(" " + sanitize(objective.name(), List.of()) + ":");
            terms(objective.columns(), objective.coefficients());
            out.write("\n");

            out.write("Subject To\n");
            Set<String> rowNames = new HashSet<>();
            for (Row row : instance.rows()) {
                List<String> parts = row.label().tuple().atoms().stream().map(Object::toString).toList();
                out.write(" " + unique(sanitize(row.template(), parts), rowNames) + ":");
                terms(row.columns(), row.coefficients());
                out.write(" " + row.sense().symbol() + " " + number(row.rhs()) + "\n");
            }

            out.write("Bounds\n");
            for (Column column : instance.columns()) {
                if (column.domain() == VariableDomain.BINARY) {
                    continue;
                }
                String name = columnNames[column.index()];
                double lo = column.lowerBound();
                double hi = column.upperBound();
                if (lo == Double.NEGATIVE_INFINITY && hi == Double.POSITIVE_INFINITY) {
                    out.write(" " + name + " free\n");
                } else if (lo == hi) {
                    out.write(" " + name + " = " + number(lo) + "\n");
                } else if (hi == Double.POSITIVE_INFINITY) {
                    if (lo != 0.0) {
                        out.write(" " + name + " >= " + number(lo) + "\n");
                    }
                } else {
                    out.write(" " + bound(lo) + " <= " + name + " <= " + number(hi) + "\n");
                }
            }

            section("General", VariableDomain.INTEGER);
            section("Binary", VariableDomain.BINARY);
            out.write("End\n");
        }

        private void section(String title, VariableDomain domain) throws IOException {
            boolean any = false;
            for (Column column : instance.columns()) {
                if (column.domain() == domain) {
                    if (!any) {
                        out.write(title + "\n");
                        any = true;
                    }
                    out.write(" " + columnNames[column.index()] + "\n");
                }
            }
        }

        private void terms(int[] columns, double[] coefficients) throws IOException {
            if (columns.length == 0) {
                out.write(" 0");
                return;
            }
            for (int k = 0; k < columns.length; k++) {
                if (k > 0 && k % TERMS_PER_LINE == 0) {
                    out.write("\n  ");
                }
                double c = coefficients[k];
                String sign = c < 0 ? " - " : (k == 0 ? " " : " + ");
                double magnitude = Math.abs(c);
                out.write(sign + (magnitude == 1.0 ? "" : number(magnitude) + " ") + columnNames[columns[k]]);
            }
        }
    }

    private static String bound(double value) {
        return value == Double.NEGATIVE_INFINITY ? "-inf" : number(value);
    }

    static String number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String sanitize(String name, List<String> parts) {
        StringBuilder sb = new StringBuilder();
        appendSafe(sb, name);
        if (!parts.isEmpty()) {
            sb.append('(');
            for (int i = 0; i < parts.size(); i++) {
                if (i > 0) sb.append(',');
                appendSafe(sb, parts.get(i));
            }
            sb.append(')');
        }
        return sb.toString();
    }

    private static void appendSafe(StringBuilder sb, String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean allowed = Character.isLetterOrDigit(c) && c < 128 || "_.!\"#$%&/;?@`'{}|~".indexOf(c) >= 0;
            sb.append(allowed ? c : '_');
        }
    }

    private static String unique(String name, Set<String> used) {
        String candidate = name;
        int n = 1;
        while (!used.add(candidate)) {
            candidate = name + "~" + n++;
        }
        return candidate;
    }
}
