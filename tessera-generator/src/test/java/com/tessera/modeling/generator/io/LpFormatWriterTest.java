package com.tessera.modeling.generator.io;

import com.tessera.modeling.api.model.Column;
import com.tessera.modeling.api.model.Instance;
import com.tessera.modeling.api.model.InstanceStats;
import com.tessera.modeling.api.model.ObjectiveDirection;
import com.tessera.modeling.api.model.ObjectiveRow;
import com.tessera.modeling.api.model.Row;
import com.tessera.modeling.api.model.RowLabel;
import com.tessera.modeling.api.model.RowSense;
import com.tessera.modeling.api.model.Tuple;
import com.tessera.modeling.api.model.VariableDomain;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class LpFormatWriterTest {

    private static final double INF = Double.POSITIVE_INFINITY;

    private static Instance instance(List<Column> columns, List<Row> rows, ObjectiveRow objective) {
        return new Instance("demo", columns, rows, objective,
                new InstanceStats(columns.size(), 0, rows.size(), 0, 0, Map.of()));
    }

    @Test
    void shouldWriteAllSections() {
        List<Column> columns = List.of(
                new Column(0, "x", Tuple.EMPTY, VariableDomain.CONTINUOUS, 0, INF),
                new Column(1, "y", Tuple.of(1, "a b"), VariableDomain.INTEGER, 0, 10),
                new Column(2, "b", Tuple.of(1), VariableDomain.BINARY, 0, 1),
                new Column(3, "f", Tuple.EMPTY, VariableDomain.CONTINUOUS, -INF, INF));
        List<Row> rows = List.of(
                new Row(0, new RowLabel("Cap", List.of("i"), Tuple.of(1)), new int[]{0, 1}, new double[]{1, -2.5},
                        RowSense.LESS_OR_EQUAL, 10),
                new Row(1, RowLabel.of("Link"), new int[]{1, 2, 3}, new double[]{1, 1, 1}, RowSense.EQUAL, 0));
        ObjectiveRow objective = new ObjectiveRow("cost", ObjectiveDirection.MINIMIZE,
                new int[]{0, 2}, new double[]{3, 1}, 4);

        String lp = LpFormatWriter.toString(instance(columns, rows, objective));

        assertThat(lp).isEqualTo("""
                \\ Model: demo
                \\ Objective offset: 4
                Minimize
                 cost: 3 x + b(1)
                Subject To
                 Cap(1): x - 2.5 y(1,a_b) <= 10
                 Link: y(1,a_b) + b(1) + f = 0
                Bounds
                 0 <= y(1,a_b) <= 10
                 f free
                General
                 y(1,a_b)
                Binary
                 b(1)
                End
                """);
    }

    @Test
    void shouldDisambiguateCollidingNames() {
        List<Column> columns = List.of(
                new Column(0, "y", Tuple.of("a b"), VariableDomain.CONTINUOUS, 0, INF),
                new Column(1, "y", Tuple.of("a_b"), VariableDomain.CONTINUOUS, 0, INF));
        ObjectiveRow objective = new ObjectiveRow("z", ObjectiveDirection.MAXIMIZE,
                new int[]{0, 1}, new double[]{1, -1}, 0);

        String lp = LpFormatWriter.toString(instance(columns, List.of(), objective));

        assertThat(lp).contains(" z: y(a_b) - y(a_b)~1\n").startsWith("\\ Model: demo\nMaximize\n");
    }

    @Test
    void shouldWriteFixedAndLowerBounds() {
        List<Column> columns = List.of(
                new Column(0, "p", Tuple.EMPTY, VariableDomain.CONTINUOUS, 2, 2),
                new Column(1, "q", Tuple.EMPTY, VariableDomain.CONTINUOUS, 1.5, INF),
                new Column(2, "r", Tuple.EMPTY, VariableDomain.CONTINUOUS, -INF, 3));
        ObjectiveRow objective = new ObjectiveRow("z", ObjectiveDirection.MINIMIZE,
                new int[]{0}, new double[]{1}, 0);

        String lp = LpFormatWriter.toString(instance(columns, List.of(), objective));

        assertThat(lp).contains(" p = 2\n", " q >= 1.5\n", " -inf <= r <= 3\n");
    }

    @ParameterizedTest
    @CsvSource({"3.0, 3", "-2.0, -2", "0.125, 0.125", "1e-7, 0.0000001", "2.5e20, 250000000000000000000"})
    void shouldFormatNumbersWithoutExponent(double value, String expected) {
        assertThat(LpFormatWriter.number(value)).isEqualTo(expected);
    }
}
