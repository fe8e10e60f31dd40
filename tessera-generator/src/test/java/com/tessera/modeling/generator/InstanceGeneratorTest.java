package com.tessera.modeling.generator;

import com.tessera.modeling.api.exceptions.InstanceBuildException;
import com.tessera.modeling.api.exceptions.InvalidRangeException;
import com.tessera.modeling.api.exceptions.MissingParameterValueException;
import com.tessera.modeling.api.model.Column;
import com.tessera.modeling.api.model.Instance;
import com.tessera.modeling.api.model.ObjectiveDirection;
import com.tessera.modeling.api.model.Row;
import com.tessera.modeling.api.model.RowLabel;
import com.tessera.modeling.api.model.RowSense;
import com.tessera.modeling.api.model.Tuple;
import com.tessera.modeling.api.model.VariableDomain;
import com.tessera.modeling.compiler.ast.ModelDeclarations;
import com.tessera.modeling.compiler.parser.ModelParser;
import com.tessera.modeling.compiler.symbols.ModelValidator;
import com.tessera.modeling.compiler.symbols.ValidatedModel;
import com.tessera.modeling.core.telemetry.TracingService;
import com.tessera.modeling.generator.data.DataBinder;
import com.tessera.modeling.generator.data.ModelData;
import com.tessera.modeling.generator.io.LpFormatWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Instance generation")
class InstanceGeneratorTest {

    private InstanceGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new InstanceGenerator(TracingService.noopTracer(), 1);
    }

    @AfterEach
    void tearDown() {
        generator.close();
    }

    private static Instance generate(InstanceGenerator generator, String text) {
        ModelDeclarations declarations = ModelParser.parse(text);
        ValidatedModel model = ModelValidator.validate(declarations);
        ModelData data = DataBinder.bind(model, declarations.data());
        return generator.generate("test", model, data);
    }

    private Instance generate(String text) {
        return generate(generator, text);
    }

    /**
     * Many small templates with uneven sizes, so parallel workers finish out of order.
     */
    private static final String ASSIGNMENT = """
            set W := 1..12;
            set J := 1..9;
            param cost{w in W, j in J} := (w * 7 + j * 3) mod 11 + 1;
            var a{W, J} binary;
            var load{W} >= 0, <= 5;
            s.t. OneWorker{j in J}: sum{w in W} a[w, j] = 1;
            s.t. Load{w in W}: load[w] = sum{j in J} a[w, j];
            s.t. Upper{w in W : w mod 2 = 0}: load[w] <= 3;
            s.t. Pairs{w in W, v in W : v > w}: a[w, 1] + a[v, 1] <= 1;
            s.t. Triangle{w in W, j in J, k in j..9 : k = j + 1 + w mod 3}: a[w, j] - a[w, k] <= 0.5 * w;
            minimize total: sum{w in W, j in J} cost[w, j] * a[w, j] + 2;
            """;

    // ========================================================================
    // Columns
    // ========================================================================

    @Nested
    @DisplayName("Columns")
    class Columns {

        @Test
        @DisplayName("One column per domain member, in declaration and header order")
        void shouldAllocateEveryIndexCombination() {
            Instance instance = generate("""
                    set I := 1..2;
                    set K := {'a', 'b', 'c'};
                    var x{I, K};
                    var y >= -3;
                    minimize z: sum{i in I, k in K} x[i, k] + y;
                    """);

            assertThat(instance.columnCount()).isEqualTo(7);
            assertThat(instance.columns()).extracting(Column::label)
                    .containsExactly("x[1,a]", "x[1,b]", "x[1,c]", "x[2,a]", "x[2,b]", "x[2,c]", "y");
            assertThat(instance.columns()).extracting(Column::index).containsExactly(0, 1, 2, 3, 4, 5, 6);
            assertThat(instance.column("y").orElseThrow().lowerBound()).isEqualTo(-3.0);
            assertThat(instance.column("x[1,a]").orElseThrow().upperBound()).isEqualTo(Double.POSITIVE_INFINITY);
        }

        @Test
        @DisplayName("Binary columns are always bounded to [0, 1]")
        void shouldForceBinaryBounds() {
            Instance instance = generate("""
                    var b{1..2} binary >= -5, <= 9;
                    var n integer <= 4;
                    minimize z: b[1] + b[2] + n;
                    """);

            assertThat(instance.columns()).filteredOn(c -> c.domain() == VariableDomain.BINARY)
                    .hasSize(2)
                    .allSatisfy(c -> {
                        assertThat(c.lowerBound()).isEqualTo(0.0);
                        assertThat(c.upperBound()).isEqualTo(1.0);
                    });
            assertThat(instance.stats().integerColumnCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Bounds on a binary variable are not evaluated")
        void shouldNotEvaluateBinaryBounds() {
            Instance instance = generate("""
                    param cap{1..2} := 4;
                    var b{i in 1..3} binary <= cap[i];
                    minimize z: sum{i in 1..3} b[i];
                    """);

            assertThat(instance.column("b", Tuple.of(3)).orElseThrow().upperBound()).isEqualTo(1.0);
        }

        @Test
        void shouldEvaluateIndexedBounds() {
            Instance instance = generate("""
                    set I := 1..3;
                    var x{i in I} >= i, <= 2 * i;
                    minimize z: sum{i in I} x[i];
                    """);

            Column x3 = instance.column("x", Tuple.of(3)).orElseThrow();
            assertThat(x3.lowerBound()).isEqualTo(3.0);
            assertThat(x3.upperBound()).isEqualTo(6.0);
        }

        @Test
        void shouldRejectCrossedBounds() {
            assertThatThrownBy(() -> generate("var x >= 5, <= 1; minimize z: x;"))
                    .isInstanceOf(InstanceBuildException.class)
                    .hasMessageContaining("lower bound");
        }
    }

    // ========================================================================
    // Rows
    // ========================================================================

    @Nested
    @DisplayName("Rows")
    class Rows {

        @Test
        @DisplayName("Constants move to the right-hand side and both sides' variables to the left")
        void shouldNormalizeRow() {
            Instance instance = generate("""
                    var x; var y;
                    s.t. C: 2 * x + 3 <= 10 - y;
                    maximize z: x;
                    """);

            Row row = instance.rows().get(0);
            assertThat(row.label()).isEqualTo(RowLabel.of("C"));
            assertThat(row.columns()).containsExactly(0, 1);
            assertThat(row.coefficients()).containsExactly(2.0, 1.0);
            assertThat(row.sense()).isEqualTo(RowSense.LESS_OR_EQUAL);
            assertThat(row.rhs()).isEqualTo(7.0);
            assertThat(instance.objective().direction()).isEqualTo(ObjectiveDirection.MAXIMIZE);
        }

        @Test
        @DisplayName("Coefficients of repeated variables are summed and zeros dropped")
        void shouldMergeRepeatedTerms() {
            Instance instance = generate("""
                    var x; var y; var w;
                    s.t. C: w + x + y - y >= x - 2 * x;
                    minimize z: x;
                    """);

            Row row = instance.rows().get(0);
            assertThat(row.columns()).containsExactly(0, 2);
            assertThat(row.coefficientOf(0)).isEqualTo(2.0);
            assertThat(row.coefficientOf(1)).isEqualTo(0.0);
            assertThat(row.coefficientOf(2)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("A header whose filter excludes every member produces no rows")
        void shouldProduceNoRowsForEmptyHeader() {
            Instance instance = generate("""
                    set I := 1..3;
                    var x{I} >= 0;
                    s.t. Never{i in I : i > 10}: x[i] >= 1;
                    s.t. Always{i in I}: x[i] <= 4;
                    minimize z: sum{i in I} x[i];
                    """);

            assertThat(instance.rowsOf("Never")).isEmpty();
            assertThat(instance.rowsOf("Always")).hasSize(3);
            assertThat(instance.stats().rowsPerTemplate()).containsOnlyKeys("Always");
        }

        @Test
        void shouldLabelRowsWithDummyNames() {
            Instance instance = generate("""
                    set CITIES := {'New York', 'Boston'};
                    var x{CITIES, 1..2};
                    s.t. Cap{c in CITIES, t in 1..2}: x[c, t] <= 10;
                    s.t. Anon{CITIES}: sum{c in CITIES, t in 1..2} x[c, t] >= 1;
                    minimize z: sum{c in CITIES, t in 1..2} x[c, t];
                    """);

            Row first = instance.rowsOf("Cap").get(0);
            assertThat(first.label().keys()).containsExactly("c", "t");
            assertThat(first.label().format()).isEqualTo("Cap[c='New York',t=1]");
            assertThat(RowLabel.parse(first.label().format())).isEqualTo(first.label());
            assertThat(instance.rowsOf("Anon").get(1).label().format()).isEqualTo("Anon[_1=Boston]");
        }

        @Test
        @DisplayName("A row without variable terms is an error naming the row")
        void shouldRejectConstantRow() {
            assertThatThrownBy(() -> generate("""
                    set I := 1..2;
                    var x{I};
                    s.t. Degenerate{i in I}: 0 * x[i] >= i;
                    minimize z: x[1];
                    """))
                    .isInstanceOf(InstanceBuildException.class)
                    .hasMessageContaining("Degenerate[i=1] has no variable terms");
        }

        @Test
        @DisplayName("A constraint range bound without a value is a range error")
        void shouldRejectConstraintRangeWithoutBound() {
            assertThatThrownBy(() -> generate("""
                    param n;
                    var x;
                    minimize z: x;
                    s.t. c{i in 1..n}: x >= i;
                    """))
                    .isInstanceOf(InvalidRangeException.class)
                    .hasMessageContaining("Range bound needs n");
        }

        @Test
        @DisplayName("A parameter member left without a value fails once generation is done")
        void shouldRejectUnvaluedMemberNeverReferenced() {
            assertThatThrownBy(() -> generate("""
                    param w{1..2};
                    var x >= 0;
                    minimize z: x;
                    data;
                    param w := 1 5;
                    end;
                    """))
                    .isInstanceOf(MissingParameterValueException.class)
                    .hasMessageContaining("w[2]");
        }

        @Test
        void shouldRejectVariableOutsideDomain() {
            assertThatThrownBy(() -> generate("""
                    set M := 1..3;
                    var stock{M} >= 0;
                    s.t. Balance{m in M}: stock[m] = stock[m - 1] + 1;
                    minimize z: sum{m in M} stock[m];
                    """))
                    .isInstanceOf(InstanceBuildException.class)
                    .hasMessageContaining("stock[0] is referenced outside its declared domain");
        }

        @Test
        void shouldSelectBranchPerRow() {
            Instance instance = generate("""
                    set M := 1..3;
                    param initial := 7;
                    var stock{M} >= 0;
                    s.t. Balance{m in M}: stock[m] = if m = 1 then initial else stock[m - 1];
                    minimize z: sum{m in M} stock[m];
                    """);

            assertThat(instance.rowsOf("Balance")).extracting(Row::rhs).containsExactly(7.0, 0.0, 0.0);
            assertThat(instance.rowsOf("Balance").get(2).coefficients()).containsExactly(-1.0, 1.0);
        }
    }

    // ========================================================================
    // Objective and statistics
    // ========================================================================

    @Nested
    @DisplayName("Objective and statistics")
    class ObjectiveAndStats {

        @Test
        void shouldKeepObjectiveOffset() {
            Instance instance = generate(ASSIGNMENT);

            assertThat(instance.objective().name()).isEqualTo("total");
            assertThat(instance.objective().constant()).isEqualTo(2.0);
            assertThat(instance.objective().size()).isEqualTo(108);
        }

        @Test
        void shouldCountRowsPerTemplate() {
            Instance instance = generate(ASSIGNMENT);

            assertThat(instance.stats().rowsPerTemplate())
                    .containsEntry("OneWorker", 9)
                    .containsEntry("Load", 12)
                    .containsEntry("Upper", 6)
                    .containsEntry("Pairs", 66);
            assertThat(instance.stats().rowCount()).isEqualTo(instance.rowCount());
            assertThat(instance.stats().nonZeroCount())
                    .isEqualTo(instance.rows().stream().mapToLong(Row::size).sum());
            assertThat(instance.stats().rowsPerTemplate().keySet())
                    .containsExactly("OneWorker", "Load", "Upper", "Pairs", "Triangle");
        }
    }

    // ========================================================================
    // Determinism
    // ========================================================================

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("Parallel generation yields the same instance as sequential generation")
        void shouldMatchSequentialGeneration() {
            Instance sequential = generate(ASSIGNMENT);
            try (InstanceGenerator parallel = new InstanceGenerator(TracingService.noopTracer(), 4)) {
                for (int run = 0; run < 5; run++) {
                    Instance concurrent = generate(parallel, ASSIGNMENT);

                    assertThat(concurrent.rows()).isEqualTo(sequential.rows());
                    assertThat(concurrent.columns()).isEqualTo(sequential.columns());
                    assertThat(concurrent.objective()).isEqualTo(sequential.objective());
                    assertThat(LpFormatWriter.toString(concurrent)).isEqualTo(LpFormatWriter.toString(sequential));
                }
            }
        }

        @Test
        void shouldEmitRowsInTemplateOrder() {
            try (InstanceGenerator parallel = new InstanceGenerator(TracingService.noopTracer(), 3)) {
                Instance instance = generate(parallel, ASSIGNMENT);

                String templates = instance.rows().stream()
                        .map(Row::template)
                        .distinct()
                        .collect(Collectors.joining(","));
                assertThat(templates).isEqualTo("OneWorker,Load,Upper,Pairs,Triangle");
                assertThat(instance.rows()).extracting(Row::index)
                        .isSorted()
                        .doesNotHaveDuplicates();
            }
        }

        @Test
        void shouldPropagateTemplateFailureFromWorker() {
            try (InstanceGenerator parallel = new InstanceGenerator(TracingService.noopTracer(), 2)) {
                assertThatThrownBy(() -> generate(parallel, """
                        set I := 1..3;
                        var x{I};
                        s.t. Fine{i in I}: x[i] >= 0;
                        s.t. Broken{i in I}: x[i + 1] >= 0;
                        minimize z: x[1];
                        """))
                        .isInstanceOf(InstanceBuildException.class)
                        .hasMessageContaining("x[4]");
            }
        }
    }
}
