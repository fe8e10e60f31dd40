package com.tessera.modeling.generator.eval;

import com.tessera.modeling.api.exceptions.InstanceBuildException;
import com.tessera.modeling.api.model.Atom;
import com.tessera.modeling.api.model.Tuple;
import com.tessera.modeling.compiler.ast.Declaration;
import com.tessera.modeling.compiler.ast.ModelDeclarations;
import com.tessera.modeling.compiler.parser.ModelParser;
import com.tessera.modeling.compiler.symbols.ModelValidator;
import com.tessera.modeling.compiler.symbols.ValidatedModel;
import com.tessera.modeling.generator.data.DataBinder;
import com.tessera.modeling.generator.data.ModelData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Expression evaluation")
class ExpressionEvaluatorTest {

    private ValidatedModel model;
    private ModelData data;

    private void load(String text) {
        ModelDeclarations declarations = ModelParser.parse(text);
        model = ModelValidator.validate(declarations);
        data = DataBinder.bind(model, declarations.data());
    }

    private Atom parameter(String name) {
        return data.parameters().get(name).get(Tuple.EMPTY);
    }

    /**
     * Evaluates the left-hand side of the named constraint with every x[i], i in I, as a column.
     */
    private LinearForm lhsOf(String constraint) {
        VariableIndex index = new VariableIndex();
        for (Tuple member : data.sets().get("I")) {
            index.register(new VariableRef("x", member));
        }
        ExpressionEvaluator evaluator = new ExpressionEvaluator(model.symbols(), data, index);
        Declaration.ConstraintDecl decl = model.ofType(Declaration.ConstraintDecl.class).stream()
                .filter(c -> c.name().equals(constraint))
                .findFirst()
                .orElseThrow();
        return evaluator.evaluate(decl.lhs(), Bindings.EMPTY);
    }

    // ========================================================================
    // Constant arithmetic
    // ========================================================================

    @Nested
    @DisplayName("Constant arithmetic")
    class ConstantArithmetic {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "2 + 3 * 4          | 14",
                "(2 + 3) * 4        | 20",
                "2 ^ 3 ^ 2          | 512",
                "-2 ^ 2             | -4",
                "7 mod 3            | 1",
                "-7 mod 3           | 2",
                "7 div 2            | 3",
                "10 / 4             | 2.5",
                "abs(-3) + floor(2.7) + ceil(2.1) | 8",
                "min(4, 2, 9) + max(4, 2, 9)      | 11",
                "if 2 > 1 then 5 else 7           | 5",
                "if 'a' = 'b' then 5              | 0",
                "1 < 2 and not 3 < 2              | 1",
        })
        void shouldEvaluateConstantExpression(String expression, double expected) {
            load("param v := " + expression + "; var x; minimize z: x;");

            assertThat(parameter("v").number()).isEqualTo(expected);
        }

        @Test
        void shouldReportDivisionByZero() {
            assertThatThrownBy(() -> load("param v := 1 / (2 - 2); var x; minimize z: x;"))
                    .isInstanceOf(InstanceBuildException.class)
                    .hasMessageContaining("Division by zero");
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
                "(-1) ^ 0.5                  | ^",
                "1e308 * 10 - 1e308 * 10     | -",
        })
        @DisplayName("Arithmetic that yields no number is a build error at the operator")
        void shouldRejectNotANumber(String expression, String operator) {
            assertThatThrownBy(() -> load("param v := " + expression + "; var x; minimize z: x;"))
                    .isInstanceOf(InstanceBuildException.class)
                    .hasMessageContaining("Operator '" + operator + "' does not yield a number")
                    .satisfies(e -> assertThat(((InstanceBuildException) e).getLocation()).isPresent());
        }

        @Test
        void shouldCompareSymbolsLexically() {
            load("""
                    set S := {'apple', 'pear'};
                    param first{s in S} := if s < 'banana' then 1 else 0;
                    var x; minimize z: x;
                    """);

            assertThat(data.parameters().get("first").get(Tuple.of("apple")).number()).isEqualTo(1.0);
            assertThat(data.parameters().get("first").get(Tuple.of("pear")).number()).isEqualTo(0.0);
        }

        @Test
        void shouldTestTupleMembership() {
            load("""
                    set ARCS dimen 2 := {(1, 2), (2, 3)};
                    param has := if (1, 2) in ARCS and (3, 1) not in ARCS then 1 else 0;
                    var x; minimize z: x;
                    """);

            assertThat(parameter("has").number()).isEqualTo(1.0);
        }
    }

    // ========================================================================
    // Linear forms
    // ========================================================================

    @Nested
    @DisplayName("Linear forms")
    class LinearForms {

        private static final String MODEL = """
                set I := 1..3;
                param c{i in I} := i * 2;
                var x{I};
                s.t. Weighted: sum{i in I} c[i] * x[i] + 4 >= 0;
                s.t. Scaled: (x[1] + x[2]) / 2 - x[1] >= 0;
                s.t. Product: x[1] * x[2] >= 0;
                s.t. Quotient: 1 / x[1] >= 0;
                s.t. Power: x[1] ^ 2 >= 0;
                minimize z: x[1];
                """;

        @Test
        void shouldCollectSumTerms() {
            load(MODEL);

            LinearForm form = lhsOf("Weighted");

            assertThat(form.coefficient(new VariableRef("x", Tuple.of(1)))).isEqualTo(2.0);
            assertThat(form.coefficient(new VariableRef("x", Tuple.of(3)))).isEqualTo(6.0);
            assertThat(form.constant()).isEqualTo(4.0);
        }

        @Test
        void shouldDistributeConstantDivision() {
            load(MODEL);

            LinearForm form = lhsOf("Scaled");

            assertThat(form.coefficient(new VariableRef("x", Tuple.of(1)))).isEqualTo(-0.5);
            assertThat(form.coefficient(new VariableRef("x", Tuple.of(2)))).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Products and quotients of variables are rejected as non-linear")
        void shouldRejectNonLinearTerms() {
            load(MODEL);

            assertThatThrownBy(() -> lhsOf("Product"))
                    .isInstanceOf(InstanceBuildException.class)
                    .hasMessageContaining("Non-linear term");
            assertThatThrownBy(() -> lhsOf("Quotient"))
                    .isInstanceOf(InstanceBuildException.class)
                    .hasMessageContaining("Non-linear term: division");
            assertThatThrownBy(() -> lhsOf("Power"))
                    .isInstanceOf(InstanceBuildException.class)
                    .hasMessageContaining("requires constant operands");
        }

        @Test
        void shouldRejectVariableOutsideDomain() {
            load("""
                    set I := 1..2;
                    var x{I};
                    s.t. Shifted{i in I}: x[i + 1] >= 0;
                    minimize z: x[1];
                    """);

            VariableIndex index = new VariableIndex();
            index.register(new VariableRef("x", Tuple.of(1)));
            index.register(new VariableRef("x", Tuple.of(2)));
            ExpressionEvaluator evaluator = new ExpressionEvaluator(model.symbols(), data, index);
            Declaration.ConstraintDecl shifted = model.ofType(Declaration.ConstraintDecl.class).get(0);

            assertThat(evaluator.evaluate(shifted.lhs(), Bindings.EMPTY.bind("i", Atom.of(1))).size()).isEqualTo(1);
            assertThatThrownBy(() -> evaluator.evaluate(shifted.lhs(), Bindings.EMPTY.bind("i", Atom.of(2))))
                    .isInstanceOf(InstanceBuildException.class)
                    .hasMessageContaining("x[3] is referenced outside its declared domain");
        }
    }
}
