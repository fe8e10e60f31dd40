package com.tessera.modeling.generator.data;

import com.tessera.modeling.api.exceptions.InvalidDataException;
import com.tessera.modeling.api.exceptions.MissingParameterValueException;
import com.tessera.modeling.api.exceptions.UnknownSymbolException;
import com.tessera.modeling.api.model.Atom;
import com.tessera.modeling.api.model.Tuple;
import com.tessera.modeling.compiler.ast.ModelDeclarations;
import com.tessera.modeling.compiler.parser.ModelParser;
import com.tessera.modeling.compiler.symbols.ModelValidator;
import com.tessera.modeling.compiler.symbols.ValidatedModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Data binding")
class DataBinderTest {

    private static final String TRANSPORT = """
            set PLANTS;
            set MARKETS;
            param supply{PLANTS} >= 0;
            param cost{PLANTS, MARKETS} default 99;
            param label{PLANTS} symbolic default 'none';
            var ship{PLANTS, MARKETS} >= 0;
            minimize total: sum{p in PLANTS, m in MARKETS} cost[p, m] * ship[p, m];
            """;

    private static ModelData bind(String model, String data) {
        ModelDeclarations declarations = ModelParser.parse(model).withData(ModelParser.parseData(data));
        ValidatedModel validated = ModelValidator.validate(declarations);
        return DataBinder.bind(validated, declarations.data());
    }

    private static double number(ModelData data, String param, Object... key) {
        return data.parameters().get(param).get(Tuple.of(key)).number();
    }

    // ========================================================================
    // Data formats
    // ========================================================================

    @Nested
    @DisplayName("Data formats")
    class Formats {

        @Test
        void shouldBindFlatRecords() {
            ModelData data = bind(TRANSPORT, """
                    set PLANTS := Seattle 'San Diego';
                    set MARKETS := NY;
                    param supply := Seattle 350 'San Diego' 600;
                    param cost := Seattle NY 2.5 'San Diego' NY 1.8;
                    """);

            assertThat(data.sets().get("PLANTS").toList())
                    .containsExactly(Tuple.of("Seattle"), Tuple.of("San Diego"));
            assertThat(number(data, "supply", "San Diego")).isEqualTo(600.0);
            assertThat(number(data, "cost", "Seattle", "NY")).isEqualTo(2.5);
        }

        @Test
        @DisplayName("Tables give one value per row key and column key, '.' falls back to the default")
        void shouldBindTables() {
            ModelData data = bind(TRANSPORT, """
                    set PLANTS := P1 P2;
                    set MARKETS := M1 M2;
                    param supply := P1 10 P2 20;
                    param cost : M1 M2 :=
                        P1  4  .
                        P2  6  7;
                    """);

            assertThat(number(data, "cost", "P1", "M1")).isEqualTo(4.0);
            assertThat(number(data, "cost", "P1", "M2")).isEqualTo(99.0);
            assertThat(number(data, "cost", "P2", "M2")).isEqualTo(7.0);
        }

        @Test
        void shouldBindTabbingData() {
            ModelData data = bind("""
                    set P;
                    param lo{P};
                    param hi{P};
                    var x{p in P} >= lo[p], <= hi[p];
                    minimize z: sum{p in P} x[p];
                    """, """
                    set P := a b;
                    param : lo hi :=
                        a  1  5
                        b  2  6;
                    """);

            assertThat(number(data, "lo", "b")).isEqualTo(2.0);
            assertThat(number(data, "hi", "a")).isEqualTo(5.0);
        }

        @Test
        @DisplayName("Data-level default wins over the declared default")
        void shouldPreferDataDefault() {
            ModelData data = bind(TRANSPORT, """
                    set PLANTS := P1 P2;
                    set MARKETS := M1;
                    param supply := P1 1 P2 2;
                    param cost default 5 := P1 M1 3;
                    """);

            assertThat(number(data, "cost", "P1", "M1")).isEqualTo(3.0);
            assertThat(number(data, "cost", "P2", "M1")).isEqualTo(5.0);
            assertThat(data.parameters().get("label").get(Tuple.of("P2"))).isEqualTo(Atom.of("none"));
        }

        @Test
        void shouldReadDimensionTwoSetMembersInPairs() {
            ModelData data = bind("""
                    set ARCS dimen 2;
                    var x{ARCS};
                    minimize z: sum{(i, j) in ARCS} x[i, j];
                    """, "set ARCS := 1 2  2 3  3 1;");

            assertThat(data.sets().get("ARCS").toList())
                    .containsExactly(Tuple.of(1, 2), Tuple.of(2, 3), Tuple.of(3, 1));
        }
    }

    // ========================================================================
    // Missing and invalid data
    // ========================================================================

    @Nested
    @DisplayName("Missing and invalid data")
    class Failures {

        @Test
        @DisplayName("A missing parameter entry names the parameter and the tuple")
        void shouldNameMissingTuple() {
            ModelData data = bind(TRANSPORT, """
                    set PLANTS := P1 P2;
                    set MARKETS := M1;
                    param supply := P1 10;
                    """);

            assertThatThrownBy(data::requireComplete)
                    .isInstanceOf(MissingParameterValueException.class)
                    .hasMessageContaining("supply[P2]")
                    .satisfies(e -> {
                        MissingParameterValueException missing = (MissingParameterValueException) e;
                        assertThat(missing.getParameter()).isEqualTo("supply");
                        assertThat(missing.getTuple()).isEqualTo(Tuple.of("P2"));
                    });
        }

        @Test
        @DisplayName("Unvalued members are kept aside and fail only when read")
        void shouldDeferMissingValueUntilRead() {
            ModelData data = bind(TRANSPORT, """
                    set PLANTS := P1 P2 P3;
                    set MARKETS := M1;
                    param supply := P1 10;
                    """);

            ParameterTable supply = data.parameters().get("supply");
            assertThat(supply.isComplete()).isFalse();
            assertThat(supply.unvalued()).containsExactly(Tuple.of("P2"), Tuple.of("P3"));
            assertThat(supply.get(Tuple.of("P2"))).isNull();
            assertThat(number(data, "supply", "P1")).isEqualTo(10.0);
            assertThatThrownBy(() -> data.parameter("supply", Tuple.of("P3"), null))
                    .isInstanceOf(MissingParameterValueException.class)
                    .hasMessageContaining("supply[P3]");
        }

        @Test
        void shouldBeCompleteWhenEveryMemberHasValue() {
            ModelData data = bind(TRANSPORT, """
                    set PLANTS := P1 P2;
                    set MARKETS := M1;
                    param supply := P1 10 P2 20;
                    """);

            assertThatCode(data::requireComplete).doesNotThrowAnyException();
        }

        @Test
        void shouldRequireSetData() {
            assertThatThrownBy(() -> bind(TRANSPORT, "set PLANTS := P1;"))
                    .isInstanceOf(MissingParameterValueException.class)
                    .hasMessageContaining("MARKETS");
        }

        @Test
        void shouldRejectValueViolatingCheck() {
            assertThatThrownBy(() -> bind(TRANSPORT, """
                    set PLANTS := P1;
                    set MARKETS := M1;
                    param supply := P1 -4;
                    """))
                    .isInstanceOf(InvalidDataException.class)
                    .hasMessageContaining("supply[P1]")
                    .hasMessageContaining(">= 0");
        }

        @Test
        void shouldRejectSymbolForNumericParameter() {
            assertThatThrownBy(() -> bind(TRANSPORT, """
                    set PLANTS := P1;
                    set MARKETS := M1;
                    param supply := P1 lots;
                    """))
                    .isInstanceOf(InvalidDataException.class)
                    .hasMessageContaining("must be numeric");
        }

        @Test
        void shouldRejectKeyOutsideDomain() {
            assertThatThrownBy(() -> bind(TRANSPORT, """
                    set PLANTS := P1;
                    set MARKETS := M1;
                    param supply := P1 1 P9 2;
                    """))
                    .isInstanceOf(InvalidDataException.class)
                    .hasMessageContaining("supply[P9] is outside the domain");
        }

        @Test
        void shouldRejectDuplicateEntry() {
            assertThatThrownBy(() -> bind(TRANSPORT, """
                    set PLANTS := P1;
                    set MARKETS := M1;
                    param supply := P1 1 P1 2;
                    """))
                    .isInstanceOf(InvalidDataException.class)
                    .hasMessageContaining("given twice");
        }

        @Test
        void shouldRejectDuplicateSetMember() {
            assertThatThrownBy(() -> bind(TRANSPORT, """
                    set PLANTS := P1 P1;
                    set MARKETS := M1;
                    param supply := P1 1;
                    """))
                    .isInstanceOf(InvalidDataException.class)
                    .hasMessageContaining("Duplicate member");
        }

        @Test
        void shouldRejectDataForUnknownSymbol() {
            assertThatThrownBy(() -> bind(TRANSPORT, "param nothing := 1;"))
                    .isInstanceOf(UnknownSymbolException.class);
        }

        @Test
        void shouldRejectDataForVariable() {
            assertThatThrownBy(() -> bind(TRANSPORT, "param ship := P1 M1 3;"))
                    .isInstanceOf(InvalidDataException.class);
        }

        @Test
        void shouldRejectDataForDefinedParameter() {
            assertThatThrownBy(() -> bind("""
                    param n := 3;
                    var x; minimize z: x;
                    """, "param n := 4;"))
                    .isInstanceOf(InvalidDataException.class)
                    .hasMessageContaining("defined in the model");
        }
    }
}
