package com.tessera.modeling.compiler.symbols;

import com.tessera.modeling.api.exceptions.CyclicDefinitionException;
import com.tessera.modeling.api.exceptions.DuplicateSymbolException;
import com.tessera.modeling.api.exceptions.InstanceBuildException;
import com.tessera.modeling.api.exceptions.ModelSyntaxException;
import com.tessera.modeling.api.exceptions.ShapeMismatchException;
import com.tessera.modeling.api.exceptions.UnknownSymbolException;
import com.tessera.modeling.compiler.ast.Declaration;
import com.tessera.modeling.compiler.parser.ModelParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Model validator")
class ModelValidatorTest {

    private static ValidatedModel validate(String text) {
        return ModelValidator.validate(ModelParser.parse(text));
    }

    @Test
    @DisplayName("Should compute arity and set dimensions")
    void shouldComputeShapes() {
        ValidatedModel model = validate("""
                set I; set ARCS dimen 2;
                set PAIRS := I cross I;
                param w{ARCS};
                var x{(i, j) in ARCS, k in I};
                minimize z: sum{(i, j) in ARCS, k in I} w[i, j] * x[i, j, k];
                """);

        SymbolTable symbols = model.symbols();
        assertThat(symbols.resolve("PAIRS").dimension()).isEqualTo(2);
        assertThat(symbols.resolve("w").arity()).isEqualTo(2);
        assertThat(symbols.resolve("x").arity()).isEqualTo(3);
        assertThat(symbols.resolve("z").kind()).isEqualTo(SymbolKind.OBJECTIVE);
    }

    @Test
    @DisplayName("Evaluation order places definitions after their dependencies")
    void shouldOrderDefinitionsTopologically() {
        ValidatedModel model = validate("""
                param total := a + b;
                param a := b * 2;
                param b;
                set S := 1..total;
                var x; minimize z: x;
                """);

        assertThat(model.evaluationOrder()).extracting(Declaration::name).containsExactly("b", "a", "total", "S");
    }

    @Test
    @DisplayName("Should name the cycle in a cyclic definition")
    void shouldDetectCycle() {
        assertThatThrownBy(() -> validate("""
                param a := b + 1;
                param b := c;
                param c := a;
                var x; minimize z: x;
                """))
                .isInstanceOf(CyclicDefinitionException.class)
                .hasMessageContaining("a -> b -> c -> a");
    }

    @Test
    void shouldDetectSelfReferencingSet() {
        assertThatThrownBy(() -> validate("set S := S union {1}; var x; minimize z: x;"))
                .isInstanceOf(CyclicDefinitionException.class)
                .hasMessageContaining("S -> S");
    }

    @Test
    void shouldRejectDuplicateNames() {
        assertThatThrownBy(() -> validate("set A; param A; var x; minimize z: x;"))
                .isInstanceOf(DuplicateSymbolException.class);
    }

    @Test
    void shouldRejectUnknownReference() {
        assertThatThrownBy(() -> validate("var x; minimize z: x + cost;"))
                .isInstanceOf(UnknownSymbolException.class)
                .hasMessageContaining("'cost'")
                .hasMessageContaining("line 1, column 24");
    }

    @Test
    @DisplayName("Dummies are only visible inside their header's scope")
    void shouldRejectDummyOutsideScope() {
        assertThatThrownBy(() -> validate("""
                set I; var x{I};
                minimize z: sum{i in I} x[i] + x[i];
                """))
                .isInstanceOf(UnknownSymbolException.class)
                .hasMessageContaining("'i'");
    }

    @Test
    void shouldRejectWrongSubscriptCount() {
        assertThatThrownBy(() -> validate("""
                set I; param p{I, I}; var x;
                minimize z: sum{i in I} p[i] * x;
                """))
                .isInstanceOf(ShapeMismatchException.class)
                .satisfies(e -> {
                    ShapeMismatchException ex = (ShapeMismatchException) e;
                    assertThat(ex.getDeclaredArity()).isEqualTo(2);
                    assertThat(ex.getUsedArity()).isEqualTo(1);
                });
    }

    @Test
    void shouldRejectDummyTupleWiderThanSet() {
        assertThatThrownBy(() -> validate("set I; var x{(i, j) in I}; minimize z: 0;"))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void shouldRejectUnionOfDifferentDimensions() {
        assertThatThrownBy(() -> validate("set A; set B dimen 2; set C := A union B; var x; minimize z: x;"))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    @DisplayName("Decision variables cannot appear in parameter definitions or headers")
    void shouldRejectVariableInDefinition() {
        assertThatThrownBy(() -> validate("var x; param p := x + 1; minimize z: x;"))
                .isInstanceOf(ModelSyntaxException.class)
                .hasMessageContaining("Decision variable 'x'");
        assertThatThrownBy(() -> validate("set I; var x{I}; s.t. c{i in I : x[i] > 0}: x[i] <= 1; minimize z: 0;"))
                .isInstanceOf(ModelSyntaxException.class);
    }

    @Test
    void shouldRejectSetUsedAsValue() {
        assertThatThrownBy(() -> validate("set I; var x; minimize z: I * x;"))
                .isInstanceOf(ModelSyntaxException.class)
                .hasMessageContaining("is a set");
    }

    @Test
    void shouldRequireAnObjective() {
        assertThatThrownBy(() -> validate("var x; s.t. c: x >= 1;"))
                .isInstanceOf(InstanceBuildException.class)
                .hasMessageContaining("no objective");
    }
}
