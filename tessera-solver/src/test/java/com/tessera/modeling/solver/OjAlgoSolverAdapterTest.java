package com.tessera.modeling.solver;

import com.tessera.modeling.api.model.Instance;
import com.tessera.modeling.api.model.Row;
import com.tessera.modeling.api.model.Solution;
import com.tessera.modeling.api.model.SolveBudget;
import com.tessera.modeling.api.model.SolverStatus;
import com.tessera.modeling.api.model.VariableValue;
import com.tessera.modeling.core.config.EngineConfig;
import com.tessera.modeling.core.telemetry.TracingService;
import com.tessera.modeling.generator.ModelCompiler;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.ojalgo.optimisation.Optimisation;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ojAlgo solver adapter")
class OjAlgoSolverAdapterTest {

    private static final SolveBudget BUDGET = SolveBudget.ofTime(Duration.ofSeconds(30));

    private static ModelCompiler compiler;
    private static OjAlgoSolverAdapter solver;

    @BeforeAll
    static void setUp() {
        compiler = new ModelCompiler(TracingService.noopTracer(), new EngineConfig(2, Duration.ofSeconds(30), 0));
        solver = new OjAlgoSolverAdapter(TracingService.noopTracer());
    }

    @AfterAll
    static void tearDown() {
        compiler.close();
        solver.close();
    }

    private static final String SUPPLY_CHAIN = """
            set PRODUCTS; set MONTHS; set PLANTS; set CUSTOMERS;
            param price{PRODUCTS} >= 0;
            param demand{PRODUCTS, MONTHS, CUSTOMERS} >= 0;
            param prod_cost{PRODUCTS, PLANTS} >= 0;
            param capacity{PLANTS, MONTHS} >= 0;
            param hold_cost >= 0;
            param ship_cost{PLANTS, CUSTOMERS} >= 0;

            var produce{PRODUCTS, MONTHS, PLANTS} >= 0;
            var inventory{PRODUCTS, MONTHS, PLANTS} >= 0;
            var ship{PRODUCTS, MONTHS, PLANTS, CUSTOMERS} >= 0;
            var sales{PRODUCTS, MONTHS, CUSTOMERS} >= 0;

            maximize profit:
                sum{p in PRODUCTS, m in MONTHS, c in CUSTOMERS} price[p] * sales[p, m, c]
              - sum{p in PRODUCTS, m in MONTHS, f in PLANTS} prod_cost[p, f] * produce[p, m, f]
              - sum{p in PRODUCTS, m in MONTHS, f in PLANTS} hold_cost * inventory[p, m, f]
              - sum{p in PRODUCTS, m in MONTHS, f in PLANTS, c in CUSTOMERS} ship_cost[f, c] * ship[p, m, f, c];

            s.t. Capacity{f in PLANTS, m in MONTHS}: sum{p in PRODUCTS} produce[p, m, f] <= capacity[f, m];
            s.t. FirstBalance{p in PRODUCTS, m in MONTHS, f in PLANTS : m = 1}:
                produce[p, m, f] = inventory[p, m, f] + sum{c in CUSTOMERS} ship[p, m, f, c];
            s.t. Balance{p in PRODUCTS, m in MONTHS, f in PLANTS : m > 1}:
                inventory[p, m - 1, f] + produce[p, m, f] = inventory[p, m, f] + sum{c in CUSTOMERS} ship[p, m, f, c];
            s.t. Delivery{p in PRODUCTS, m in MONTHS, c in CUSTOMERS}:
                sales[p, m, c] = sum{f in PLANTS} ship[p, m, f, c];
            s.t. MinDemand{p in PRODUCTS, m in MONTHS, c in CUSTOMERS}: sales[p, m, c] >= 0.5 * demand[p, m, c];
            s.t. MaxDemand{p in PRODUCTS, m in MONTHS, c in CUSTOMERS}: sales[p, m, c] <= demand[p, m, c];
            """;

    private static final String SUPPLY_CHAIN_DATA = """
            set PRODUCTS := A B;
            set MONTHS := 1;
            set PLANTS := F1;
            set CUSTOMERS := C1;
            param price := A 10 B 12;
            param demand := A 1 C1 100 B 1 C1 100;
            param prod_cost : F1 := A 3 B 4;
            param capacity : 1 := F1 500;
            param hold_cost := 0.5;
            param ship_cost : C1 := F1 1;
            """;

    private static final String TSP = """
            param n integer >= 2;
            set NODES := 1..n;
            param dist{NODES, NODES} >= 0;
            var x{i in NODES, j in NODES : i <> j} binary;
            var flow{i in NODES, j in NODES : i <> j} >= 0;
            minimize tour: sum{i in NODES, j in NODES : i <> j} dist[i, j] * x[i, j];
            s.t. Leave{i in NODES}: sum{j in NODES : j <> i} x[i, j] = 1;
            s.t. Enter{j in NODES}: sum{i in NODES : i <> j} x[i, j] = 1;
            s.t. FlowBalance{i in NODES}:
                sum{j in NODES : j <> i} flow[i, j] - sum{j in NODES : j <> i} flow[j, i]
                    = if i = 1 then n - 1 else -1;
            s.t. FlowCapacity{i in NODES, j in NODES : i <> j}: flow[i, j] <= (n - 1) * x[i, j];
            data;
            param n := 3;
            param dist : 1 2 3 :=
                1   0 10 10
                2  10  0 10
                3  10 10  0;
            end;
            """;

    // ========================================================================
    // Optimal solutions
    // ========================================================================

    @Nested
    @DisplayName("Optimal solutions")
    class Optimal {

        @Test
        @DisplayName("Supply chain: demand bounds become rows and the objective matches the solution")
        void shouldSolveSupplyChain() {
            Instance instance = compiler.compile(SUPPLY_CHAIN, SUPPLY_CHAIN_DATA);

            assertThat(instance.rowsOf("MinDemand")).hasSize(2).extracting(Row::rhs).containsOnly(50.0);
            assertThat(instance.rowsOf("MaxDemand")).hasSize(2).extracting(Row::rhs).containsOnly(100.0);
            assertThat(instance.rowsOf("Balance")).isEmpty();

            Solution solution = solver.solve(instance, BUDGET);

            assertThat(solution.status()).isEqualTo(SolverStatus.OPTIMAL);
            double sales = solution.value("sales[A,1,C1]").orElseThrow() * 10
                    + solution.value("sales[B,1,C1]").orElseThrow() * 12;
            double costs = solution.value("produce[A,1,F1]").orElseThrow() * 3
                    + solution.value("produce[B,1,F1]").orElseThrow() * 4
                    + (solution.value("inventory[A,1,F1]").orElseThrow()
                    + solution.value("inventory[B,1,F1]").orElseThrow()) * 0.5
                    + solution.value("ship[A,1,F1,C1]").orElseThrow()
                    + solution.value("ship[B,1,F1,C1]").orElseThrow();
            assertThat(solution.objectiveValue()).isCloseTo(sales - costs, within(1e-6));
            assertThat(solution.objectiveValue()).isCloseTo(1300.0, within(1e-6));
            assertThat(solution.value("sales[A,1,C1]").orElseThrow()).isCloseTo(100.0, within(1e-6));
        }

        @Test
        @DisplayName("Three-node tour with equal weights costs 30 with one arc in and out of every node")
        void shouldSolveThreeNodeTour() {
            Instance instance = compiler.compile(TSP, null);

            Solution solution = solver.solve(instance, BUDGET);

            assertThat(solution.status()).isEqualTo(SolverStatus.OPTIMAL);
            assertThat(solution.objectiveValue()).isCloseTo(30.0, within(1e-6));
            for (int node = 1; node <= 3; node++) {
                double out = 0;
                double in = 0;
                for (VariableValue v : solution.values()) {
                    if (!v.name().equals("x")) {
                        continue;
                    }
                    if (v.index().get(0).number() == node) out += v.value();
                    if (v.index().get(1).number() == node) in += v.value();
                }
                assertThat(out).as("arcs leaving %d", node).isCloseTo(1.0, within(1e-6));
                assertThat(in).as("arcs entering %d", node).isCloseTo(1.0, within(1e-6));
            }
        }

        @Test
        void shouldAddObjectiveOffset() {
            Instance instance = compiler.compile("var x >= 2, <= 5; minimize z: 3 * x + 7;", null);

            Solution solution = solver.solve(instance, BUDGET);

            assertThat(solution.status()).isEqualTo(SolverStatus.OPTIMAL);
            assertThat(solution.objectiveValue()).isCloseTo(13.0, within(1e-6));
            assertThat(solution.values()).singleElement()
                    .satisfies(v -> assertThat(v.label()).isEqualTo("x"));
        }

        @Test
        void shouldHonourIntegrality() {
            Instance instance = compiler.compile("""
                    var k integer >= 0;
                    maximize z: k;
                    s.t. Limit: 2 * k <= 7;
                    """, null);

            Solution solution = solver.solve(instance, BUDGET);

            assertThat(solution.status()).isEqualTo(SolverStatus.OPTIMAL);
            assertThat(solution.value("k").orElseThrow()).isCloseTo(3.0, within(1e-6));
        }
    }

    // ========================================================================
    // Terminal statuses
    // ========================================================================

    @Nested
    @DisplayName("Terminal statuses")
    class Statuses {

        @Test
        void shouldReportInfeasible() {
            Instance instance = compiler.compile("""
                    var x >= 0; var y >= 0;
                    minimize z: x + y;
                    s.t. AtLeast: x + y >= 5;
                    s.t. AtMost: x + y <= 3;
                    """, null);

            Solution solution = solver.solve(instance, BUDGET);

            assertThat(solution.status()).isEqualTo(SolverStatus.INFEASIBLE);
            assertThat(solution.hasPoint()).isFalse();
        }

        @Test
        void shouldNotReportUnboundedProblemAsOptimal() {
            Instance instance = compiler.compile("""
                    var x >= 0; var y >= 0;
                    maximize z: x + y;
                    s.t. Gap: x - y <= 1;
                    """, null);

            Solution solution = solver.solve(instance, BUDGET);

            assertThat(solution.status()).isNotEqualTo(SolverStatus.OPTIMAL);
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "OPTIMAL, OPTIMAL",
                "DISTINCT, OPTIMAL",
                "INFEASIBLE, INFEASIBLE",
                "UNBOUNDED, UNBOUNDED",
                "FEASIBLE, TIME_LIMIT",
                "APPROXIMATE, TIME_LIMIT",
                "FAILED, FAILED",
                "INVALID, FAILED",
                "UNEXPLORED, FAILED",
        })
        void shouldMapBackendStates(Optimisation.State state, SolverStatus expected) {
            assertThat(OjAlgoSolverAdapter.statusOf(state)).isEqualTo(expected);
        }

        @Test
        void shouldNameBackend() {
            assertThat(solver.backendName()).isEqualTo("ojalgo");
        }
    }
}
