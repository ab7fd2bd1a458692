package io.surfworks.arrowforge.rewrite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.surfworks.arrowforge.config.SearchConfig;
import io.surfworks.arrowforge.path.Path;

@DisplayName("RewriteEngine")
class RewriteEngineTest {

    private static RelationSet<String> swap() {
        return new RelationSet<String>().add("swap", List.of("a", "b"), List.of("b", "a"));
    }

    private static RewriteStep step(String relation, int offset, Direction direction) {
        return new RewriteStep(relation, offset, direction);
    }

    @Nested
    @DisplayName("Reflexivity")
    class ReflexivityTests {

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 64})
        @DisplayName("equal paths are proved with an empty certificate for any budget")
        void equalPathsProved(int budget) {
            RewriteEngine<String> engine = new RewriteEngine<>(swap());
            Path<String> p = Path.of("a", "b", "c");

            SearchResult result = engine.search(p, p, budget);

            assertEquals(SearchOutcome.PROVED, result.outcome());
            assertTrue(result.certificate().isEmpty());
            assertEquals(0, result.expansions());
        }

        @Test
        @DisplayName("equal paths are proved with no relations at all")
        void equalPathsWithoutRelations() {
            RewriteEngine<String> engine = new RewriteEngine<>(new RelationSet<>());
            assertTrue(engine.check(Path.of("x"), Path.of("x"), 0));
        }
    }

    @Nested
    @DisplayName("Proofs")
    class ProofTests {

        @Test
        @DisplayName("swapping two generators takes one forward step at offset 0")
        void singleSwap() {
            RewriteEngine<String> engine = new RewriteEngine<>(swap());

            SearchResult result = engine.search(Path.of("a", "b"), Path.of("b", "a"), 64);

            assertTrue(result.verdict());
            assertEquals(List.of(step("swap", 0, Direction.FORWARD)), result.certificate().steps());
            assertEquals(1, result.expansions());
            assertEquals(2, result.visited());
        }

        @Test
        @DisplayName("a relation's sides are provably equal in one step")
        void relationSoundness() {
            RelationSet<String> relations = new RelationSet<String>()
                    .add("assoc", List.of("f", "g", "h"), List.of("k"));
            RewriteEngine<String> engine = new RewriteEngine<>(relations);

            SearchResult result = engine.search(Path.of("f", "g", "h"), Path.of("k"), 1);

            assertEquals(List.of(step("assoc", 0, Direction.FORWARD)), result.certificate().steps());
        }

        @Test
        @DisplayName("rewrites inside a longer path at the matching offset")
        void subpathRewrite() {
            RewriteEngine<String> engine = new RewriteEngine<>(swap());

            SearchResult result = engine.search(Path.of("x", "a", "b", "y"), Path.of("x", "b", "a", "y"), 64);

            assertTrue(result.verdict());
            assertEquals(1, result.certificate().steps().get(0).offset());
        }

        @Test
        @DisplayName("applies relations right to left when needed")
        void backwardStep() {
            RelationSet<String> relations = new RelationSet<String>()
                    .add("idem", List.of("e", "e"), List.of("e"));
            RewriteEngine<String> engine = new RewriteEngine<>(relations);

            SearchResult result = engine.search(Path.of("e"), Path.of("e", "e"), 8);

            assertEquals(List.of(step("idem", 0, Direction.BACKWARD)), result.certificate().steps());
        }

        @Test
        @DisplayName("tries relations in registration order")
        void registrationOrder() {
            RelationSet<String> relations = new RelationSet<String>()
                    .add("first", List.of("a"), List.of("c"))
                    .add("second", List.of("a"), List.of("c"));
            RewriteEngine<String> engine = new RewriteEngine<>(relations);

            SearchResult result = engine.search(Path.of("a"), Path.of("c"), 8);

            assertEquals("first", result.certificate().steps().get(0).relationName());
        }

        @Test
        @DisplayName("multi-step proofs replay to the end path")
        void certificateReplays() {
            RelationSet<String> relations = swap();
            RewriteEngine<String> engine = new RewriteEngine<>(relations);
            Path<String> start = Path.of("a", "a", "b");
            Path<String> end = Path.of("b", "a", "a");

            SearchResult result = engine.search(start, end, 64);

            assertEquals(List.of(step("swap", 1, Direction.FORWARD), step("swap", 0, Direction.FORWARD)),
                    result.certificate().steps());
            assertEquals(end, result.certificate().replay(start, relations));
            assertTrue(result.certificate().verifies(start, end, relations));
        }

        @Test
        @DisplayName("searching a diagram uses the configured budget")
        void searchDiagram() {
            RewriteEngine<String> engine = new RewriteEngine<>(swap(), new SearchConfig(4));

            SearchResult result = engine.search(Diagram.of(Path.of("a", "b"), Path.of("b", "a")));

            assertTrue(result.verdict());
        }
    }

    @Nested
    @DisplayName("Budget")
    class BudgetTests {

        @Test
        @DisplayName("budget 0 never proves distinct paths")
        void zeroBudget() {
            RewriteEngine<String> engine = new RewriteEngine<>(swap());

            SearchResult result = engine.search(Path.of("a", "b"), Path.of("b", "a"), 0);

            assertFalse(result.verdict());
            assertEquals(SearchOutcome.UNKNOWN, result.outcome());
            assertEquals(0, result.expansions());
        }

        @Test
        @DisplayName("a proof found with budget N is found with any larger budget")
        void monotonicity() {
            RewriteEngine<String> engine = new RewriteEngine<>(swap());
            Path<String> start = Path.of("a", "a", "b");
            Path<String> end = Path.of("b", "a", "a");

            SearchResult tight = engine.search(start, end, 2);
            SearchResult loose = engine.search(start, end, 100);

            assertTrue(tight.verdict());
            assertTrue(loose.verdict());
            assertEquals(tight.certificate(), loose.certificate());
        }

        @Test
        @DisplayName("running out of budget before the proof is unknown")
        void budgetTooSmall() {
            RewriteEngine<String> engine = new RewriteEngine<>(swap());

            SearchResult result = engine.search(Path.of("a", "a", "b"), Path.of("b", "a", "a"), 1);

            assertTrue(result.isUnknown());
            assertTrue(result.certificate().isEmpty());
        }

        @Test
        @DisplayName("rejects a negative budget")
        void negativeBudget() {
            RewriteEngine<String> engine = new RewriteEngine<>(swap());
            assertThrows(IllegalArgumentException.class,
                    () -> engine.search(Path.of("a"), Path.of("b"), -1));
        }
    }

    @Nested
    @DisplayName("Outcomes")
    class OutcomeTests {

        @Test
        @DisplayName("exhausting a finite equivalence class refutes")
        void refuted() {
            RewriteEngine<String> engine = new RewriteEngine<>(swap());

            SearchResult result = engine.search(Path.of("a", "b"), Path.of("c", "d"), 64);

            assertEquals(SearchOutcome.REFUTED, result.outcome());
            assertEquals(2, result.expansions());
            assertEquals(2, result.visited());
            assertFalse(result.verdict());
        }

        @Test
        @DisplayName("an unbounded equivalence class stays unknown")
        void unknownOnGrowingClass() {
            RelationSet<String> relations = new RelationSet<String>()
                    .add("grow", List.of("e"), List.of("e", "e"));
            RewriteEngine<String> engine = new RewriteEngine<>(relations);

            SearchResult result = engine.search(Path.of("e"), Path.of("f"), 5);

            assertEquals(SearchOutcome.UNKNOWN, result.outcome());
            assertEquals(5, result.expansions());
        }

        @Test
        @DisplayName("only proved results carry a certificate")
        void resultInvariant() {
            Certificate nonEmpty = Certificate.of(List.of(step("swap", 0, Direction.FORWARD)));
            assertThrows(IllegalArgumentException.class,
                    () -> new SearchResult(SearchOutcome.REFUTED, nonEmpty, 1, 1));
        }
    }

    @Test
    @DisplayName("lists one-step neighbours in search order")
    void neighbours() {
        RelationSet<String> relations = swap()
                .add("idem", List.of("a", "a"), List.of("a"));
        RewriteEngine<String> engine = new RewriteEngine<>(relations);

        List<RewriteEngine.Rewrite<String>> next = engine.neighbours(Path.of("a", "a", "b"));

        assertEquals(4, next.size());
        assertEquals(Path.of("a", "b", "a"), next.get(0).path());
        assertEquals(step("swap", 1, Direction.FORWARD), next.get(0).step());
        assertEquals(Path.of("a", "b"), next.get(1).path());
        assertEquals(step("idem", 0, Direction.FORWARD), next.get(1).step());
        assertEquals(Path.of("a", "a", "a", "b"), next.get(2).path());
        assertEquals(step("idem", 0, Direction.BACKWARD), next.get(2).step());
        assertEquals(Path.of("a", "a", "a", "b"), next.get(3).path());
        assertEquals(step("idem", 1, Direction.BACKWARD), next.get(3).step());
    }
}
