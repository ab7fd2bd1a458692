package io.surfworks.arrowforge.rewrite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.arrowforge.path.Path;

@DisplayName("Relations")
class RelationSetTest {

    @Nested
    @DisplayName("Relation")
    class RelationTests {

        @Test
        @DisplayName("rejects an empty left-hand side")
        void rejectsEmptyLhs() {
            MalformedRelationException e = assertThrows(MalformedRelationException.class,
                    () -> new Relation<>("bad", List.<String>of(), List.of("a")));
            assertEquals("bad", e.getRelationName());
        }

        @Test
        @DisplayName("rejects an empty right-hand side")
        void rejectsEmptyRhs() {
            assertThrows(MalformedRelationException.class,
                    () -> new Relation<>("bad", List.of("a"), List.<String>of()));
        }

        @Test
        @DisplayName("rejects a blank name")
        void rejectsBlankName() {
            assertThrows(MalformedRelationException.class,
                    () -> new Relation<>(" ", List.of("a"), List.of("b")));
        }

        @Test
        @DisplayName("rejects null symbols")
        void rejectsNullSymbols() {
            assertThrows(MalformedRelationException.class,
                    () -> new Relation<>("bad", Arrays.asList("a", null), List.of("b")));
        }

        @Test
        @DisplayName("pattern and replacement swap with direction")
        void directionalSides() {
            Relation<String> idem = Relation.of("idem", List.of("e", "e"), List.of("e"));
            assertEquals(List.of("e", "e"), idem.pattern(Direction.FORWARD));
            assertEquals(List.of("e"), idem.replacement(Direction.FORWARD));
            assertEquals(List.of("e"), idem.pattern(Direction.BACKWARD));
            assertEquals(List.of("e", "e"), idem.replacement(Direction.BACKWARD));
        }
    }

    @Test
    @DisplayName("keeps relations in registration order")
    void registrationOrder() {
        RelationSet<String> relations = new RelationSet<String>()
                .add("swap", List.of("a", "b"), List.of("b", "a"))
                .add("idem", List.of("e", "e"), List.of("e"));

        assertEquals(2, relations.size());
        assertEquals("swap", relations.relations().get(0).name());
        assertEquals("idem", relations.relations().get(1).name());
    }

    @Test
    @DisplayName("relations() is a snapshot")
    void relationsSnapshot() {
        RelationSet<String> relations = new RelationSet<>();
        List<Relation<String>> before = relations.relations();
        relations.add("swap", List.of("a", "b"), List.of("b", "a"));

        assertTrue(before.isEmpty());
        assertThrows(UnsupportedOperationException.class,
                () -> relations.relations().add(Relation.of("x", List.of("x"), List.of("y"))));
    }

    @Test
    @DisplayName("looks relations up by name")
    void lookupByName() {
        RelationSet<String> relations = new RelationSet<String>()
                .add("swap", List.of("a", "b"), List.of("b", "a"));

        assertEquals(List.of("a", "b"), relations.byName("swap").orElseThrow().lhs());
        assertTrue(relations.byName("missing").isEmpty());
    }

    @Test
    @DisplayName("rejects a second relation under a registered name")
    void rejectsDuplicateName() {
        RelationSet<String> relations = new RelationSet<String>()
                .add("r", List.of("a"), List.of("b"));

        MalformedRelationException e = assertThrows(MalformedRelationException.class,
                () -> relations.add("r", List.of("a"), List.of("c")));
        assertEquals("r", e.getRelationName());
        assertEquals(1, relations.size());
    }

    @Test
    @DisplayName("proved certificates replay after a rejected duplicate")
    void replayAfterRejectedDuplicate() {
        RelationSet<String> relations = new RelationSet<String>()
                .add("r", List.of("a"), List.of("b"));
        assertThrows(MalformedRelationException.class,
                () -> relations.add("r", List.of("a"), List.of("c")));
        relations.add("s", List.of("a"), List.of("c"));

        SearchResult result = new RewriteEngine<>(relations).search(Path.of("a"), Path.of("c"), 64);

        assertTrue(result.verdict());
        assertEquals("s", result.certificate().steps().get(0).relationName());
        assertTrue(result.certificate().verifies(Path.of("a"), Path.of("c"), relations));
    }

    @Test
    @DisplayName("rejects a null relation")
    void rejectsNull() {
        assertThrows(MalformedRelationException.class, () -> new RelationSet<String>().add(null));
    }
}
