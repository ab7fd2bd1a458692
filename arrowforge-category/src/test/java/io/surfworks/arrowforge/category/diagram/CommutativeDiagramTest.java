package io.surfworks.arrowforge.category.diagram;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.arrowforge.category.Category;
import io.surfworks.arrowforge.category.CategoryObject;
import io.surfworks.arrowforge.category.Morphism;
import io.surfworks.arrowforge.category.MorphismPath;
import io.surfworks.arrowforge.category.verify.CommutativityProof;

@DisplayName("CommutativeDiagram")
class CommutativeDiagramTest {

    private Category category;
    private CategoryObject a;
    private CategoryObject b;
    private CategoryObject c;
    private Morphism f;
    private Morphism g;
    private Morphism h;
    private Morphism k;

    @BeforeEach
    void setUp() {
        category = new Category("C");
        a = category.addObject("A");
        b = category.addObject("B");
        c = category.addObject("C");
        f = category.addMorphism("f", a, b);
        g = category.addMorphism("g", b, c);
        h = category.addMorphism("h", a, c);
        k = category.addMorphism("k", a, c);
        category.setComposition(f, g, h);
    }

    @Nested
    @DisplayName("Building")
    class BuildingTests {

        @Test
        @DisplayName("rejects objects outside the category")
        void foreignObject() {
            CommutativeDiagram diagram = new CommutativeDiagram("d", category);
            assertThrows(IllegalArgumentException.class, () -> diagram.addObject(new CategoryObject("Z")));
        }

        @Test
        @DisplayName("rejects morphisms outside the category")
        void foreignMorphism() {
            CommutativeDiagram diagram = new CommutativeDiagram("d", category);
            assertThrows(IllegalArgumentException.class, () -> diagram.addMorphism(new Morphism("x", a, b)));
        }

        @Test
        @DisplayName("rejects broken and empty paths")
        void badPaths() {
            CommutativeDiagram diagram = new CommutativeDiagram("d", category);
            assertThrows(IllegalArgumentException.class, () -> diagram.addPath(List.of(g, f)));
            assertThrows(IllegalArgumentException.class, () -> diagram.addPath(List.of()));
        }

        @Test
        @DisplayName("adding a path records its morphisms, objects and the composite")
        void addPath() {
            CommutativeDiagram diagram = new CommutativeDiagram("d", category)
                    .addPath(List.of(f, g))
                    .addMorphism(h);

            assertEquals(3, diagram.objects().size());
            assertEquals(3, diagram.morphisms().size());
            assertEquals(List.of(MorphismPath.of(f, g), MorphismPath.of(h)), diagram.pathsBetween(a, c));
            assertEquals(List.of(MorphismPath.of(f)), diagram.pathsBetween(a, b));
        }

        @Test
        @DisplayName("requiring commutativity of non-parallel paths fails")
        void nonParallel() {
            CommutativeDiagram diagram = new CommutativeDiagram("d", category);
            assertThrows(IllegalArgumentException.class,
                    () -> diagram.requireCommutativity(List.of(f), List.of(h)));
        }
    }

    @Nested
    @DisplayName("Checking")
    class CheckingTests {

        @Test
        @DisplayName("commutes when every required pair composes equally")
        void commutative() {
            CommutativeDiagram diagram = new CommutativeDiagram("tri", category)
                    .addPath(List.of(f, g))
                    .addMorphism(h)
                    .requireCommutativity(List.of(f, g), List.of(h));

            assertTrue(diagram.isCommutative());
            List<CommutativityProof> proofs = diagram.verify();
            assertEquals(1, proofs.size());
            assertTrue(proofs.get(0).valid());
            assertEquals("tri#0", proofs.get(0).shapeName());
        }

        @Test
        @DisplayName("one failing pair makes the diagram non-commutative")
        void nonCommutative() {
            CommutativeDiagram diagram = new CommutativeDiagram("tri", category)
                    .requireCommutativity(List.of(f, g), List.of(h))
                    .requireCommutativity(List.of(f, g), List.of(k));

            assertFalse(diagram.isCommutative());
            List<CommutativityProof> proofs = diagram.verify();
            assertTrue(proofs.get(0).valid());
            assertFalse(proofs.get(1).valid());
        }

        @Test
        @DisplayName("an empty diagram is trivially commutative")
        void empty() {
            assertTrue(new CommutativeDiagram("empty", category).isCommutative());
        }
    }

    @Nested
    @DisplayName("Path search")
    class PathSearchTests {

        @Test
        @DisplayName("finds paths built from the diagram's own morphisms")
        void findPaths() {
            CommutativeDiagram diagram = new CommutativeDiagram("d", category)
                    .addPath(List.of(f, g))
                    .addMorphism(h);

            assertEquals(List.of(MorphismPath.of(f, g), MorphismPath.of(h)), diagram.findAllPaths(a, c, 3));
            assertTrue(diagram.findAllPaths(c, a, 3).isEmpty());
        }

        @Test
        @DisplayName("the length bound is inclusive")
        void lengthBound() {
            CommutativeDiagram diagram = new CommutativeDiagram("d", category).addPath(List.of(f, g));

            assertEquals(1, diagram.findAllPaths(a, c, 2).size());
            assertTrue(diagram.findAllPaths(a, c, 1).isEmpty());
        }

        @Test
        @DisplayName("a loop query returns the identity")
        void identity() {
            CommutativeDiagram diagram = new CommutativeDiagram("d", category).addMorphism(f);
            List<MorphismPath> loops = diagram.findAllPaths(a, a, 3);

            assertEquals(List.of(MorphismPath.of(category.identity(a).orElseThrow())), loops);
        }

        @Test
        @DisplayName("auto-detection requires parallel composites to commute")
        void autoDetect() {
            CommutativeDiagram diagram = new CommutativeDiagram("d", category)
                    .addPath(List.of(f, g))
                    .addMorphism(h)
                    .autoDetectCommutations(3);

            assertEquals(1, diagram.requiredCommutations().size());
            assertTrue(diagram.isCommutative());
        }

        @Test
        @DisplayName("auto-detection skips pairs of single morphisms")
        void autoDetectSkipsSingles() {
            CommutativeDiagram diagram = new CommutativeDiagram("d", category)
                    .addPath(List.of(f, g))
                    .addMorphism(h)
                    .addMorphism(k)
                    .autoDetectCommutations(3);

            assertEquals(2, diagram.requiredCommutations().size());
            assertFalse(diagram.isCommutative());
        }

        @Test
        @DisplayName("repeated auto-detection adds no pair twice")
        void autoDetectIsIdempotent() {
            CommutativeDiagram diagram = new CommutativeDiagram("d", category)
                    .addPath(List.of(f, g))
                    .addMorphism(h)
                    .requireCommutativity(List.of(h), List.of(f, g))
                    .autoDetectCommutations(3)
                    .autoDetectCommutations(3);

            assertEquals(1, diagram.requiredCommutations().size());
            assertEquals(1, diagram.verify().size());
        }
    }
}
