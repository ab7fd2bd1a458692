package io.surfworks.arrowforge.ncat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.arrowforge.config.SearchConfig;
import io.surfworks.arrowforge.path.Path;
import io.surfworks.arrowforge.rewrite.Certificate;
import io.surfworks.arrowforge.rewrite.Direction;
import io.surfworks.arrowforge.rewrite.MalformedRelationException;
import io.surfworks.arrowforge.rewrite.RewriteStep;
import io.surfworks.arrowforge.rewrite.SearchOutcome;

@DisplayName("FiniteWeakNCategory")
class FiniteWeakNCategoryTest {

    private FiniteWeakNCategory cat;
    private int a;
    private int b;

    @BeforeEach
    void setUp() {
        cat = new FiniteWeakNCategory(2);
        a = cat.addGenerator(new Generator(1, "a", 0, 1));
        b = cat.addGenerator(new Generator(1, "b", 1, 2));
        cat.addRelation(new DimensionedRelation(1, List.of(a, b), List.of(b, a), "swap"));
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("generator indices count up per dimension")
        void generatorIndices() {
            assertEquals(0, a);
            assertEquals(1, b);
            assertEquals(0, cat.addGenerator(2, "alpha", a, a));
            assertEquals(2, cat.generators(1).size());
            assertEquals("b", cat.generator(1, b).name());
        }

        @Test
        @DisplayName("rejects generators above the top dimension")
        void generatorAboveTop() {
            DimensionOutOfBoundsException e = assertThrows(DimensionOutOfBoundsException.class,
                    () -> cat.addGenerator(new Generator(3, "x", 0, 0)));
            assertEquals(3, e.getDimension());
            assertEquals(1, e.getMin());
            assertEquals(2, e.getMax());
        }

        @Test
        @DisplayName("rejects dimension 0")
        void dimensionZero() {
            assertThrows(DimensionOutOfBoundsException.class,
                    () -> cat.addRelation(0, "r", List.of(0), List.of(0)));
        }

        @Test
        @DisplayName("rejects relations naming unregistered generators")
        void unregisteredGenerator() {
            MalformedRelationException e = assertThrows(MalformedRelationException.class,
                    () -> cat.addRelation(1, "bad", List.of(a, 7), List.of(b)));
            assertEquals("bad", e.getRelationName());
        }

        @Test
        @DisplayName("rejects a relation name already used at the same dimension")
        void duplicateNameAtDimension() {
            MalformedRelationException e = assertThrows(MalformedRelationException.class,
                    () -> cat.addRelation(1, "swap", List.of(b, a), List.of(a, b)));
            assertEquals("swap", e.getRelationName());
            assertEquals(1, cat.relationsFor(1).size());
            assertEquals(1, cat.relationSet(1).size());
        }

        @Test
        @DisplayName("the same relation name may appear at different dimensions")
        void sameNameAcrossDimensions() {
            int alpha = cat.addGenerator(2, "alpha", a, a);
            assertEquals(0, cat.addRelation(2, "swap", List.of(alpha, alpha), List.of(alpha)));
        }

        @Test
        @DisplayName("logs each registered relation at FINE")
        void logsRelationRegistration() {
            Logger logger = Logger.getLogger(FiniteWeakNCategory.class.getName());
            List<LogRecord> records = new ArrayList<>();
            Handler handler = new Handler() {
                @Override
                public void publish(LogRecord record) {
                    records.add(record);
                }

                @Override
                public void flush() {}

                @Override
                public void close() {}
            };
            Level previous = logger.getLevel();
            logger.setLevel(Level.FINE);
            logger.addHandler(handler);
            try {
                cat.addRelation(1, "idem", List.of(a, a), List.of(a));
            } finally {
                logger.removeHandler(handler);
                logger.setLevel(previous);
            }

            assertTrue(records.stream().anyMatch(r -> r.getLevel() == Level.FINE
                    && r.getMessage().startsWith("Registered relation #1")));
        }

        @Test
        @DisplayName("rejects relations with an empty side")
        void emptySide() {
            assertThrows(MalformedRelationException.class,
                    () -> new DimensionedRelation(1, List.of(), List.of(0), "empty"));
        }

        @Test
        @DisplayName("rejects relations with null indices")
        void nullIndex() {
            assertThrows(MalformedRelationException.class,
                    () -> new DimensionedRelation(1, Arrays.asList(0, null), List.of(0), "nulls"));
        }

        @Test
        @DisplayName("rejects negative generator endpoints")
        void negativeEndpoint() {
            assertThrows(IllegalArgumentException.class, () -> new Generator(1, "x", -1, 0));
        }

        @Test
        @DisplayName("requires n >= 1")
        void requiresPositiveN() {
            assertThrows(IllegalArgumentException.class, () -> new FiniteWeakNCategory(0));
        }

        @Test
        @DisplayName("keeps relations per dimension")
        void relationsPerDimension() {
            cat.addGenerator(2, "alpha", a, a);
            cat.addRelation(2, "alpha-idem", List.of(0, 0), List.of(0));

            assertEquals(1, cat.relationsFor(1).size());
            assertEquals(1, cat.relationsFor(2).size());
            assertEquals("alpha-idem", cat.relationSet(2).relations().get(0).name());
        }
    }

    @Nested
    @DisplayName("Certificates")
    class CertificateTests {

        @Test
        @DisplayName("swapping a and b yields a non-empty certificate")
        void swapCertificate() {
            Path<Integer> lhs = Path.of(a, b, a);
            Path<Integer> rhs = Path.of(b, a, a);

            Certificate cert = cat.certificate(1, lhs, rhs, 64);

            assertFalse(cert.isEmpty());
            assertEquals(List.of(new RewriteStep("swap", 0, Direction.FORWARD)), cert.steps());
            assertEquals(rhs, cert.replay(lhs, cat.relationSet(1)));
        }

        @Test
        @DisplayName("equal paths give the empty certificate")
        void reflexive() {
            assertTrue(cat.certificate(1, Path.of(a, b), Path.of(a, b), 0).isEmpty());
        }

        @Test
        @DisplayName("relations at one dimension do not apply at another")
        void dimensionScoping() {
            int alpha = cat.addGenerator(2, "alpha", a, a);
            int beta = cat.addGenerator(2, "beta", a, a);

            assertEquals(SearchOutcome.REFUTED,
                    cat.prove(2, Path.of(alpha, beta), Path.of(beta, alpha), 64).outcome());
        }

        @Test
        @DisplayName("certificate lookup outside 1..n is rejected")
        void outOfBounds() {
            assertThrows(DimensionOutOfBoundsException.class,
                    () -> cat.certificate(3, Path.of(0), Path.of(0), 1));
        }

        @Test
        @DisplayName("default budget comes from the configuration")
        void configuredBudget() {
            FiniteWeakNCategory tight = new FiniteWeakNCategory(1, new SearchConfig(0));
            int x = tight.addGenerator(1, "x", 0, 0);
            int y = tight.addGenerator(1, "y", 0, 0);
            tight.addRelation(1, "xy", List.of(x), List.of(y));

            assertTrue(tight.certificate(1, Path.of(x), Path.of(y)).isEmpty());
            assertEquals(1, tight.certificate(1, Path.of(x), Path.of(y), 1).length());
        }
    }

    @Nested
    @DisplayName("Boundaries")
    class BoundaryTests {

        @Test
        @DisplayName("resolves endpoints through generators")
        void endpoints() {
            Path<Integer> ab = Path.of(a, b);
            assertTrue(cat.isComposable(1, ab));
            assertEquals(0, cat.source(1, ab));
            assertEquals(2, cat.target(1, ab));
        }

        @Test
        @DisplayName("detects non-composable paths")
        void notComposable() {
            assertFalse(cat.isComposable(1, Path.of(b, a, b, b)));
        }
    }
}
