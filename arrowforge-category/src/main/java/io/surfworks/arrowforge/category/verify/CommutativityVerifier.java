package io.surfworks.arrowforge.category.verify;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.arrowforge.category.CategoryObject;
import io.surfworks.arrowforge.category.CategoryView;
import io.surfworks.arrowforge.category.CommutativeSquare;
import io.surfworks.arrowforge.category.CommutativeTriangle;
import io.surfworks.arrowforge.category.Morphism;
import io.surfworks.arrowforge.category.MorphismPath;
import io.surfworks.arrowforge.category.PathPair;
import io.surfworks.arrowforge.category.PathValidationResult;

/**
 * Checks commutativity of triangles, squares and arbitrary parallel paths by
 * looking composites up in a category's composition table.
 *
 * <p>The verifier is a service over a {@link CategoryView}; it never modifies
 * the category. Two paths commute when they share source and target and both
 * compose to the same morphism. A composite the table does not know makes the
 * shape non-commuting; it is never an error.
 *
 * <p>Example usage:
 * <pre>{@code
 * CommutativityVerifier verifier = new CommutativityVerifier(category);
 *
 * CommutativityProof proof = verifier.checkTriangle(a, b, c, f, g, h);
 * if (!proof.valid()) {
 *     System.out.println(proof.failureReason());
 * }
 *
 * List<ShapeMatch<CommutativeSquare>> squares = verifier.findCommutativeSquares();
 * }</pre>
 *
 * <p>Caches (paths by endpoints, composites by path, commutativity by unordered
 * path pair) are plain maps owned by this instance. A verifier must not be
 * shared between threads, and {@link #clearCaches()} must be called if the
 * category changes after a query.
 */
public final class CommutativityVerifier {

    private static final Logger LOG = Logger.getLogger(CommutativityVerifier.class.getName());

    private final CategoryView category;
    private final VerifierConfig config;

    private final Map<PathQuery, List<MorphismPath>> pathCache = new HashMap<>();
    private final Map<MorphismPath, Optional<Morphism>> compositionCache = new HashMap<>();
    private final Map<Set<MorphismPath>, Boolean> commutativityCache = new HashMap<>();
    private long hits;
    private long misses;

    public CommutativityVerifier(CategoryView category) {
        this(category, VerifierConfig.defaults());
    }

    public CommutativityVerifier(CategoryView category, VerifierConfig config) {
        if (category == null) {
            throw new IllegalArgumentException("category must not be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        this.category = category;
        this.config = config;
    }

    // ==================== Composition ====================

    /**
     * Composes a path left to right through the category's table.
     *
     * @return the composite, or empty if the path is empty or any partial
     *         composite is unknown
     */
    public Optional<Morphism> compose(MorphismPath path) {
        if (config.cachingEnabled()) {
            Optional<Morphism> cached = compositionCache.get(path);
            if (cached != null) {
                hits++;
                return cached;
            }
            misses++;
        }
        Optional<Morphism> result = composeUncached(path);
        if (config.cachingEnabled()) {
            compositionCache.put(path, result);
        }
        return result;
    }

    private Optional<Morphism> composeUncached(MorphismPath path) {
        if (path.isEmpty()) {
            return Optional.empty();
        }
        List<Morphism> morphisms = path.morphisms();
        Morphism result = morphisms.get(0);
        for (int i = 1; i < morphisms.size(); i++) {
            Optional<Morphism> next = category.compose(result, morphisms.get(i));
            if (next.isEmpty()) {
                return Optional.empty();
            }
            result = next.get();
        }
        return Optional.of(result);
    }

    /**
     * Returns true if both paths run between the same objects and compose to
     * the same morphism. The result is symmetric and cached per unordered pair.
     */
    public boolean pathsCommute(MorphismPath first, MorphismPath second) {
        Set<MorphismPath> key = first.equals(second) ? Set.of(first) : Set.of(first, second);
        if (config.cachingEnabled()) {
            Boolean cached = commutativityCache.get(key);
            if (cached != null) {
                hits++;
                return cached;
            }
            misses++;
        }
        boolean result;
        if (first.isEmpty() || second.isEmpty()
                || !first.source().equals(second.source())
                || !first.target().equals(second.target())) {
            result = false;
        } else {
            Optional<Morphism> c1 = compose(first);
            Optional<Morphism> c2 = compose(second);
            result = c1.isPresent() && c2.isPresent() && c1.get().equals(c2.get());
        }
        if (config.cachingEnabled()) {
            commutativityCache.put(key, result);
        }
        return result;
    }

    // ==================== Shapes ====================

    /**
     * Checks the triangle {@code f: A → B}, {@code g: B → C}, {@code h: A → C}.
     */
    public CommutativityProof checkTriangle(CategoryObject a, CategoryObject b, CategoryObject c,
                                            Morphism f, Morphism g, Morphism h) {
        return checkTriangle(CommutativeTriangle.of(a, b, c, f, g, h));
    }

    /**
     * Checks whether {@code g ∘ f = h}.
     *
     * <p>Returns a failed proof with {@link PathValidationResult#SHAPE_MISMATCH}
     * if an edge does not connect its vertices, and a failed proof if the
     * composite is unknown or differs from {@code h}.
     */
    public CommutativityProof checkTriangle(CommutativeTriangle triangle) {
        PathPair paths = triangle.paths();
        List<PathNamePair> compared = List.of(names(paths));

        List<String> mismatches = triangle.mismatches();
        if (!mismatches.isEmpty()) {
            return shapeMismatch(triangle.name(), compared, mismatches);
        }
        Optional<CommutativityProof> invalid = validatePaths(triangle.name(), compared, paths);
        if (invalid.isPresent()) {
            return invalid.get();
        }

        MorphismPath path1 = paths.first();
        MorphismPath path2 = paths.second();
        List<String> steps = new ArrayList<>();
        steps.add("Checking triangle " + triangle.name());
        steps.add(String.format("Path 1: %s from %s to %s", path1.name(), path1.source(), path1.target()));
        steps.add(String.format("Path 2: %s from %s to %s", path2.name(), path2.source(), path2.target()));

        Optional<Morphism> composite = compose(path1);
        if (composite.isEmpty()) {
            steps.add(String.format("Composite %s ∘ %s is undefined", triangle.g().name(), triangle.f().name()));
            return CommutativityProof.failure(triangle.name(), compared, steps,
                    String.format("Composition %s ∘ %s is undefined", triangle.g().name(), triangle.f().name()),
                    PathValidationResult.VALID);
        }
        boolean commutes = pathsCommute(path1, path2);
        steps.add(String.format("%s ∘ %s = %s", triangle.g().name(), triangle.f().name(), composite.get().name()));
        steps.add("Composition check: " + commutes);

        if (commutes) {
            return CommutativityProof.success(triangle.name(), compared, steps);
        }
        return CommutativityProof.failure(triangle.name(), compared, steps,
                String.format("Paths do not compose to same morphism: %s ≠ %s",
                        composite.get().name(), triangle.h().name()),
                PathValidationResult.VALID);
    }

    /**
     * Checks the square {@code top: TL → TR}, {@code right: TR → BR},
     * {@code left: TL → BL}, {@code bottom: BL → BR}.
     */
    public CommutativityProof checkSquare(CategoryObject topLeft, CategoryObject topRight,
                                          CategoryObject bottomLeft, CategoryObject bottomRight,
                                          Morphism top, Morphism right, Morphism left, Morphism bottom) {
        return checkSquare(CommutativeSquare.of(topLeft, topRight, bottomLeft, bottomRight, top, right, left, bottom));
    }

    /**
     * Checks whether {@code right ∘ top = bottom ∘ left}.
     */
    public CommutativityProof checkSquare(CommutativeSquare square) {
        PathPair paths = square.paths();
        List<PathNamePair> compared = List.of(names(paths));

        List<String> mismatches = square.mismatches();
        if (!mismatches.isEmpty()) {
            return shapeMismatch(square.name(), compared, mismatches);
        }
        Optional<CommutativityProof> invalid = validatePaths(square.name(), compared, paths);
        if (invalid.isPresent()) {
            return invalid.get();
        }

        MorphismPath path1 = paths.first();
        MorphismPath path2 = paths.second();
        List<String> steps = new ArrayList<>();
        steps.add("Checking square " + square.name());
        steps.add("Top-right path: " + path1.name());
        steps.add("Left-bottom path: " + path2.name());
        steps.add(String.format("Both paths go from %s to %s", path1.source(), path1.target()));

        Optional<Morphism> c1 = compose(path1);
        Optional<Morphism> c2 = compose(path2);
        if (c1.isEmpty() || c2.isEmpty()) {
            String undefined = c1.isEmpty() ? path1.name() : path2.name();
            steps.add("Composite " + undefined + " is undefined");
            return CommutativityProof.failure(square.name(), compared, steps,
                    "Composition " + undefined + " is undefined", PathValidationResult.VALID);
        }
        boolean commutes = pathsCommute(path1, path2);
        steps.add(String.format("%s = %s, %s = %s", path1.name(), c1.get().name(), path2.name(), c2.get().name()));
        steps.add("Commutativity: " + commutes);

        if (commutes) {
            return CommutativityProof.success(square.name(), compared, steps);
        }
        return CommutativityProof.failure(square.name(), compared, steps,
                String.format("Square does not commute: %s ≠ %s", c1.get().name(), c2.get().name()),
                PathValidationResult.VALID);
    }

    /**
     * Checks a pullback square over the cospan {@code f: A → C ← B: g} with
     * projections {@code p1: P → A}, {@code p2: P → B}, i.e. {@code f ∘ p1 = g ∘ p2}.
     *
     * <p>Only the commuting condition is checked, not the universal property.
     */
    public CommutativityProof checkPullbackSquare(CategoryObject a, CategoryObject b, CategoryObject c,
                                                  CategoryObject p, Morphism f, Morphism g,
                                                  Morphism p1, Morphism p2) {
        CommutativeSquare square = CommutativeSquare.of(p, a, b, c, p1, f, p2, g)
                .named("pullback_" + p.name() + "_" + f.name() + "_" + g.name());
        return checkSquare(square);
    }

    /**
     * Checks a pushout square over the span {@code f: A → B}, {@code g: A → C}
     * with injections {@code i1: B → Q}, {@code i2: C → Q}, i.e. {@code i1 ∘ f = i2 ∘ g}.
     *
     * <p>Only the commuting condition is checked, not the universal property.
     */
    public CommutativityProof checkPushoutSquare(CategoryObject a, CategoryObject b, CategoryObject c,
                                                 CategoryObject q, Morphism f, Morphism g,
                                                 Morphism i1, Morphism i2) {
        CommutativeSquare square = CommutativeSquare.of(a, b, c, q, f, i1, g, i2)
                .named("pushout_" + q.name() + "_" + f.name() + "_" + g.name());
        return checkSquare(square);
    }

    /**
     * Checks that every pair of the given parallel paths commutes.
     */
    public CommutativityProof checkPaths(List<MorphismPath> paths) {
        return checkPaths("arbitrary_diagram", paths);
    }

    /**
     * Checks that every pair of the given parallel paths commutes, reporting
     * under {@code diagramName}.
     */
    public CommutativityProof checkPaths(String diagramName, List<MorphismPath> paths) {
        if (paths.size() < 2) {
            return CommutativityProof.failure(diagramName, List.of(),
                    List.of("Need at least 2 paths to check commutativity"),
                    "Insufficient paths", PathValidationResult.VALID);
        }
        for (MorphismPath path : paths) {
            PathValidationResult result = path.validate(category);
            if (!result.isValid()) {
                return CommutativityProof.failure(diagramName, List.of(),
                        List.of("Path " + path.name() + " is invalid: " + result),
                        "Invalid path: " + path.name(), result);
            }
        }

        MorphismPath reference = paths.get(0);
        List<PathNamePair> compared = new ArrayList<>();
        for (int i = 0; i < paths.size(); i++) {
            for (int j = i + 1; j < paths.size(); j++) {
                compared.add(new PathNamePair(paths.get(i).name(), paths.get(j).name()));
            }
        }
        for (MorphismPath path : paths.subList(1, paths.size())) {
            if (!path.source().equals(reference.source()) || !path.target().equals(reference.target())) {
                return CommutativityProof.failure(diagramName, compared,
                        List.of("Not all paths have same source and target"),
                        "Source/target mismatch", PathValidationResult.SHAPE_MISMATCH);
            }
        }

        List<String> steps = new ArrayList<>();
        steps.add(String.format("Checking %d paths from %s to %s", paths.size(), reference.source(), reference.target()));
        boolean allCommute = true;
        for (int i = 0; i < paths.size(); i++) {
            for (int j = i + 1; j < paths.size(); j++) {
                boolean commutes = pathsCommute(paths.get(i), paths.get(j));
                steps.add(String.format("%s ≟ %s: %s", paths.get(i).name(), paths.get(j).name(), commutes));
                allCommute &= commutes;
            }
        }
        if (allCommute) {
            return CommutativityProof.success(diagramName, compared, steps);
        }
        return CommutativityProof.failure(diagramName, compared, steps,
                "Not all path pairs commute", PathValidationResult.VALID);
    }

    // ==================== Search ====================

    /**
     * Finds paths from {@code source} to {@code target} up to the configured length.
     */
    public List<MorphismPath> findAllPaths(CategoryObject source, CategoryObject target) {
        return findAllPaths(source, target, config.maxPathLength());
    }

    /**
     * Finds all paths from {@code source} to {@code target} with at most
     * {@code maxLength} morphisms, shortest first.
     *
     * <p>For {@code source == target} the identity path alone is returned when
     * the category has an identity. Identity morphisms are never used as steps.
     *
     * @throws IllegalArgumentException if {@code maxLength < 1}
     */
    public List<MorphismPath> findAllPaths(CategoryObject source, CategoryObject target, int maxLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be >= 1, got " + maxLength);
        }
        PathQuery key = new PathQuery(source, target, maxLength);
        if (config.cachingEnabled()) {
            List<MorphismPath> cached = pathCache.get(key);
            if (cached != null) {
                hits++;
                return cached;
            }
            misses++;
        }

        List<MorphismPath> paths = new ArrayList<>();
        Optional<Morphism> identity = source.equals(target) ? category.identity(source) : Optional.empty();
        if (identity.isPresent()) {
            paths.add(new MorphismPath(List.of(identity.get()), "id_" + source.name()));
        } else {
            MorphismIndex index = MorphismIndex.build(category);
            ArrayDeque<MorphismPath> queue = new ArrayDeque<>();
            for (Morphism m : index.outgoingNonIdentity(source)) {
                queue.add(MorphismPath.of(m));
            }
            while (!queue.isEmpty()) {
                MorphismPath current = queue.poll();
                if (current.target().equals(target)) {
                    paths.add(current);
                }
                if (current.length() >= maxLength) {
                    continue;
                }
                for (Morphism m : index.outgoingNonIdentity(current.target())) {
                    queue.add(current.then(m));
                }
            }
        }

        List<MorphismPath> result = List.copyOf(paths);
        if (config.cachingEnabled()) {
            pathCache.put(key, result);
        }
        return result;
    }

    // ==================== Enumeration ====================

    /**
     * Enumerates every triangle over three distinct objects and returns those that commute.
     *
     * @throws EnumerationLimitExceededException if the category has more
     *         objects than {@link VerifierConfig#maxEnumerationObjects()}
     */
    public List<ShapeMatch<CommutativeTriangle>> findCommutativeTriangles() {
        List<CategoryObject> objects = guardedObjects("triangle");
        MorphismIndex index = MorphismIndex.build(category);
        List<ShapeMatch<CommutativeTriangle>> found = new ArrayList<>();
        int checked = 0;

        for (CategoryObject a : objects) {
            for (CategoryObject b : objects) {
                if (b.equals(a)) continue;
                List<Morphism> ab = index.between(a, b);
                if (ab.isEmpty()) continue;
                for (CategoryObject c : objects) {
                    if (c.equals(a) || c.equals(b)) continue;
                    List<Morphism> bc = index.between(b, c);
                    List<Morphism> ac = index.between(a, c);
                    for (Morphism f : ab) {
                        for (Morphism g : bc) {
                            for (Morphism h : ac) {
                                CommutativeTriangle triangle = CommutativeTriangle.of(a, b, c, f, g, h);
                                CommutativityProof proof = checkTriangle(triangle);
                                checked++;
                                if (proof.valid()) {
                                    found.add(new ShapeMatch<>(triangle, proof));
                                }
                            }
                        }
                    }
                }
            }
        }
        LOG.fine("Checked " + checked + " triangles in " + category.name() + ", " + found.size() + " commute");
        return found;
    }

    /**
     * Enumerates every square over four distinct objects and returns those that commute.
     *
     * @throws EnumerationLimitExceededException if the category has more
     *         objects than {@link VerifierConfig#maxEnumerationObjects()}
     */
    public List<ShapeMatch<CommutativeSquare>> findCommutativeSquares() {
        List<CategoryObject> objects = guardedObjects("square");
        MorphismIndex index = MorphismIndex.build(category);
        List<ShapeMatch<CommutativeSquare>> found = new ArrayList<>();
        int checked = 0;

        for (CategoryObject tl : objects) {
            for (CategoryObject tr : objects) {
                if (tr.equals(tl)) continue;
                List<Morphism> tops = index.between(tl, tr);
                if (tops.isEmpty()) continue;
                for (CategoryObject bl : objects) {
                    if (bl.equals(tl) || bl.equals(tr)) continue;
                    List<Morphism> lefts = index.between(tl, bl);
                    if (lefts.isEmpty()) continue;
                    for (CategoryObject br : objects) {
                        if (br.equals(tl) || br.equals(tr) || br.equals(bl)) continue;
                        List<Morphism> rights = index.between(tr, br);
                        List<Morphism> bottoms = index.between(bl, br);
                        for (Morphism top : tops) {
                            for (Morphism right : rights) {
                                for (Morphism left : lefts) {
                                    for (Morphism bottom : bottoms) {
                                        CommutativeSquare square =
                                                CommutativeSquare.of(tl, tr, bl, br, top, right, left, bottom);
                                        CommutativityProof proof = checkSquare(square);
                                        checked++;
                                        if (proof.valid()) {
                                            found.add(new ShapeMatch<>(square, proof));
                                        }
                                    }
                                }
                            }
                        }
                    }
                }
            }
        }
        LOG.fine("Checked " + checked + " squares in " + category.name() + ", " + found.size() + " commute");
        return found;
    }

    /**
     * Builds a text report of the commuting triangles and squares and the
     * number of endomorphism paths per object.
     */
    public String report() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Commutativity Report for ").append(category.name()).append(" ===\n\n");

        sb.append("COMMUTATIVE TRIANGLES:\n");
        List<ShapeMatch<CommutativeTriangle>> triangles = findCommutativeTriangles();
        if (triangles.isEmpty()) {
            sb.append("  None found\n");
        }
        for (ShapeMatch<CommutativeTriangle> match : triangles) {
            appendMatch(sb, match.shape().name(), match.proof());
        }

        sb.append("\nCOMMUTATIVE SQUARES:\n");
        List<ShapeMatch<CommutativeSquare>> squares = findCommutativeSquares();
        if (squares.isEmpty()) {
            sb.append("  None found\n");
        }
        for (ShapeMatch<CommutativeSquare> match : squares) {
            appendMatch(sb, match.shape().name(), match.proof());
        }

        sb.append("\nOBJECT ANALYSIS:\n");
        for (CategoryObject object : category.objects()) {
            int endomorphisms = findAllPaths(object, object, Math.min(3, config.maxPathLength())).size();
            sb.append("  ").append(object).append(": ").append(endomorphisms).append(" endomorphism paths\n");
        }
        return sb.toString();
    }

    private static void appendMatch(StringBuilder sb, String name, CommutativityProof proof) {
        sb.append("  ✓ ").append(name).append('\n');
        for (String step : proof.steps().subList(1, proof.steps().size())) {
            sb.append("    ").append(step).append('\n');
        }
    }

    // ==================== Caches ====================

    /**
     * Drops all cached paths, composites and commutativity results.
     */
    public void clearCaches() {
        pathCache.clear();
        compositionCache.clear();
        commutativityCache.clear();
        hits = 0;
        misses = 0;
    }

    public CacheStats cacheStats() {
        return new CacheStats(pathCache.size(), compositionCache.size(), commutativityCache.size(), hits, misses);
    }

    public CategoryView category() {
        return category;
    }

    public VerifierConfig config() {
        return config;
    }

    // ==================== Helpers ====================

    private List<CategoryObject> guardedObjects(String shape) {
        List<CategoryObject> objects = new ArrayList<>(category.objects());
        if (objects.size() > config.maxEnumerationObjects()) {
            LOG.warning(String.format("Skipping %s enumeration for %s: %d objects exceeds limit %d",
                    shape, category.name(), objects.size(), config.maxEnumerationObjects()));
            throw new EnumerationLimitExceededException(shape, objects.size(), config.maxEnumerationObjects());
        }
        return objects;
    }

    private Optional<CommutativityProof> validatePaths(String shapeName, List<PathNamePair> compared, PathPair paths) {
        List<String> errors = new ArrayList<>();
        PathValidationResult worst = PathValidationResult.VALID;
        for (MorphismPath path : new MorphismPath[] {paths.first(), paths.second()}) {
            PathValidationResult result = path.validate(category);
            if (!result.isValid()) {
                errors.add("Path " + path.name() + " is invalid: " + result);
                if (worst.isValid()) {
                    worst = result;
                }
            }
        }
        if (errors.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(CommutativityProof.failure(shapeName, compared, errors, String.join("; ", errors), worst));
    }

    private static CommutativityProof shapeMismatch(String shapeName, List<PathNamePair> compared,
                                                    List<String> mismatches) {
        List<String> steps = new ArrayList<>();
        steps.add("Shape " + shapeName + " does not connect its vertices");
        steps.addAll(mismatches);
        return CommutativityProof.failure(shapeName, compared, steps,
                "Shape mismatch: " + String.join("; ", mismatches), PathValidationResult.SHAPE_MISMATCH);
    }

    private static PathNamePair names(PathPair paths) {
        return new PathNamePair(paths.first().name(), paths.second().name());
    }

    private record PathQuery(CategoryObject source, CategoryObject target, int maxLength) {}

    @Override
    public String toString() {
        return String.format("CommutativityVerifier[%s, %s]", category.name(), cacheStats());
    }
}
