package io.surfworks.arrowforge.category.diagram;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.arrowforge.category.Category;
import io.surfworks.arrowforge.category.CategoryObject;
import io.surfworks.arrowforge.category.Morphism;
import io.surfworks.arrowforge.category.MorphismPath;
import io.surfworks.arrowforge.category.PathPair;
import io.surfworks.arrowforge.category.verify.CommutativityProof;
import io.surfworks.arrowforge.category.verify.CommutativityVerifier;

/**
 * A diagram drawn inside a {@link Category}: a subset of its objects and
 * morphisms, the composite paths of interest, and the pairs of paths that are
 * required to commute.
 *
 * <p>Example:
 * <pre>{@code
 * CommutativeDiagram d = new CommutativeDiagram("naturality", category)
 *     .addPath(List.of(f, g))
 *     .addMorphism(h)
 *     .requireCommutativity(List.of(f, g), List.of(h));
 *
 * d.isCommutative();
 * }</pre>
 */
public final class CommutativeDiagram {

    private static final Logger LOG = Logger.getLogger(CommutativeDiagram.class.getName());

    private final String name;
    private final Category category;
    private final Set<CategoryObject> objects = new LinkedHashSet<>();
    private final Set<Morphism> morphisms = new LinkedHashSet<>();
    private final Map<Endpoints, List<MorphismPath>> paths = new LinkedHashMap<>();
    private final List<PathPair> requiredCommutations = new ArrayList<>();

    public CommutativeDiagram(String name, Category category) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("diagram name must not be blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("category must not be null");
        }
        this.name = name;
        this.category = category;
    }

    public String name() {
        return name;
    }

    public Category category() {
        return category;
    }

    /**
     * @throws IllegalArgumentException if the object is not in the category
     */
    public CommutativeDiagram addObject(CategoryObject object) {
        if (!category.objects().contains(object)) {
            throw new IllegalArgumentException(
                    "Object " + object + " is not in category " + category.name());
        }
        objects.add(object);
        return this;
    }

    /**
     * Adds a morphism, its endpoints, and the single-morphism path it forms.
     *
     * @throws IllegalArgumentException if the morphism is not in the category
     */
    public CommutativeDiagram addMorphism(Morphism morphism) {
        if (!category.contains(morphism)) {
            throw new IllegalArgumentException(
                    "Morphism " + morphism + " is not in category " + category.name());
        }
        if (morphisms.add(morphism)) {
            objects.add(morphism.source());
            objects.add(morphism.target());
            recordPath(MorphismPath.of(morphism));
        }
        return this;
    }

    /**
     * Adds a composite path and every morphism on it.
     *
     * @throws IllegalArgumentException if the list is empty or does not chain
     */
    public CommutativeDiagram addPath(List<Morphism> chain) {
        MorphismPath path = composablePath(chain);
        for (Morphism m : chain) {
            addMorphism(m);
        }
        if (path.length() > 1) {
            recordPath(path);
        }
        return this;
    }

    /**
     * Requires two parallel paths to commute.
     *
     * @throws IllegalArgumentException if the paths are empty or do not share
     *         source and target
     */
    public CommutativeDiagram requireCommutativity(MorphismPath first, MorphismPath second) {
        if (first.isEmpty() || second.isEmpty()) {
            throw new IllegalArgumentException("Cannot require commutativity of an empty path");
        }
        if (!first.source().equals(second.source()) || !first.target().equals(second.target())) {
            throw new IllegalArgumentException(String.format(
                    "Paths must have same source and target to commute: %s: %s → %s, %s: %s → %s",
                    first.name(), first.source(), first.target(),
                    second.name(), second.source(), second.target()));
        }
        requiredCommutations.add(new PathPair(first, second));
        return this;
    }

    /**
     * Requires two paths, given as morphism lists, to commute.
     */
    public CommutativeDiagram requireCommutativity(List<Morphism> first, List<Morphism> second) {
        return requireCommutativity(composablePath(first), composablePath(second));
    }

    /**
     * Returns the paths recorded between two objects, in insertion order.
     */
    public List<MorphismPath> pathsBetween(CategoryObject source, CategoryObject target) {
        return List.copyOf(paths.getOrDefault(new Endpoints(source, target), List.of()));
    }

    /**
     * Finds every path of the diagram's own morphisms from {@code source} to
     * {@code target} with at most {@code maxLength} morphisms. A path never
     * uses the same morphism twice and stops the first time it reaches the target.
     *
     * <p>For {@code source == target} only the identity path is returned.
     */
    public List<MorphismPath> findAllPaths(CategoryObject source, CategoryObject target, int maxLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be >= 1, got " + maxLength);
        }
        if (source.equals(target)) {
            return category.identity(source)
                    .map(id -> List.of(MorphismPath.of(id)))
                    .orElse(List.of());
        }
        List<MorphismPath> found = new ArrayList<>();
        search(source, target, new ArrayList<>(), maxLength, found);
        return found;
    }

    private void search(CategoryObject current, CategoryObject target, List<Morphism> prefix,
                        int maxLength, List<MorphismPath> found) {
        if (!prefix.isEmpty() && current.equals(target)) {
            found.add(new MorphismPath(prefix));
            return;
        }
        if (prefix.size() == maxLength) {
            return;
        }
        for (Morphism m : morphisms) {
            if (m.source().equals(current) && !prefix.contains(m)) {
                prefix.add(m);
                search(m.target(), target, prefix, maxLength, found);
                prefix.remove(prefix.size() - 1);
            }
        }
    }

    /**
     * Requires every pair of distinct parallel paths of length up to
     * {@code maxLength} to commute, skipping pairs of two single morphisms and
     * pairs that are already required in either order.
     */
    public CommutativeDiagram autoDetectCommutations(int maxLength) {
        int before = requiredCommutations.size();
        for (CategoryObject source : objects) {
            for (CategoryObject target : objects) {
                if (source.equals(target)) continue;
                List<MorphismPath> parallel = findAllPaths(source, target, maxLength);
                for (int i = 0; i < parallel.size(); i++) {
                    for (int j = i + 1; j < parallel.size(); j++) {
                        MorphismPath first = parallel.get(i);
                        MorphismPath second = parallel.get(j);
                        if ((first.length() > 1 || second.length() > 1) && !isRequired(first, second)) {
                            requireCommutativity(first, second);
                        }
                    }
                }
            }
        }
        int added = requiredCommutations.size() - before;
        LOG.fine(() -> "Detected " + added + " candidate commutations in diagram " + name);
        return this;
    }

    private boolean isRequired(MorphismPath first, MorphismPath second) {
        return requiredCommutations.contains(new PathPair(first, second))
                || requiredCommutations.contains(new PathPair(second, first));
    }

    /**
     * Returns true if every required pair composes to the same morphism.
     */
    public boolean isCommutative() {
        return isCommutative(new CommutativityVerifier(category));
    }

    public boolean isCommutative(CommutativityVerifier verifier) {
        for (PathPair pair : requiredCommutations) {
            if (!verifier.pathsCommute(pair.first(), pair.second())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks each required pair and returns one proof per pair, in the order
     * they were required.
     */
    public List<CommutativityProof> verify() {
        return verify(new CommutativityVerifier(category));
    }

    public List<CommutativityProof> verify(CommutativityVerifier verifier) {
        List<CommutativityProof> proofs = new ArrayList<>(requiredCommutations.size());
        for (int i = 0; i < requiredCommutations.size(); i++) {
            PathPair pair = requiredCommutations.get(i);
            proofs.add(verifier.checkPaths(name + "#" + i, List.of(pair.first(), pair.second())));
        }
        return proofs;
    }

    public List<PathPair> requiredCommutations() {
        return List.copyOf(requiredCommutations);
    }

    public Set<CategoryObject> objects() {
        return Collections.unmodifiableSet(objects);
    }

    public Set<Morphism> morphisms() {
        return Collections.unmodifiableSet(morphisms);
    }

    private void recordPath(MorphismPath path) {
        List<MorphismPath> atEndpoints =
                paths.computeIfAbsent(new Endpoints(path.source(), path.target()), k -> new ArrayList<>());
        if (!atEndpoints.contains(path)) {
            atEndpoints.add(path);
        }
    }

    private static MorphismPath composablePath(List<Morphism> chain) {
        MorphismPath path = new MorphismPath(chain);
        if (path.isEmpty()) {
            throw new IllegalArgumentException("A path needs at least one morphism");
        }
        if (!path.isComposable()) {
            throw new IllegalArgumentException("Morphisms do not chain: " + chain);
        }
        return path;
    }

    @Override
    public String toString() {
        return String.format("CommutativeDiagram[%s in %s, objects=%d, morphisms=%d, required=%d]",
                name, category.name(), objects.size(), morphisms.size(), requiredCommutations.size());
    }

    private record Endpoints(CategoryObject source, CategoryObject target) {}
}
