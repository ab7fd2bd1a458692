package io.surfworks.arrowforge.ncat;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import io.surfworks.arrowforge.config.SearchConfig;
import io.surfworks.arrowforge.path.Boundary;
import io.surfworks.arrowforge.path.Path;
import io.surfworks.arrowforge.rewrite.Certificate;
import io.surfworks.arrowforge.rewrite.MalformedRelationException;
import io.surfworks.arrowforge.rewrite.RelationSet;
import io.surfworks.arrowforge.rewrite.RewriteEngine;
import io.surfworks.arrowforge.rewrite.SearchResult;

/**
 * A finite presentation of a weak n-category: generators and relations
 * partitioned by dimension {@code 1..n}.
 *
 * <p>Paths at dimension k are sequences of indices into that dimension's
 * generator list. Equality of two such paths is decided by the bounded
 * {@link RewriteEngine} scoped to dimension k's relations.
 *
 * <p>Example:
 * <pre>{@code
 * FiniteWeakNCategory cat = new FiniteWeakNCategory(2);
 * int a = cat.addGenerator(new Generator(1, "a", 0, 1));
 * int b = cat.addGenerator(new Generator(1, "b", 1, 2));
 * cat.addRelation(new DimensionedRelation(1, List.of(a, b), List.of(b, a), "swap"));
 *
 * Certificate cert = cat.certificate(1, Path.of(a, b, a), Path.of(b, a, a), 64);
 * }</pre>
 */
public final class FiniteWeakNCategory {

    private static final Logger LOG = Logger.getLogger(FiniteWeakNCategory.class.getName());

    private final int n;
    private final List<List<Generator>> generators;
    private final List<RelationSet<Integer>> relations;
    private final List<List<DimensionedRelation>> declared;
    private final SearchConfig config;

    /**
     * Creates an empty presentation with the default search configuration.
     *
     * @param n the top dimension ({@code >= 1})
     */
    public FiniteWeakNCategory(int n) {
        this(n, SearchConfig.defaults());
    }

    /**
     * Creates an empty presentation.
     *
     * @param n the top dimension ({@code >= 1})
     * @param config the search configuration used when no budget is given
     */
    public FiniteWeakNCategory(int n, SearchConfig config) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1, got " + n);
        }
        this.n = n;
        this.config = config;
        this.generators = new ArrayList<>(n);
        this.relations = new ArrayList<>(n);
        this.declared = new ArrayList<>(n);
        for (int k = 1; k <= n; k++) {
            generators.add(new ArrayList<>());
            relations.add(new RelationSet<>());
            declared.add(new ArrayList<>());
        }
    }

    /**
     * Returns the top dimension.
     */
    public int n() {
        return n;
    }

    /**
     * Registers a generator.
     *
     * @return the generator's index within its dimension
     * @throws DimensionOutOfBoundsException if {@code g.dim()} is not in {@code 1..n}
     */
    public int addGenerator(Generator g) {
        checkDimension(g.dim());
        List<Generator> atDim = generators.get(g.dim() - 1);
        int index = atDim.size();
        atDim.add(g);
        LOG.fine(() -> "Registered generator #" + index + " " + g);
        return index;
    }

    /**
     * Builds and registers a generator.
     */
    public int addGenerator(int dim, String name, int src, int tgt) {
        return addGenerator(new Generator(dim, name, src, tgt));
    }

    /**
     * Registers a relation.
     *
     * @return the relation's index within its dimension
     * @throws DimensionOutOfBoundsException if {@code r.dim()} is not in {@code 1..n}
     * @throws MalformedRelationException if a side references an unregistered generator
     *         or the name is already used at this dimension
     */
    public int addRelation(DimensionedRelation r) {
        checkDimension(r.dim());
        int generatorCount = generators.get(r.dim() - 1).size();
        checkIndices(r, r.lhs(), generatorCount);
        checkIndices(r, r.rhs(), generatorCount);

        List<DimensionedRelation> atDim = declared.get(r.dim() - 1);
        int index = atDim.size();
        relations.get(r.dim() - 1).add(r.toRelation());
        atDim.add(r);
        LOG.fine(() -> "Registered relation #" + index + " " + r);
        return index;
    }

    /**
     * Builds and registers a relation.
     */
    public int addRelation(int dim, String name, List<Integer> lhs, List<Integer> rhs) {
        return addRelation(new DimensionedRelation(dim, lhs, rhs, name));
    }

    /**
     * Returns the certificate rewriting {@code lhs} into {@code rhs} at {@code dim}.
     *
     * @return the certificate, or an empty certificate if none was found within
     *         the budget (also empty when {@code lhs.equals(rhs)})
     * @throws DimensionOutOfBoundsException if {@code dim} is not in {@code 1..n}
     */
    public Certificate certificate(int dim, Path<Integer> lhs, Path<Integer> rhs, int budget) {
        return prove(dim, lhs, rhs, budget).certificate();
    }

    /**
     * Same as {@link #certificate(int, Path, Path, int)} with the configured budget.
     */
    public Certificate certificate(int dim, Path<Integer> lhs, Path<Integer> rhs) {
        return certificate(dim, lhs, rhs, config.budget());
    }

    /**
     * Runs the bounded search at {@code dim} and returns the full three-valued result.
     */
    public SearchResult prove(int dim, Path<Integer> lhs, Path<Integer> rhs, int budget) {
        return engine(dim).search(lhs, rhs, budget);
    }

    /**
     * Returns a rewrite engine scoped to one dimension's relations.
     */
    public RewriteEngine<Integer> engine(int dim) {
        checkDimension(dim);
        return new RewriteEngine<>(relations.get(dim - 1), config);
    }

    /**
     * Returns the generators registered at {@code dim}, in index order.
     */
    public List<Generator> generators(int dim) {
        checkDimension(dim);
        return List.copyOf(generators.get(dim - 1));
    }

    /**
     * Returns the generator with the given index at {@code dim}.
     */
    public Generator generator(int dim, int index) {
        checkDimension(dim);
        List<Generator> atDim = generators.get(dim - 1);
        if (index < 0 || index >= atDim.size()) {
            throw new IllegalArgumentException(String.format(
                    "No generator #%d at dimension %d (have %d)", index, dim, atDim.size()));
        }
        return atDim.get(index);
    }

    /**
     * Returns the relations registered at {@code dim}, in registration order.
     */
    public List<DimensionedRelation> relationsFor(int dim) {
        checkDimension(dim);
        return List.copyOf(declared.get(dim - 1));
    }

    /**
     * Returns the relation registry the engine uses at {@code dim}.
     */
    public RelationSet<Integer> relationSet(int dim) {
        checkDimension(dim);
        return relations.get(dim - 1);
    }

    /**
     * Returns a boundary resolving generator indices at {@code dim} to their endpoints.
     */
    public Boundary<Integer, Integer> boundary(int dim) {
        checkDimension(dim);
        return new Boundary<>() {
            @Override
            public Integer sourceOf(Integer symbol) {
                return generator(dim, symbol).src();
            }

            @Override
            public Integer targetOf(Integer symbol) {
                return generator(dim, symbol).tgt();
            }
        };
    }

    /**
     * Returns true if consecutive generators of {@code path} chain target to source.
     */
    public boolean isComposable(int dim, Path<Integer> path) {
        return boundary(dim).isComposable(path);
    }

    /**
     * Source endpoint of a path at {@code dim}.
     */
    public int source(int dim, Path<Integer> path) {
        return boundary(dim).source(path);
    }

    /**
     * Target endpoint of a path at {@code dim}.
     */
    public int target(int dim, Path<Integer> path) {
        return boundary(dim).target(path);
    }

    private void checkDimension(int dim) {
        if (dim < 1 || dim > n) {
            throw new DimensionOutOfBoundsException(dim, 1, n);
        }
    }

    private static void checkIndices(DimensionedRelation r, List<Integer> side, int generatorCount) {
        for (Integer index : side) {
            if (index < 0 || index >= generatorCount) {
                throw new MalformedRelationException(r.name(), String.format(
                        "generator #%s is not registered at dimension %d", index, r.dim()));
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FiniteWeakNCategory[n=").append(n);
        for (int k = 1; k <= n; k++) {
            sb.append(String.format(", dim%d=(%d gens, %d rels)",
                    k, generators.get(k - 1).size(), declared.get(k - 1).size()));
        }
        return sb.append(']').toString();
    }
}
