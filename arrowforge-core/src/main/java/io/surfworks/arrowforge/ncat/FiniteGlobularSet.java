package io.surfworks.arrowforge.ncat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A finite globular set truncated at dimension n.
 *
 * <p>Cells are stored per dimension {@code 0..n}. Every k-cell with k &gt; 0
 * has a source and a target (k-1)-cell, referenced by index.
 *
 * <p>Payloads are opaque.
 */
public final class FiniteGlobularSet {

    private final int n;
    private final List<List<Object>> cells;
    private final List<List<int[]>> boundaries;

    public FiniteGlobularSet(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got " + n);
        }
        this.n = n;
        this.cells = new ArrayList<>(n + 1);
        this.boundaries = new ArrayList<>(n + 1);
        for (int k = 0; k <= n; k++) {
            cells.add(new ArrayList<>());
            boundaries.add(new ArrayList<>());
        }
    }

    public int n() {
        return n;
    }

    /**
     * Adds a 0-cell.
     *
     * @return the new cell's index
     */
    public int addCell(int k, Object payload) {
        checkDimension(k);
        if (k > 0) {
            throw new IllegalArgumentException("cells of dimension " + k + " need a source and target");
        }
        return append(k, payload, null);
    }

    /**
     * Adds a k-cell with the given boundary.
     *
     * @param k the dimension ({@code 1..n})
     * @param payload the cell data
     * @param src index of the source (k-1)-cell
     * @param tgt index of the target (k-1)-cell
     * @return the new cell's index
     */
    public int addCell(int k, Object payload, int src, int tgt) {
        checkDimension(k);
        if (k == 0) {
            return append(0, payload, null);
        }
        int below = cells.get(k - 1).size();
        if (src < 0 || src >= below || tgt < 0 || tgt >= below) {
            throw new IllegalArgumentException(String.format(
                    "boundary (%d, %d) of %d-cell refers to missing %d-cells (have %d)",
                    src, tgt, k, k - 1, below));
        }
        return append(k, payload, new int[] {src, tgt});
    }

    public List<Object> cells(int k) {
        checkDimension(k);
        return Collections.unmodifiableList(new ArrayList<>(cells.get(k)));
    }

    public int size(int k) {
        checkDimension(k);
        return cells.get(k).size();
    }

    /**
     * Returns the index of the source (k-1)-cell of k-cell {@code index}.
     */
    public int source(int k, int index) {
        return boundary(k, index)[0];
    }

    /**
     * Returns the index of the target (k-1)-cell of k-cell {@code index}.
     */
    public int target(int k, int index) {
        return boundary(k, index)[1];
    }

    /**
     * Checks the globular identities {@code s∘s = s∘t} and {@code t∘s = t∘t}
     * for every cell of dimension 2 and above.
     */
    public boolean satisfiesGlobularIdentities() {
        for (int k = 2; k <= n; k++) {
            for (int i = 0; i < cells.get(k).size(); i++) {
                int s = source(k, i);
                int t = target(k, i);
                if (source(k - 1, s) != source(k - 1, t) || target(k - 1, s) != target(k - 1, t)) {
                    return false;
                }
            }
        }
        return true;
    }

    private int append(int k, Object payload, int[] boundary) {
        int index = cells.get(k).size();
        cells.get(k).add(payload);
        boundaries.get(k).add(boundary);
        return index;
    }

    private int[] boundary(int k, int index) {
        checkDimension(k);
        if (k == 0) {
            throw new IllegalArgumentException("0-cells have no boundary");
        }
        List<int[]> atDim = boundaries.get(k);
        if (index < 0 || index >= atDim.size()) {
            throw new IllegalArgumentException(String.format("No %d-cell #%d", k, index));
        }
        return atDim.get(index);
    }

    private void checkDimension(int k) {
        if (k < 0 || k > n) {
            throw new DimensionOutOfBoundsException(k, 0, n);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FiniteGlobularSet[n=").append(n);
        for (int k = 0; k <= n; k++) {
            sb.append(", ").append(k).append("-cells=").append(cells.get(k).size());
        }
        return sb.append(']').toString();
    }
}
