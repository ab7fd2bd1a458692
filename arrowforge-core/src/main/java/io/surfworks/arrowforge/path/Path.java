package io.surfworks.arrowforge.path;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An immutable, non-empty sequence of symbols representing a composite arrow.
 *
 * <p>Symbols are opaque: the only thing the rewrite machinery relies on is
 * {@link Object#equals(Object)} and {@link Object#hashCode()}. Labeled diagrams
 * use {@code String} symbols, the finite n-category uses {@code Integer}
 * generator indices.
 *
 * <p>Paths carry no boundary information of their own. Where a source and
 * target are needed they are resolved through a {@link Boundary} over the
 * first and last symbol.
 *
 * <p>Example:
 * <pre>{@code
 * Path<String> p = Path.of("x", "a", "b", "y");
 * p.matchesAt(List.of("a", "b"), 1);               // true
 * p.replace(1, 2, List.of("b", "a"));              // x·b·a·y
 * }</pre>
 *
 * @param <S> the symbol type
 */
public final class Path<S> {

    private final List<S> symbols;
    private final int hash;

    private Path(List<S> symbols) {
        this.symbols = symbols;
        this.hash = symbols.hashCode();
    }

    /**
     * Creates a path from a list of symbols.
     *
     * @param symbols the symbols, in composition order
     * @return the path
     * @throws InvalidPathException if the list is null, empty or contains null
     */
    public static <S> Path<S> of(List<? extends S> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            throw new InvalidPathException("Path must contain at least one symbol");
        }
        List<S> copy = new ArrayList<>(symbols.size());
        for (int i = 0; i < symbols.size(); i++) {
            S symbol = symbols.get(i);
            if (symbol == null) {
                throw new InvalidPathException("Path symbol at index " + i + " is null");
            }
            copy.add(symbol);
        }
        return new Path<>(Collections.unmodifiableList(copy));
    }

    /**
     * Creates a path from the given symbols.
     */
    @SafeVarargs
    public static <S> Path<S> of(S... symbols) {
        if (symbols == null) {
            throw new InvalidPathException("Path must contain at least one symbol");
        }
        return of(Arrays.asList(symbols));
    }

    /**
     * Returns the symbols of this path.
     */
    public List<S> symbols() {
        return symbols;
    }

    public int size() {
        return symbols.size();
    }

    public S get(int index) {
        return symbols.get(index);
    }

    public S first() {
        return symbols.get(0);
    }

    public S last() {
        return symbols.get(symbols.size() - 1);
    }

    /**
     * Checks whether {@code pattern} occurs in this path starting at {@code offset}.
     *
     * @param pattern the subsequence to look for
     * @param offset the start index
     * @return true if {@code path[offset : offset + pattern.size()] == pattern}
     */
    public boolean matchesAt(List<S> pattern, int offset) {
        int length = pattern.size();
        if (length == 0 || offset < 0 || offset + length > symbols.size()) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (!symbols.get(offset + i).equals(pattern.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the offsets at which {@code pattern} occurs, in ascending order.
     * Overlapping occurrences are all reported.
     */
    public List<Integer> occurrencesOf(List<S> pattern) {
        List<Integer> offsets = new ArrayList<>();
        int last = symbols.size() - pattern.size();
        for (int i = 0; i <= last; i++) {
            if (matchesAt(pattern, i)) {
                offsets.add(i);
            }
        }
        return offsets;
    }

    /**
     * Replaces {@code length} symbols starting at {@code offset} with {@code replacement}.
     *
     * @return the rewritten path
     * @throws IndexOutOfBoundsException if the range is outside this path
     * @throws InvalidPathException if the result would be empty
     */
    public Path<S> replace(int offset, int length, List<S> replacement) {
        Objects.checkFromIndexSize(offset, length, symbols.size());
        List<S> result = new ArrayList<>(symbols.size() - length + replacement.size());
        result.addAll(symbols.subList(0, offset));
        result.addAll(replacement);
        result.addAll(symbols.subList(offset + length, symbols.size()));
        return of(result);
    }

    /**
     * Returns this path followed by {@code other}.
     */
    public Path<S> concat(Path<S> other) {
        List<S> result = new ArrayList<>(symbols.size() + other.size());
        result.addAll(symbols);
        result.addAll(other.symbols);
        return new Path<>(Collections.unmodifiableList(result));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Path<?> other)) return false;
        return hash == other.hash && symbols.equals(other.symbols);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return symbols.stream().map(String::valueOf).collect(Collectors.joining("·"));
    }
}
