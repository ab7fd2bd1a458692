package io.surfworks.arrowforge.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import io.surfworks.arrowforge.path.Path;

/**
 * An ordered proof trace witnessing that one path rewrites to another.
 *
 * <p>Replaying the steps against the start path, in order, substituting each
 * relation's pattern at the recorded offset, yields the end path exactly. The
 * empty certificate witnesses only {@code start == end}.
 *
 * <p>Example:
 * <pre>{@code
 * SearchResult result = engine.search(Path.of("a", "b"), Path.of("b", "a"), 64);
 * Certificate cert = result.certificate();     // [(swap, 0, →)]
 * cert.replay(Path.of("a", "b"), relations);   // b·a
 * }</pre>
 */
public final class Certificate {

    private static final Certificate EMPTY = new Certificate(List.of());

    private final List<RewriteStep> steps;

    private Certificate(List<RewriteStep> steps) {
        this.steps = steps;
    }

    /**
     * Returns the empty certificate.
     */
    public static Certificate empty() {
        return EMPTY;
    }

    /**
     * Creates a certificate from the given steps.
     */
    public static Certificate of(List<RewriteStep> steps) {
        return steps.isEmpty() ? EMPTY : new Certificate(List.copyOf(steps));
    }

    /**
     * Returns a new certificate with {@code step} appended.
     */
    public Certificate append(RewriteStep step) {
        List<RewriteStep> extended = new ArrayList<>(steps.size() + 1);
        extended.addAll(steps);
        extended.add(step);
        return new Certificate(List.copyOf(extended));
    }

    public List<RewriteStep> steps() {
        return steps;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int length() {
        return steps.size();
    }

    /**
     * Mechanically replays this certificate.
     *
     * <p>Each step applies the relation registered under the step's name at the
     * recorded offset.
     *
     * @param start the path the certificate starts from
     * @param relations the registry the certificate was produced against
     * @return the path reached after the last step
     * @throws CertificateReplayException if a step names an unknown relation or
     *         its pattern does not occur at the recorded offset
     */
    public <S> Path<S> replay(Path<S> start, RelationSet<S> relations) {
        Path<S> current = start;
        for (int i = 0; i < steps.size(); i++) {
            current = apply(current, steps.get(i), relations, i);
        }
        return current;
    }

    /**
     * Returns true if replaying this certificate from {@code start} reaches {@code end}.
     * A step that fails to apply counts as not verifying.
     */
    public <S> boolean verifies(Path<S> start, Path<S> end, RelationSet<S> relations) {
        try {
            return replay(start, relations).equals(end);
        } catch (CertificateReplayException e) {
            return false;
        }
    }

    private static <S> Path<S> apply(Path<S> path, RewriteStep step, RelationSet<S> relations, int index) {
        Relation<S> relation = relations.byName(step.relationName())
                .orElseThrow(() -> new CertificateReplayException(
                        "Unknown relation '" + step.relationName() + "'", index));
        List<S> pattern = relation.pattern(step.direction());
        if (!path.matchesAt(pattern, step.offset())) {
            throw new CertificateReplayException(String.format(
                    "Relation '%s' %s does not match %s at offset %d",
                    step.relationName(), step.direction().arrow(), path, step.offset()), index);
        }
        return path.replace(step.offset(), pattern.size(), relation.replacement(step.direction()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Certificate other)) return false;
        return steps.equals(other.steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return steps.stream().map(RewriteStep::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
