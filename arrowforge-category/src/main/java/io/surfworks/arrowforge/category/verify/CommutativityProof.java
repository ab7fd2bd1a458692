package io.surfworks.arrowforge.category.verify;

import java.util.List;
import java.util.Optional;

import io.surfworks.arrowforge.category.PathValidationResult;

/**
 * Report of a composition-based commutativity check.
 *
 * <p>Unlike a rewrite {@link io.surfworks.arrowforge.rewrite.Certificate}, this
 * carries no replayable steps: it records which composites were compared and
 * what the composition table said.
 *
 * @param shapeName the triangle, square or diagram that was checked
 * @param comparedPaths the pairs of path names that were compared
 * @param steps human-readable log of the check
 * @param valid true if the shape commutes
 * @param failureReason why the shape does not commute, or null if it does
 * @param validation the structural validation result of the shape
 */
public record CommutativityProof(
        String shapeName,
        List<PathNamePair> comparedPaths,
        List<String> steps,
        boolean valid,
        String failureReason,
        PathValidationResult validation
) {

    public CommutativityProof {
        comparedPaths = List.copyOf(comparedPaths);
        steps = List.copyOf(steps);
        if (!valid && failureReason == null) {
            throw new IllegalArgumentException("a failed proof needs a failure reason");
        }
        if (valid && !validation.isValid()) {
            throw new IllegalArgumentException("a proof of an invalid shape cannot succeed");
        }
    }

    static CommutativityProof success(String shapeName, List<PathNamePair> compared, List<String> steps) {
        return new CommutativityProof(shapeName, compared, steps, true, null, PathValidationResult.VALID);
    }

    static CommutativityProof failure(String shapeName, List<PathNamePair> compared, List<String> steps,
                                      String reason, PathValidationResult validation) {
        return new CommutativityProof(shapeName, compared, steps, false, reason, validation);
    }

    /**
     * Returns the failure reason, if the shape does not commute.
     */
    public Optional<String> failure() {
        return Optional.ofNullable(failureReason);
    }

    @Override
    public String toString() {
        return valid
                ? String.format("CommutativityProof[%s commutes]", shapeName)
                : String.format("CommutativityProof[%s fails: %s]", shapeName, failureReason);
    }
}
