package io.surfworks.arrowforge.category.verify;

import io.surfworks.arrowforge.config.EnvironmentSettings;

/**
 * Configuration for {@link CommutativityVerifier}.
 *
 * <p>Exhaustive shape enumeration is {@code O(|objects|^4 × |morphisms|^4)} in
 * the worst case, so it is refused on categories with more objects than
 * {@code maxEnumerationObjects}.
 *
 * @param maxEnumerationObjects largest object count for which triangle/square enumeration runs
 * @param maxPathLength default length bound for {@link CommutativityVerifier#findAllPaths}
 * @param cachingEnabled whether path, composition and commutativity results are cached
 */
public record VerifierConfig(int maxEnumerationObjects, int maxPathLength, boolean cachingEnabled) {

    public static final String ENV_MAX_ENUMERATION_OBJECTS = "ARROWFORGE_MAX_ENUMERATION_OBJECTS";
    public static final String ENV_MAX_PATH_LENGTH = "ARROWFORGE_MAX_PATH_LENGTH";
    public static final String ENV_VERIFIER_CACHE = "ARROWFORGE_VERIFIER_CACHE";

    public static final int DEFAULT_MAX_ENUMERATION_OBJECTS = 12;
    public static final int DEFAULT_MAX_PATH_LENGTH = 5;

    public VerifierConfig {
        if (maxEnumerationObjects < 0) {
            throw new IllegalArgumentException("maxEnumerationObjects must be >= 0, got " + maxEnumerationObjects);
        }
        if (maxPathLength < 1) {
            throw new IllegalArgumentException("maxPathLength must be >= 1, got " + maxPathLength);
        }
    }

    public static VerifierConfig defaults() {
        return new VerifierConfig(DEFAULT_MAX_ENUMERATION_OBJECTS, DEFAULT_MAX_PATH_LENGTH, true);
    }

    /**
     * Returns the defaults with environment overrides applied.
     */
    public static VerifierConfig fromEnvironment() {
        return fromEnvironment(EnvironmentSettings.system());
    }

    public static VerifierConfig fromEnvironment(EnvironmentSettings settings) {
        int maxPathLength = settings.getNonNegativeInt(ENV_MAX_PATH_LENGTH, DEFAULT_MAX_PATH_LENGTH);
        return new VerifierConfig(
                settings.getNonNegativeInt(ENV_MAX_ENUMERATION_OBJECTS, DEFAULT_MAX_ENUMERATION_OBJECTS),
                Math.max(1, maxPathLength),
                settings.getBoolean(ENV_VERIFIER_CACHE, true));
    }

    public VerifierConfig withMaxEnumerationObjects(int maxEnumerationObjects) {
        return new VerifierConfig(maxEnumerationObjects, maxPathLength, cachingEnabled);
    }

    public VerifierConfig withMaxPathLength(int maxPathLength) {
        return new VerifierConfig(maxEnumerationObjects, maxPathLength, cachingEnabled);
    }

    public VerifierConfig withCaching(boolean cachingEnabled) {
        return new VerifierConfig(maxEnumerationObjects, maxPathLength, cachingEnabled);
    }
}
