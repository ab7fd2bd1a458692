package io.surfworks.arrowforge.config;

/**
 * Configuration for bounded rewrite searches.
 *
 * <p>The budget is an expansion count (paths dequeued), not wall-clock time,
 * and is the only way a search is cut short. A budget of 0 permits only the
 * reflexive fast path.
 *
 * @param budget the default number of expansions per search
 */
public record SearchConfig(int budget) {

    /**
     * Environment variable overriding the default budget.
     */
    public static final String ENV_SEARCH_BUDGET = "ARROWFORGE_SEARCH_BUDGET";

    /**
     * Default expansion budget.
     */
    public static final int DEFAULT_BUDGET = 2048;

    public SearchConfig {
        if (budget < 0) {
            throw new IllegalArgumentException("budget must be >= 0, got " + budget);
        }
    }

    /**
     * Returns the default configuration.
     */
    public static SearchConfig defaults() {
        return new SearchConfig(DEFAULT_BUDGET);
    }

    /**
     * Returns the default configuration with environment overrides applied.
     */
    public static SearchConfig fromEnvironment() {
        return fromEnvironment(EnvironmentSettings.system());
    }

    /**
     * Returns the default configuration with overrides read from {@code settings}.
     */
    public static SearchConfig fromEnvironment(EnvironmentSettings settings) {
        return new SearchConfig(settings.getNonNegativeInt(ENV_SEARCH_BUDGET, DEFAULT_BUDGET));
    }

    /**
     * Returns a copy with a different budget.
     */
    public SearchConfig withBudget(int budget) {
        return new SearchConfig(budget);
    }
}
