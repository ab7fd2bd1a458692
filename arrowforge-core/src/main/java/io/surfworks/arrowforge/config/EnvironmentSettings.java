package io.surfworks.arrowforge.config;

import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Reads typed settings from an environment map.
 *
 * <p>Values that are missing or cannot be parsed fall back to the supplied
 * default. Unparseable values are logged at WARNING.
 */
public final class EnvironmentSettings {

    private static final Logger LOG = Logger.getLogger(EnvironmentSettings.class.getName());

    private final Function<String, String> lookup;

    private EnvironmentSettings(Function<String, String> lookup) {
        this.lookup = lookup;
    }

    /**
     * Settings backed by {@link System#getenv(String)}.
     */
    public static EnvironmentSettings system() {
        return new EnvironmentSettings(System::getenv);
    }

    /**
     * Settings backed by a fixed map (for testing).
     */
    public static EnvironmentSettings of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(values);
        return new EnvironmentSettings(copy::get);
    }

    /**
     * Returns the raw value, or null if unset or blank.
     */
    public String get(String name) {
        String value = lookup.apply(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Returns a non-negative integer setting.
     */
    public int getNonNegativeInt(String name, int defaultValue) {
        String value = get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 0) {
                LOG.warning("Ignoring negative value for " + name + ": " + value);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            LOG.warning("Ignoring non-numeric value for " + name + ": " + value);
            return defaultValue;
        }
    }

    /**
     * Returns a boolean setting. Accepts "true"/"1" and "false"/"0".
     */
    public boolean getBoolean(String name, boolean defaultValue) {
        String value = get(name);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value) || "1".equals(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value) || "0".equals(value)) {
            return false;
        }
        LOG.warning("Ignoring non-boolean value for " + name + ": " + value);
        return defaultValue;
    }
}
