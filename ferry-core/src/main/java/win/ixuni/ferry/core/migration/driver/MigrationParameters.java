package win.ixuni.ferry.core.migration.driver;

import win.ixuni.ferry.core.exception.MigrationDriverException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 迁移参数
 * <p>
 * Required keys taken from the container metadata plus the static
 * parameters configured for the provider. Lives for one migration attempt.
 */
public final class MigrationParameters {

    private final Map<String, String> values;

    public MigrationParameters(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static MigrationParameters of(Map<String, String> values) {
        return new MigrationParameters(values);
    }

    public String get(String key) {
        return values.get(key);
    }

    public String get(String key, String defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = values.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    /**
     * @throws MigrationDriverException when the key is absent or blank
     */
    public String require(String key) {
        String value = values.get(key);
        if (value == null || value.isBlank()) {
            throw new MigrationDriverException("Missing value for " + key);
        }
        return value;
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        // values may carry credentials
        return "MigrationParameters" + values.keySet();
    }
}
