package win.ixuni.ferry.core.config;

import lombok.Data;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Migration driver configuration
 * <p>
 * One entry per provider. {@code type} names the factory implementing the
 * provider, {@code keys} the container metadata the provider needs and
 * {@code properties} the static parameters handed to every driver instance.
 */
@Data
public class MigrationDriverConfig {

    /**
     * Factory type, e.g. "fsystem", "s3", "swift". Defaults to the provider name.
     */
    private String type;

    /**
     * Comma-separated required container metadata keys, e.g. "token-url,user,key"
     */
    private String keys = "";

    /**
     * Driver-specific static parameters
     */
    private Map<String, Object> properties = new HashMap<>();

    /**
     * Split {@link #keys} into a list, dropping blanks
     */
    public List<String> getKeyList() {
        if (keys == null) {
            return List.of();
        }
        return Arrays.stream(keys.split(","))
                .map(String::trim)
                .filter(k -> !k.isEmpty())
                .toList();
    }

    /**
     * Get a string configuration value
     */
    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
