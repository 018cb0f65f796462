package win.ixuni.ferry.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ferry main configuration
 */
@Data
@ConfigurationProperties(prefix = "ferry")
public class FerryProperties {

    /**
     * Backend configuration
     */
    private BackendConfig backend = new BackendConfig();

    /**
     * Server-side copy configuration
     */
    private CopyConfig copy = new CopyConfig();

    /**
     * Object creation limits
     */
    private ConstraintsConfig constraints = new ConstraintsConfig();

    /**
     * On-demand migration configuration
     */
    private MigrationConfig migration = new MigrationConfig();

    /**
     * Backend configuration
     */
    @Data
    public static class BackendConfig {

        /**
         * "forward" proxies to {@link #url}; "memory" keeps everything in process
         */
        private String type = "forward";

        /**
         * Base URL of the storage backend, e.g. http://127.0.0.1:6000
         */
        private String url = "http://127.0.0.1:8080";
    }

    /**
     * Server-side copy configuration
     */
    @Data
    public static class CopyConfig {

        /**
         * Treat object POST as a copy onto itself
         */
        private boolean objectPostAsCopy = true;
    }

    /**
     * Object creation limits
     */
    @Data
    public static class ConstraintsConfig {

        private int maxObjectNameLength = 1024;

        /**
         * Largest object a client may create, in bytes (5 GiB + 2)
         */
        private long maxFileSize = 5368709122L;
    }

    /**
     * On-demand migration configuration
     */
    @Data
    public static class MigrationConfig {

        private boolean enabled = true;

        /**
         * Comma-separated provider names, e.g. "fsystem,swift"
         */
        private String supportedDrivers = "";

        /**
         * Per-provider settings keyed by provider name
         */
        private Map<String, MigrationDriverConfig> drivers = new LinkedHashMap<>();
    }
}
