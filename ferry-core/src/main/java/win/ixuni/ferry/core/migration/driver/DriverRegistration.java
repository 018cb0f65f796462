package win.ixuni.ferry.core.migration.driver;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One configured migration provider
 */
@Value
@Builder
public class DriverRegistration {

    /**
     * Provider name as used in X-Container-Migration-Provider
     */
    String provider;

    /**
     * Factory type implementing the provider
     */
    String driverType;

    /**
     * Container metadata keys the driver needs, lower case
     */
    List<String> requiredKeys;

    /**
     * False when no factory of {@link #driverType} exists or its libraries are missing
     */
    boolean driverLoaded;

    Map<String, String> staticParams;

    /**
     * {@code null} when not loaded
     */
    MigrationDriverFactory factory;
}
