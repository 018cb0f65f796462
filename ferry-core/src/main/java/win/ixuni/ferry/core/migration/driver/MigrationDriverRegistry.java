package win.ixuni.ferry.core.migration.driver;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.ferry.core.config.FerryProperties;
import win.ixuni.ferry.core.config.MigrationDriverConfig;
import win.ixuni.ferry.core.exception.MigrationDriverException;
import win.ixuni.ferry.core.exception.MigrationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 迁移驱动注册表
 * <p>
 * Built once at startup from {@code ferry.migration} and the available
 * factories, read-only afterwards. A provider whose factory is unknown or
 * whose libraries are missing stays registered with {@code driverLoaded=false}
 * so that it fails per request instead of at startup.
 */
@Slf4j
public class MigrationDriverRegistry {

    public static final String MIGRATION_PREFIX = "migration-";
    public static final String ACTIVE = MIGRATION_PREFIX + "active";
    public static final String PROVIDER = MIGRATION_PREFIX + "provider";
    public static final String SOURCE = MIGRATION_PREFIX + "source";

    /**
     * Registration mapping: provider -> registration
     */
    private final Map<String, DriverRegistration> registrations;

    /**
     * Registry over the factories declared in META-INF/services, for use without Spring
     */
    public MigrationDriverRegistry(FerryProperties.MigrationConfig config) {
        this(config, MigrationDriverFactoryLoader.load());
    }

    public MigrationDriverRegistry(FerryProperties.MigrationConfig config, List<MigrationDriverFactory> factories) {
        log.info("Initializing migration driver registry...");

        Map<String, MigrationDriverFactory> factoryMap = new HashMap<>();
        for (MigrationDriverFactory factory : factories) {
            factoryMap.put(factory.getDriverType().toLowerCase(Locale.ROOT), factory);
            log.info("Registered migration driver factory: {} - {}", factory.getDriverType(), factory.getDescription());
        }

        Map<String, DriverRegistration> result = new LinkedHashMap<>();
        for (String provider : splitCsv(config.getSupportedDrivers())) {
            MigrationDriverConfig driverConfig = config.getDrivers().get(provider);
            if (driverConfig == null) {
                driverConfig = new MigrationDriverConfig();
            }
            String type = driverConfig.getType() != null
                    ? driverConfig.getType().toLowerCase(Locale.ROOT)
                    : provider;

            MigrationDriverFactory factory = factoryMap.get(type);
            boolean loaded = false;
            if (factory == null) {
                log.error("Unknown migration driver type '{}' for provider '{}'", type, provider);
            } else if (!factory.isAvailable()) {
                log.warn("Migration driver '{}' is not available, provider '{}' is disabled", type, provider);
            } else {
                loaded = true;
            }

            Map<String, String> staticParams = new LinkedHashMap<>();
            driverConfig.getProperties().forEach((k, v) -> staticParams.put(k, v == null ? null : v.toString()));

            DriverRegistration registration = DriverRegistration.builder()
                    .provider(provider)
                    .driverType(type)
                    .requiredKeys(driverConfig.getKeyList().stream()
                            .map(k -> k.toLowerCase(Locale.ROOT))
                            .toList())
                    .driverLoaded(loaded)
                    .staticParams(Collections.unmodifiableMap(staticParams))
                    .factory(loaded ? factory : null)
                    .build();
            result.put(provider, registration);
            log.info("Registered migration provider: {} (type: {}, loaded: {}, keys: {})",
                    provider, type, loaded, registration.getRequiredKeys());
        }
        this.registrations = Collections.unmodifiableMap(result);
        log.info("Migration driver registry initialized with {} providers, enabled: {}",
                registrations.size(), getEnabledProviders());
    }

    public Optional<DriverRegistration> find(String provider) {
        if (provider == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registrations.get(provider.toLowerCase(Locale.ROOT)));
    }

    public Map<String, DriverRegistration> getRegistrations() {
        return registrations;
    }

    /**
     * 已加载驱动的提供方，按名称排序；对外公布在集群信息中
     */
    public List<String> getEnabledProviders() {
        return registrations.values().stream()
                .filter(DriverRegistration::isDriverLoaded)
                .map(DriverRegistration::getProvider)
                .sorted()
                .toList();
    }

    /**
     * Create the driver for a container
     *
     * @param containerMetadata lower-cased {@code migration-*} sys-meta of the container
     * @return a fresh driver, to be closed by the caller
     * @throws MigrationException when the provider is unknown or unloaded, a
     *                            required key is missing or the driver rejects its parameters
     */
    public MigrationDriver resolve(Map<String, String> containerMetadata) {
        String provider = containerMetadata.getOrDefault(PROVIDER, "").toLowerCase(Locale.ROOT);
        String source = containerMetadata.getOrDefault(SOURCE, "").toLowerCase(Locale.ROOT);

        DriverRegistration registration = registrations.get(provider);
        if (registration == null) {
            throw new MigrationException("Migration provider is missing");
        }
        if (!registration.isDriverLoaded()) {
            throw new MigrationException("Failed to retrieve remote driver");
        }

        Map<String, String> params = new LinkedHashMap<>();
        for (String key : registration.getRequiredKeys()) {
            String value = containerMetadata.get(MIGRATION_PREFIX + key);
            if (value == null) {
                throw new MigrationException("Missing required key: " + key);
            }
            params.put(key, value);
        }
        params.putAll(registration.getStaticParams());

        try {
            return registration.getFactory().createDriver(source, MigrationParameters.of(params));
        } catch (MigrationDriverException e) {
            throw new MigrationException(e.getMessage(), e);
        }
    }

    private static List<String> splitCsv(String csv) {
        if (csv == null) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }
}
