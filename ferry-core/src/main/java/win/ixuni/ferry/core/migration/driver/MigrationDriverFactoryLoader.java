package win.ixuni.ferry.core.migration.driver;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Migration driver factory loader
 * <p>
 * Discovers {@link MigrationDriverFactory} implementations declared in
 * META-INF/services, for setups that run the pipeline without Spring.
 */
@Slf4j
public final class MigrationDriverFactoryLoader {

    private MigrationDriverFactoryLoader() {
    }

    public static List<MigrationDriverFactory> load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static List<MigrationDriverFactory> load(ClassLoader classLoader) {
        ServiceLoader<MigrationDriverFactory> loader = ServiceLoader.load(MigrationDriverFactory.class, classLoader);
        List<MigrationDriverFactory> factories = new ArrayList<>();

        for (MigrationDriverFactory factory : loader) {
            factories.add(factory);
            log.info("Discovered migration driver factory via SPI: {} - {}",
                    factory.getDriverType(), factory.getDescription());
        }

        if (factories.isEmpty()) {
            log.warn("No MigrationDriverFactory implementations found via SPI");
        }
        return Collections.unmodifiableList(factories);
    }
}
