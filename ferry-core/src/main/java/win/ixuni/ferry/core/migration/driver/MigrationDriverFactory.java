package win.ixuni.ferry.core.migration.driver;

/**
 * Migration driver factory interface
 * <p>
 * Each provider type ships a factory; the registry maps configured provider
 * names to factories by {@link #getDriverType()}.
 */
public interface MigrationDriverFactory {

    /**
     * @return driver type identifier (e.g. "fsystem", "s3", "swift")
     */
    String getDriverType();

    /**
     * Whether the libraries this driver needs are on the classpath
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create a driver for one migration attempt
     *
     * @param source container or folder holding the objects to migrate
     * @param params resolved parameters
     * @return driver instance
     * @throws win.ixuni.ferry.core.exception.MigrationDriverException when the parameters are invalid
     */
    MigrationDriver createDriver(String source, MigrationParameters params);

    default String getDescription() {
        return getDriverType() + " migration driver";
    }
}
