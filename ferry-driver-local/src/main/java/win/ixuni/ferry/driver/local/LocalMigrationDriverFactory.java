package win.ixuni.ferry.driver.local;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.ferry.core.migration.driver.MigrationDriver;
import win.ixuni.ferry.core.migration.driver.MigrationDriverFactory;
import win.ixuni.ferry.core.migration.driver.MigrationParameters;

/**
 * 本地文件系统迁移驱动工厂
 */
@Slf4j
@Component
public class LocalMigrationDriverFactory implements MigrationDriverFactory {

    public static final String DRIVER_TYPE = "fsystem";

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public MigrationDriver createDriver(String source, MigrationParameters params) {
        log.debug("Creating filesystem migration driver for source: {}", source);
        return new LocalMigrationDriver(source, params);
    }

    @Override
    public String getDescription() {
        return "Local filesystem migration driver";
    }
}
