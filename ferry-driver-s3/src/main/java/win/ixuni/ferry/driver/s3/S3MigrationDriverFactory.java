package win.ixuni.ferry.driver.s3;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;
import win.ixuni.ferry.core.migration.driver.MigrationDriver;
import win.ixuni.ferry.core.migration.driver.MigrationDriverFactory;
import win.ixuni.ferry.core.migration.driver.MigrationParameters;

/**
 * S3 迁移驱动工厂
 * <p>
 * The AWS SDK is optional; without it the provider stays registered but unloaded.
 */
@Slf4j
@Component
public class S3MigrationDriverFactory implements MigrationDriverFactory {

    public static final String DRIVER_TYPE = "s3";

    static final String SDK_CLASS = "software.amazon.awssdk.services.s3.S3AsyncClient";

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public boolean isAvailable() {
        return ClassUtils.isPresent(SDK_CLASS, S3MigrationDriverFactory.class.getClassLoader());
    }

    @Override
    public MigrationDriver createDriver(String source, MigrationParameters params) {
        log.debug("Creating S3 migration driver for bucket: {}", source);
        return new S3MigrationDriver(source, params);
    }

    @Override
    public String getDescription() {
        return "S3-compatible object store migration driver (MinIO, AWS S3, ...)";
    }
}
