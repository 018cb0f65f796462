package win.ixuni.ferry.core.support;

import lombok.Getter;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.exception.MigrationDriverException;
import win.ixuni.ferry.core.migration.driver.MigratedObject;
import win.ixuni.ferry.core.migration.driver.MigrationDriver;
import win.ixuni.ferry.core.migration.driver.MigrationDriverFactory;
import win.ixuni.ferry.core.migration.driver.MigrationParameters;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存中的迁移源，统计 fetch/close 调用次数
 */
@Getter
public class FakeMigrationDriverFactory implements MigrationDriverFactory {

    private final String driverType;
    private final boolean available;
    private final Map<String, MigratedObject> objects = new ConcurrentHashMap<>();
    private final AtomicInteger fetches = new AtomicInteger();
    private final AtomicInteger closes = new AtomicInteger();
    private volatile String lastSource;
    private volatile MigrationParameters lastParams;

    public FakeMigrationDriverFactory(String driverType) {
        this(driverType, true);
    }

    public FakeMigrationDriverFactory(String driverType, boolean available) {
        this.driverType = driverType;
        this.available = available;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public MigrationDriver createDriver(String source, MigrationParameters params) {
        if ("broken".equals(source)) {
            throw new MigrationDriverException("Migration source broken is invalid");
        }
        lastSource = source;
        lastParams = params;
        return new MigrationDriver() {
            @Override
            public Mono<MigratedObject> fetch(String objectName) {
                fetches.incrementAndGet();
                MigratedObject object = objects.get(objectName);
                if (object == null) {
                    return Mono.error(new MigrationDriverException("Object GET failed: " + objectName));
                }
                return Mono.just(object);
            }

            @Override
            public void close() {
                closes.incrementAndGet();
            }
        };
    }
}
