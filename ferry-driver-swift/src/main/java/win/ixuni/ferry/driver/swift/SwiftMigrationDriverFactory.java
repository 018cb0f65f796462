package win.ixuni.ferry.driver.swift;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;
import org.springframework.web.reactive.function.client.WebClient;
import win.ixuni.ferry.core.migration.driver.MigrationDriver;
import win.ixuni.ferry.core.migration.driver.MigrationDriverFactory;
import win.ixuni.ferry.core.migration.driver.MigrationParameters;

/**
 * Swift 迁移驱动工厂
 * <p>
 * All drivers share one {@link WebClient}.
 */
@Slf4j
@Component
public class SwiftMigrationDriverFactory implements MigrationDriverFactory {

    public static final String DRIVER_TYPE = "swift";

    private final WebClient webClient;

    public SwiftMigrationDriverFactory() {
        this(WebClient.builder().build());
    }

    public SwiftMigrationDriverFactory(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public boolean isAvailable() {
        return ClassUtils.isPresent("reactor.netty.http.client.HttpClient",
                SwiftMigrationDriverFactory.class.getClassLoader());
    }

    @Override
    public MigrationDriver createDriver(String source, MigrationParameters params) {
        log.debug("Creating Swift migration driver for container: {}", source);
        return new SwiftMigrationDriver(webClient, source, params);
    }

    @Override
    public String getDescription() {
        return "Remote Swift cluster migration driver";
    }
}
