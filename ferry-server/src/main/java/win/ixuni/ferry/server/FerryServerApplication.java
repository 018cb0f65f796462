package win.ixuni.ferry.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import win.ixuni.ferry.core.config.FerryProperties;

/**
 * Ferry 服务器启动类
 * <p>
 * Scans the driver modules so that every migration driver factory on the
 * classpath registers itself.
 */
@SpringBootApplication(scanBasePackages = "win.ixuni.ferry")
@EnableConfigurationProperties(FerryProperties.class)
public class FerryServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FerryServerApplication.class, args);
    }
}
