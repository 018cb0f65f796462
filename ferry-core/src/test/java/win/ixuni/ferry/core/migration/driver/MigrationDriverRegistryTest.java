package win.ixuni.ferry.core.migration.driver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.ferry.core.config.FerryProperties;
import win.ixuni.ferry.core.config.MigrationDriverConfig;
import win.ixuni.ferry.core.exception.MigrationException;
import win.ixuni.ferry.core.support.FakeMigrationDriverFactory;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MigrationDriverRegistryTest {

    private FakeMigrationDriverFactory remote;
    private MigrationDriverRegistry registry;

    @BeforeEach
    void setUp() {
        FerryProperties.MigrationConfig config = new FerryProperties.MigrationConfig();
        config.setSupportedDrivers(" Remote, ghost ,offline,remote");

        MigrationDriverConfig remoteConfig = new MigrationDriverConfig();
        remoteConfig.setType("fake");
        remoteConfig.setKeys("token-url, User");
        remoteConfig.getProperties().put("region", "eu-west-1");
        config.getDrivers().put("remote", remoteConfig);

        MigrationDriverConfig ghostConfig = new MigrationDriverConfig();
        ghostConfig.setType("does-not-exist");
        config.getDrivers().put("ghost", ghostConfig);

        remote = new FakeMigrationDriverFactory("fake");
        registry = new MigrationDriverRegistry(config, List.of(remote, new FakeMigrationDriverFactory("offline", false)));
    }

    @Test
    @DisplayName("按配置注册提供方，未知类型和不可用驱动标记为未加载")
    void testRegistrations() {
        assertEquals(List.of("remote", "ghost", "offline"), List.copyOf(registry.getRegistrations().keySet()));

        DriverRegistration reg = registry.find("REMOTE").orElseThrow();
        assertTrue(reg.isDriverLoaded());
        assertEquals("fake", reg.getDriverType());
        assertEquals(List.of("token-url", "user"), reg.getRequiredKeys());
        assertEquals(Map.of("region", "eu-west-1"), reg.getStaticParams());

        assertFalse(registry.find("ghost").orElseThrow().isDriverLoaded());
        assertFalse(registry.find("offline").orElseThrow().isDriverLoaded());
        assertTrue(registry.find("nope").isEmpty());
    }

    @Test
    @DisplayName("只公布驱动已加载的提供方")
    void testEnabledProviders() {
        assertEquals(List.of("remote"), registry.getEnabledProviders());

        FerryProperties.MigrationConfig config = new FerryProperties.MigrationConfig();
        config.setSupportedDrivers("zeta,alpha");
        MigrationDriverRegistry sorted = new MigrationDriverRegistry(config,
                List.of(new FakeMigrationDriverFactory("zeta"), new FakeMigrationDriverFactory("alpha")));
        assertEquals(List.of("alpha", "zeta"), sorted.getEnabledProviders());
    }

    @Test
    @DisplayName("解析驱动：合并容器元数据和静态参数，源名称转小写")
    void testResolve() {
        MigrationDriver driver = registry.resolve(Map.of(
                "migration-provider", "Remote",
                "migration-source", "Legacy",
                "migration-token-url", "http://auth",
                "migration-user", "tester"));

        assertNotNull(driver);
        assertEquals("legacy", remote.getLastSource());
        assertEquals("http://auth", remote.getLastParams().get("token-url"));
        assertEquals("tester", remote.getLastParams().get("user"));
        assertEquals("eu-west-1", remote.getLastParams().get("region"));
    }

    @Test
    @DisplayName("解析失败抛出 MigrationException")
    void testResolve_Failures() {
        MigrationException unknown = assertThrows(MigrationException.class,
                () -> registry.resolve(Map.of("migration-provider", "nope", "migration-source", "x")));
        assertEquals("Migration provider is missing", unknown.getMessage());

        MigrationException unloaded = assertThrows(MigrationException.class,
                () -> registry.resolve(Map.of("migration-provider", "ghost", "migration-source", "x")));
        assertEquals("Failed to retrieve remote driver", unloaded.getMessage());

        MigrationException missingKey = assertThrows(MigrationException.class,
                () -> registry.resolve(Map.of("migration-provider", "remote", "migration-source", "x",
                        "migration-token-url", "http://auth")));
        assertEquals("Missing required key: user", missingKey.getMessage());
        assertEquals(404, missingKey.getHttpStatus());

        MigrationException rejected = assertThrows(MigrationException.class,
                () -> registry.resolve(Map.of("migration-provider", "remote", "migration-source", "broken",
                        "migration-token-url", "http://auth", "migration-user", "u")));
        assertEquals("Migration source broken is invalid", rejected.getMessage());
    }
}
