package win.ixuni.ferry.server.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import reactor.core.publisher.Mono;
import win.ixuni.ferry.core.config.FerryProperties;
import win.ixuni.ferry.core.config.MigrationDriverConfig;
import win.ixuni.ferry.core.http.ProxyRequest;
import win.ixuni.ferry.core.http.ProxyResponse;
import win.ixuni.ferry.core.migration.driver.MigrationDriverRegistry;
import win.ixuni.ferry.core.pipeline.MiddlewarePipeline;
import win.ixuni.ferry.core.pipeline.ProxyHandler;
import win.ixuni.ferry.core.util.BodyUtils;
import win.ixuni.ferry.driver.local.LocalMigrationDriverFactory;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 集群信息测试：后端信息与迁移驱动信息合并
 */
class ClusterInfoHandlerTest {

    private FerryProperties properties;
    private MigrationDriverRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new FerryProperties();
        properties.getMigration().setSupportedDrivers("fsystem,ghost");
        MigrationDriverConfig ghost = new MigrationDriverConfig();
        ghost.setType("not-installed");
        properties.getMigration().getDrivers().put("ghost", ghost);
        registry = new MigrationDriverRegistry(properties.getMigration(), List.of(new LocalMigrationDriverFactory()));
    }

    private Map<String, Object> info(ProxyHandler backend) {
        ClusterInfoHandler handler = new ClusterInfoHandler(new MiddlewarePipeline(List.of(), backend),
                registry, properties, new ObjectMapper());
        ProxyRequest request = ProxyRequest.builder().method("GET").path(ClusterInfoHandler.INFO_PATH).build();
        return handler.clusterInfo(request).block();
    }

    private static ProxyHandler json(String body) {
        return request -> {
            ProxyResponse response = ProxyResponse.of(200);
            response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
            response.getHeaders().setContentLength(body.length());
            response.setBody(BodyUtils.of(body));
            return Mono.just(response);
        };
    }

    @Test
    @DisplayName("后端 JSON 信息中追加已加载的迁移提供方")
    void testClusterInfo_MergesBackendInfo() {
        Map<String, Object> info = info(json("{\"swift\":{\"version\":\"2.7.0\"},\"tempurl\":{}}"));

        assertEquals(Map.of("version", "2.7.0"), info.get("swift"));
        assertTrue(info.containsKey("tempurl"));
        assertEquals(Map.of("fsystem", "enabled"), info.get(ClusterInfoHandler.MIGRATION_SECTION));
    }

    @Test
    @DisplayName("后端无 JSON 信息时只返回迁移部分")
    void testClusterInfo_BackendWithoutInfo() {
        Map<String, Object> info = info(request -> Mono.just(ProxyResponse.text(404, "Not Found")));

        assertEquals(Map.of(ClusterInfoHandler.MIGRATION_SECTION, Map.of("fsystem", "enabled")), info);

        Map<String, Object> unreadable = info(json("not json"));
        assertEquals(List.of(ClusterInfoHandler.MIGRATION_SECTION), List.copyOf(unreadable.keySet()));
    }

    @Test
    @DisplayName("迁移关闭时不公布迁移部分")
    void testClusterInfo_MigrationDisabled() {
        properties.getMigration().setEnabled(false);

        Map<String, Object> info = info(json("{\"swift\":{}}"));

        assertFalse(info.containsKey(ClusterInfoHandler.MIGRATION_SECTION));
        assertTrue(info.containsKey("swift"));
    }
}
