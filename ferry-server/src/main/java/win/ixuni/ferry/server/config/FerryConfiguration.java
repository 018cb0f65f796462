package win.ixuni.ferry.server.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import win.ixuni.ferry.core.backend.MemoryBackend;
import win.ixuni.ferry.core.config.FerryProperties;
import win.ixuni.ferry.core.constraints.ObjectConstraints;
import win.ixuni.ferry.core.constraints.ObjectCreationValidator;
import win.ixuni.ferry.core.copy.CopyOrchestrator;
import win.ixuni.ferry.core.copy.CopyRequestRouter;
import win.ixuni.ferry.core.migration.ContainerMetadataLookup;
import win.ixuni.ferry.core.migration.MigrationMiddleware;
import win.ixuni.ferry.core.migration.ObjectMigrator;
import win.ixuni.ferry.core.migration.driver.MigrationDriverFactory;
import win.ixuni.ferry.core.migration.driver.MigrationDriverRegistry;
import win.ixuni.ferry.core.pipeline.ErrorTranslationMiddleware;
import win.ixuni.ferry.core.pipeline.MiddlewarePipeline;
import win.ixuni.ferry.core.pipeline.ProxyHandler;
import win.ixuni.ferry.core.pipeline.ProxyMiddleware;
import win.ixuni.ferry.core.pipeline.RequestLoggingMiddleware;
import win.ixuni.ferry.server.backend.ForwardingBackend;

import java.util.List;

/**
 * Pipeline wiring
 */
@Slf4j
@Configuration
public class FerryConfiguration {

    /**
     * Factories are the driver beans on the classpath; without any, fall back to META-INF/services
     */
    @Bean
    public MigrationDriverRegistry migrationDriverRegistry(FerryProperties properties,
                                                           ObjectProvider<MigrationDriverFactory> factoryProvider) {
        List<MigrationDriverFactory> factories = factoryProvider.orderedStream().toList();
        if (factories.isEmpty()) {
            log.info("No migration driver beans found, loading factories via SPI");
            return new MigrationDriverRegistry(properties.getMigration());
        }
        return new MigrationDriverRegistry(properties.getMigration(), factories);
    }

    @Bean
    public ObjectCreationValidator objectCreationValidator(FerryProperties properties) {
        return new ObjectConstraints(properties.getConstraints());
    }

    @Bean
    public ErrorTranslationMiddleware errorTranslationMiddleware() {
        return new ErrorTranslationMiddleware();
    }

    @Bean
    public RequestLoggingMiddleware requestLoggingMiddleware() {
        return new RequestLoggingMiddleware();
    }

    @Bean
    public CopyRequestRouter copyRequestRouter(FerryProperties properties) {
        CopyOrchestrator orchestrator = new CopyOrchestrator(properties.getConstraints().getMaxFileSize());
        return new CopyRequestRouter(orchestrator, properties.getCopy().isObjectPostAsCopy());
    }

    @Bean
    @ConditionalOnProperty(prefix = "ferry.migration", name = "enabled", havingValue = "true", matchIfMissing = true)
    public MigrationMiddleware migrationMiddleware(MigrationDriverRegistry registry,
                                                   ObjectCreationValidator validator) {
        return new MigrationMiddleware(registry, new ContainerMetadataLookup(), new ObjectMigrator(validator));
    }

    /**
     * Terminal handler: the real backend, or an in-process one
     */
    @Bean
    public ProxyHandler backendHandler(FerryProperties properties, WebClient.Builder webClientBuilder) {
        FerryProperties.BackendConfig backend = properties.getBackend();
        if ("memory".equalsIgnoreCase(backend.getType())) {
            log.info("Using in-memory backend");
            return new MemoryBackend();
        }
        log.info("Forwarding to backend at {}", backend.getUrl());
        return new ForwardingBackend(webClientBuilder, backend.getUrl());
    }

    @Bean
    public MiddlewarePipeline middlewarePipeline(List<ProxyMiddleware> middlewares, ProxyHandler backendHandler) {
        return new MiddlewarePipeline(middlewares, backendHandler);
    }
}
