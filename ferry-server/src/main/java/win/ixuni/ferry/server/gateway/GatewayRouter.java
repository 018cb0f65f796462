package win.ixuni.ferry.server.gateway;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

/**
 * Routes GET /info to the cluster info handler, every other path and method to the gateway handler
 */
@Configuration
public class GatewayRouter {

    @Bean
    public RouterFunction<ServerResponse> gatewayRoute(ProxyGatewayHandler handler, ClusterInfoHandler infoHandler) {
        return RouterFunctions.route(RequestPredicates.GET(ClusterInfoHandler.INFO_PATH), infoHandler::handle)
                .andRoute(RequestPredicates.all(), handler::handle);
    }
}
