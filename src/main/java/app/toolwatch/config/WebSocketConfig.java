package app.toolwatch.config;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import app.toolwatch.manual.PendingApprovalsWebSocketHandler;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping pendingApprovalsWebSocketMapping(PendingApprovalsWebSocketHandler handler) {
        return new SimpleUrlHandlerMapping(Map.of("/ws", handler), Ordered.HIGHEST_PRECEDENCE);
    }
}
