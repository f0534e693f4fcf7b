package app.toolwatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import io.netty.channel.ChannelOption;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient der Agent-Seite (Audit, Remote-Auswertung, Drain).
 *
 * <p>Kein Read-Timeout: eine Remote-Auswertung kann auf eine manuelle Freigabe warten,
 * begrenzt wird im RemoteEvaluator.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient agentWebClient(WebClient.Builder builder, AgentProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getConnectTimeout().toMillis());

        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
