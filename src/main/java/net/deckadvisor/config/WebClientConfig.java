package net.deckadvisor.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Configures the WebClient used for catalog traffic
 * - Connection, read, write and response timeouts come from {@link CatalogProperties}
 * - Identifies the application through the User-Agent header
 */
@Configuration
public class WebClientConfig {

    /**
     * Search pages from the catalog can exceed the 256KB codec default.
     */
    private static final int MAX_IN_MEMORY_BYTES = 8 * 1024 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder(CatalogProperties properties) {
        long timeoutMillis = properties.getRequestTimeout().toMillis();
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getConnectTimeout().toMillis())
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
            )
            .responseTimeout(properties.getRequestTimeout());

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(MAX_IN_MEMORY_BYTES))
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
