package net.deckadvisor.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the card catalog client and its cache.
 */
@Component
@ConfigurationProperties(prefix = "deckadvisor.catalog")
@Getter
@Setter
public class CatalogProperties {

    public enum Provider {
        SCRYFALL,
        LOCAL
    }

    /**
     * Which catalog backs the engine.
     */
    private Provider provider = Provider.SCRYFALL;

    /**
     * Scryfall API root.
     */
    private String baseUrl = "https://api.scryfall.com";

    /**
     * Card list loaded by the local provider; {@code classpath:} and {@code file:} prefixes are supported.
     */
    private String localPath = "classpath:catalog/sample-cards.json";

    /**
     * Sent as the User-Agent header; Scryfall asks clients to identify themselves.
     */
    private String userAgent = "DeckAdvisor/0.1";

    /**
     * Request budget per second. Scryfall asks for no more than 10.
     */
    private int requestsPerSecond = 10;

    /**
     * How long a caller waits for a rate limiter permit before the request counts as failed.
     */
    private Duration rateLimitWait = Duration.ofSeconds(5);

    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * Upper bound for a single HTTP exchange, including retries of 5xx responses.
     */
    private Duration requestTimeout = Duration.ofSeconds(10);

    /**
     * Retries for 5xx responses and connection errors.
     */
    private int retryAttempts = 1;

    /**
     * Maximum result pages followed per search.
     */
    private int maxSearchPages = 3;

    private Duration cardTtl = Duration.ofDays(30);

    private Duration searchTtl = Duration.ofDays(1);

    private int cardCacheSize = 20_000;

    private int searchCacheSize = 2_000;

    @PostConstruct
    void validate() {
        Assert.notNull(provider, "deckadvisor.catalog.provider must be set");
        Assert.hasText(baseUrl, "deckadvisor.catalog.base-url must not be blank");
        Assert.isTrue(requestsPerSecond > 0, "deckadvisor.catalog.requests-per-second must be positive");
        Assert.isTrue(!rateLimitWait.isNegative(), "deckadvisor.catalog.rate-limit-wait must be non-negative");
        Assert.isTrue(!connectTimeout.isNegative() && !connectTimeout.isZero(),
                "deckadvisor.catalog.connect-timeout must be positive");
        Assert.isTrue(!requestTimeout.isNegative() && !requestTimeout.isZero(),
                "deckadvisor.catalog.request-timeout must be positive");
        Assert.isTrue(retryAttempts >= 0, "deckadvisor.catalog.retry-attempts must be non-negative");
        Assert.isTrue(maxSearchPages > 0, "deckadvisor.catalog.max-search-pages must be positive");
        Assert.isTrue(!cardTtl.isNegative(), "deckadvisor.catalog.card-ttl must be non-negative");
        Assert.isTrue(!searchTtl.isNegative(), "deckadvisor.catalog.search-ttl must be non-negative");
        Assert.isTrue(cardCacheSize > 0 && searchCacheSize > 0, "deckadvisor.catalog cache sizes must be positive");
        if (provider == Provider.LOCAL) {
            Assert.hasText(localPath, "deckadvisor.catalog.local-path is required for the local provider");
        }
    }
}
