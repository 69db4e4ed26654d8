package net.deckadvisor.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.config.CatalogProperties;
import net.deckadvisor.exception.CatalogTransportException;
import net.deckadvisor.model.Card;
import net.deckadvisor.util.ExternalApiLogger;
import net.deckadvisor.util.LoggingUtils;
import net.deckadvisor.util.ValidationUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Catalog client backed by the Scryfall REST API.
 *
 * <ul>
 *   <li>Name lookups try {@code /cards/named?exact=} and fall back to {@code ?fuzzy=}.</li>
 *   <li>Searches use {@code /cards/search} ordered by EDHREC rank and follow {@code next_page}.</li>
 *   <li>HTTP 404 means "not found". Other failures become {@link CatalogTransportException}.</li>
 * </ul>
 *
 * Calls block the caller; every outbound request takes a permit from the shared rate limiter.
 */
@Slf4j
public class ScryfallCatalogClient implements CatalogClient {

    private static final String API_NAME = "Scryfall";
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(250);

    private final WebClient webClient;
    private final CatalogProperties properties;
    private final RateLimiter rateLimiter;
    private final CatalogRequestMonitor monitor;

    public ScryfallCatalogClient(WebClient.Builder webClientBuilder,
                                 CatalogProperties properties,
                                 RateLimiter rateLimiter,
                                 CatalogRequestMonitor monitor) {
        this.webClient = webClientBuilder.clone().baseUrl(properties.getBaseUrl()).build();
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.monitor = monitor;
    }

    @Override
    public Optional<Card> lookupByName(String name) {
        if (!ValidationUtils.hasText(name)) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        Optional<Card> exact = fetchNamed("exact", trimmed);
        return exact.isPresent() ? exact : fetchNamed("fuzzy", trimmed);
    }

    private Optional<Card> fetchNamed(String mode, String name) {
        String operation = "cards/named/" + mode;
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, operation, name);
        JsonNode body = execute(() -> webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/cards/named").queryParam(mode, "{name}").build(name)),
            operation, name);
        if (body == null) {
            ExternalApiLogger.logNotFound(log, API_NAME, operation, name);
            return Optional.empty();
        }
        Optional<Card> card = ScryfallCardMapper.map(body);
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, operation, name, card.isPresent() ? 1 : 0);
        return card;
    }

    @Override
    public List<Card> search(CatalogQuery query, int limit) {
        if (query == null || limit <= 0) {
            return List.of();
        }
        String q = query.toScryfallQuery();
        String operation = "cards/search";
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, operation, q);

        List<Card> results = new ArrayList<>();
        JsonNode page = execute(() -> webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/cards/search")
                    .queryParam("q", "{q}")
                    .queryParam("unique", "cards")
                    .queryParam("order", "edhrec")
                    .build(q)),
            operation, q);
        int pagesRead = 0;
        while (page != null) {
            pagesRead++;
            for (Card card : ScryfallCardMapper.mapList(page)) {
                if (results.size() >= limit) {
                    break;
                }
                results.add(card);
            }
            String nextPage = page.path("next_page").asText(null);
            if (results.size() >= limit || !page.path("has_more").asBoolean(false)
                    || nextPage == null || pagesRead >= properties.getMaxSearchPages()) {
                break;
            }
            page = execute(() -> webClient.get().uri(URI.create(nextPage)), operation + "/next", q);
        }
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, operation, q, results.size());
        return results;
    }

    /**
     * Performs one rate-limited GET. Returns null for 404. The request is built inside the guard so a
     * malformed URI surfaces as a transport failure.
     */
    private JsonNode execute(Supplier<WebClient.RequestHeadersSpec<?>> request, String operation, String target) {
        try {
            return request.get().retrieve()
                .bodyToMono(JsonNode.class)
                .transformDeferred(RateLimiterOperator.of(rateLimiter))
                .timeout(properties.getRequestTimeout())
                .retryWhen(Retry.backoff(properties.getRetryAttempts(), RETRY_BACKOFF)
                    .filter(ScryfallCatalogClient::isRetryable)
                    .doBeforeRetry(retrySignal -> LoggingUtils.warnBrief(log, retrySignal.failure(),
                        "Retrying Scryfall {} for '{}'. Attempt #{}", operation, target, retrySignal.totalRetries() + 1))
                    .onRetryExhaustedThrow((spec, retrySignal) -> retrySignal.failure()))
                .doOnNext(body -> monitor.recordSuccessfulRequest(operation))
                .onErrorResume(WebClientResponseException.NotFound.class, notFound -> {
                    monitor.recordNotFound(operation);
                    return Mono.empty();
                })
                .block();
        } catch (RequestNotPermitted e) {
            ExternalApiLogger.logRateLimited(log, API_NAME, target);
            monitor.recordFailedRequest(operation, "rate limited");
            throw new CatalogTransportException(operation, target, true, e);
        } catch (WebClientResponseException e) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, operation, target, "HTTP " + e.getStatusCode().value());
            monitor.recordFailedRequest(operation, "HTTP " + e.getStatusCode().value());
            throw new CatalogTransportException(operation, target, e.getStatusCode().is5xxServerError(), e);
        } catch (RuntimeException e) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, operation, target, LoggingUtils.describe(e));
            monitor.recordFailedRequest(operation, LoggingUtils.describe(e));
            throw new CatalogTransportException(operation, target, true, e);
        }
    }

    private static boolean isRetryable(Throwable throwable) {
        if (throwable instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().is5xxServerError();
        }
        return throwable instanceof WebClientRequestException || throwable instanceof IOException;
    }
}
