package net.deckadvisor.catalog;

import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.exception.CatalogTransportException;
import net.deckadvisor.model.Card;
import net.deckadvisor.util.LoggingUtils;

/**
 * Treats catalog failures as empty answers so one unreachable lookup never aborts a whole
 * recommendation pass. Failures are logged, never raised.
 *
 * <p>Transport failures are already counted by the provider client. Anything else escaping the
 * delegate (blocking timeouts, decode errors) is counted here when a monitor is attached.</p>
 */
@Slf4j
public class ResilientCatalogClient implements CatalogClient {

    static final String LOOKUP_OPERATION = "catalog/lookup";
    static final String SEARCH_OPERATION = "catalog/search";

    private final CatalogClient delegate;
    private final CatalogRequestMonitor monitor;

    public ResilientCatalogClient(CatalogClient delegate) {
        this(delegate, null);
    }

    public ResilientCatalogClient(CatalogClient delegate, CatalogRequestMonitor monitor) {
        this.delegate = delegate;
        this.monitor = monitor;
    }

    /**
     * Wraps a client unless it is already resilient.
     */
    public static CatalogClient wrap(CatalogClient client) {
        return wrap(client, null);
    }

    public static CatalogClient wrap(CatalogClient client, CatalogRequestMonitor monitor) {
        return client instanceof ResilientCatalogClient ? client : new ResilientCatalogClient(client, monitor);
    }

    @Override
    public Optional<Card> lookupByName(String name) {
        try {
            return delegate.lookupByName(name);
        } catch (CatalogTransportException e) {
            LoggingUtils.warnBrief(log, e, "Catalog lookup for '{}' failed; treating as not found", name);
            return Optional.empty();
        } catch (RuntimeException e) {
            recordUnexpected(LOOKUP_OPERATION, e);
            LoggingUtils.warnBrief(log, e, "Catalog lookup for '{}' failed unexpectedly; treating as not found", name);
            return Optional.empty();
        }
    }

    @Override
    public List<Card> search(CatalogQuery query, int limit) {
        String rendered = query == null ? null : query.toScryfallQuery();
        try {
            return delegate.search(query, limit);
        } catch (CatalogTransportException e) {
            LoggingUtils.warnBrief(log, e, "Catalog search '{}' failed; treating as no results", rendered);
            return List.of();
        } catch (RuntimeException e) {
            recordUnexpected(SEARCH_OPERATION, e);
            LoggingUtils.warnBrief(log, e, "Catalog search '{}' failed unexpectedly; treating as no results", rendered);
            return List.of();
        }
    }

    private void recordUnexpected(String operation, RuntimeException e) {
        if (monitor != null) {
            monitor.recordFailedRequest(operation, LoggingUtils.describe(e));
        }
    }
}
