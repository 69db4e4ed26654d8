package net.deckadvisor.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import net.deckadvisor.exception.CatalogTransportException;
import org.junit.jupiter.api.Test;

class ResilientCatalogClientTest {

    private final CatalogClient delegate = mock(CatalogClient.class);

    @Test
    void should_TreatTransportFailureAsNotFound() {
        when(delegate.lookupByName("Shock"))
            .thenThrow(new CatalogTransportException("cards/named/exact", "Shock", true, new RuntimeException("timeout")));

        assertThat(ResilientCatalogClient.wrap(delegate).lookupByName("Shock")).isEmpty();
    }

    @Test
    void should_TreatTransportFailureAsNoResults() {
        when(delegate.search(any(), anyInt()))
            .thenThrow(new CatalogTransportException("cards/search", "legal:standard", new RuntimeException("503")));

        assertThat(ResilientCatalogClient.wrap(delegate).search(CatalogQuery.builder().build(), 5)).isEmpty();
    }

    @Test
    void should_AbsorbAndRecordUnexpectedLookupFailure() {
        CatalogRequestMonitor monitor = new CatalogRequestMonitor();
        when(delegate.lookupByName("Shock"))
            .thenThrow(new IllegalStateException("Timeout on blocking read for 5000 MILLISECONDS"));

        assertThat(ResilientCatalogClient.wrap(delegate, monitor).lookupByName("Shock")).isEmpty();
        assertThat(monitor.getTotalFailed()).isEqualTo(1);
        assertThat(monitor.getOperationCount(ResilientCatalogClient.LOOKUP_OPERATION)).isEqualTo(1);
    }

    @Test
    void should_AbsorbAndRecordUnexpectedSearchFailure() {
        CatalogRequestMonitor monitor = new CatalogRequestMonitor();
        when(delegate.search(any(), anyInt())).thenThrow(new IllegalArgumentException("bad next_page"));

        assertThat(ResilientCatalogClient.wrap(delegate, monitor).search(CatalogQuery.builder().build(), 5)).isEmpty();
        assertThat(monitor.getTotalFailed()).isEqualTo(1);
        assertThat(monitor.getOperationCount(ResilientCatalogClient.SEARCH_OPERATION)).isEqualTo(1);
    }

    @Test
    void should_NotRecordTransportFailuresTwice() {
        CatalogRequestMonitor monitor = new CatalogRequestMonitor();
        when(delegate.lookupByName("Shock"))
            .thenThrow(new CatalogTransportException("cards/named/exact", "Shock", new RuntimeException("503")));

        assertThat(ResilientCatalogClient.wrap(delegate, monitor).lookupByName("Shock")).isEmpty();
        assertThat(monitor.getTotalFailed()).isZero();
    }

    @Test
    void should_AbsorbUnexpectedFailureWithoutMonitor() {
        when(delegate.lookupByName("Shock")).thenThrow(new IllegalStateException("decode failed"));

        assertThat(ResilientCatalogClient.wrap(delegate).lookupByName("Shock")).isEmpty();
    }

    @Test
    void should_NotWrapTwice() {
        CatalogClient wrapped = ResilientCatalogClient.wrap(delegate);

        assertThat(ResilientCatalogClient.wrap(wrapped)).isSameAs(wrapped);
    }
}
