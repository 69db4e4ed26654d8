package net.deckadvisor.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import net.deckadvisor.config.CacheFactory;
import net.deckadvisor.config.CatalogProperties;
import net.deckadvisor.exception.CatalogTransportException;
import net.deckadvisor.support.TestCards;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CatalogCacheTest {

    private CatalogClient delegate;
    private CatalogRequestMonitor monitor;
    private CatalogCache cache;

    @BeforeEach
    void setUp() {
        delegate = mock(CatalogClient.class);
        monitor = new CatalogRequestMonitor();
        cache = new CatalogCache(delegate, new CacheFactory(), new CatalogProperties(), monitor);
    }

    @Test
    void should_ServeRepeatedLookupsFromCache_IgnoringCase() {
        when(delegate.lookupByName("Shock")).thenReturn(Optional.of(TestCards.bolt("Shock")));

        assertThat(cache.lookupByName("Shock")).isPresent();
        assertThat(cache.lookupByName("shock")).isPresent();

        verify(delegate, times(1)).lookupByName(anyString());
        assertThat(monitor.getCacheHits()).isEqualTo(1);
    }

    @Test
    void should_CacheNotFoundAnswers() {
        when(delegate.lookupByName("Nope")).thenReturn(Optional.empty());

        assertThat(cache.lookupByName("Nope")).isEmpty();
        assertThat(cache.lookupByName("Nope")).isEmpty();

        verify(delegate, times(1)).lookupByName("Nope");
    }

    @Test
    void should_NotCacheTransportFailures() {
        when(delegate.lookupByName("Shock"))
            .thenThrow(new CatalogTransportException("cards/named/exact", "Shock", new RuntimeException("boom")))
            .thenReturn(Optional.of(TestCards.bolt("Shock")));

        assertThatThrownBy(() -> cache.lookupByName("Shock")).isInstanceOf(CatalogTransportException.class);
        assertThat(cache.lookupByName("Shock")).isPresent();
        verify(delegate, times(2)).lookupByName("Shock");
    }

    @Test
    void should_CacheSearchesAndSeedCardLookups() {
        CatalogQuery query = CatalogQuery.builder().format("standard").build();
        when(delegate.search(query, 4)).thenReturn(List.of(TestCards.bolt("Shock"), TestCards.bolt("Lightning Bolt")));

        assertThat(cache.search(query, 4)).hasSize(2);
        assertThat(cache.search(query, 4)).hasSize(2);
        assertThat(cache.lookupByName("Lightning Bolt")).isPresent();

        verify(delegate, times(1)).search(any(), anyInt());
        verify(delegate, never()).lookupByName(anyString());
    }

    @Test
    void should_KeySearchesByLimit() {
        CatalogQuery query = CatalogQuery.builder().format("standard").build();
        when(delegate.search(any(), anyInt())).thenReturn(List.of());

        cache.search(query, 4);
        cache.search(query, 8);

        verify(delegate, times(2)).search(any(), anyInt());
    }

    @Test
    void should_ClearEntries_When_Invalidated() {
        when(delegate.lookupByName("Shock")).thenReturn(Optional.of(TestCards.bolt("Shock")));
        cache.lookupByName("Shock");

        cache.invalidateAll();
        cache.lookupByName("Shock");

        verify(delegate, times(2)).lookupByName("Shock");
    }
}
