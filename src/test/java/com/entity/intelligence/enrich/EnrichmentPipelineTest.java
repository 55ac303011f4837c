package com.entity.intelligence.enrich;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.entity.intelligence.EntityFixtures.corpus;
import static com.entity.intelligence.EntityFixtures.movie;
import static com.entity.intelligence.EntityFixtures.person;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EnrichmentPipelineTest {

    @Mock
    private EntityEnricher first;

    @Mock
    private EntityEnricher second;

    private Entity kappa;
    private Entity sigma;

    @BeforeEach
    void setUp() {
        kappa = movie(1).title("Kappa").build();
        sigma = movie(2).title("Sigma").build();
    }

    @Test
    @DisplayName("Excluded entities should be dropped and not offered to later enrichers")
    void testExclusion() {
        when(first.getName()).thenReturn("first");
        when(first.supports(any())).thenReturn(true);
        EntityCorpus input = corpus(kappa, sigma);
        when(first.enrich(kappa, input)).thenReturn(EnrichmentResult.kept(kappa.withDerived(Map.of("tag", "a"))));
        when(first.enrich(sigma, input)).thenReturn(EnrichmentResult.excluded(sigma, "not wanted"));
        when(second.supports(any())).thenReturn(true);
        when(second.enrich(any(), any())).thenAnswer(invocation -> EnrichmentResult.kept(invocation.getArgument(0)));

        EnrichmentPipeline.Outcome outcome = new EnrichmentPipeline(List.of(first, second)).run(input);

        assertEquals(List.of("movie:1"), List.copyOf(outcome.corpus().ids()));
        assertEquals("a", outcome.corpus().get("movie:1").orElseThrow().getDerived().get("tag"));
        assertEquals(List.of("movie:2"), List.copyOf(outcome.excludedIds()));
        verify(second).enrich(any(), same(input));
        verify(second, never()).enrich(eq(sigma), any());
    }

    @Test
    @DisplayName("A failing enricher should leave the entity unchanged")
    void testFailingEnricher() {
        when(first.getName()).thenReturn("first");
        when(first.supports(any())).thenReturn(true);
        when(first.enrich(any(), any())).thenThrow(new IllegalStateException("boom"));

        EnrichmentPipeline.Outcome outcome = new EnrichmentPipeline(List.of(first)).run(corpus(kappa, sigma));

        assertEquals(List.of("movie:1", "movie:2"), List.copyOf(outcome.corpus().ids()));
        assertSame(kappa, outcome.corpus().get("movie:1").orElseThrow());
        assertTrue(outcome.excludedIds().isEmpty());
    }

    @Test
    @DisplayName("Unsupported entities should pass through untouched")
    void testUnsupported() {
        when(first.supports(any())).thenReturn(false);

        EnrichmentPipeline.Outcome outcome = new EnrichmentPipeline(List.of(first)).run(corpus(kappa));

        assertSame(kappa, outcome.corpus().get("movie:1").orElseThrow());
        verify(first, never()).enrich(any(), any());
    }

    @Test
    @DisplayName("Person enricher should drop unpopular people from a mixed corpus")
    void testWithPersonEnricher() {
        Entity unknown = person(3).name("Unknown").popularity(1).build();
        EntityCorpus input = corpus(kappa, unknown);

        EnrichmentPipeline.Outcome outcome = new EnrichmentPipeline(List.of(new PersonEnricher())).run(input);

        assertEquals(List.of("movie:1"), List.copyOf(outcome.corpus().ids()));
        assertTrue(outcome.excludedIds().contains("person:3"));
        assertEquals(2, input.size());
    }

    @Test
    @DisplayName("Exclusions must carry a reason")
    void testExclusionReasonRequired() {
        assertThrows(IllegalArgumentException.class, () -> EnrichmentResult.excluded(kappa, " "));
        assertThrows(NullPointerException.class, () -> EnrichmentResult.kept(null));
    }
}
