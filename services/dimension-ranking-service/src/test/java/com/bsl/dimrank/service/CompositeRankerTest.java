package com.bsl.dimrank.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.bsl.dimrank.MutableClock;
import com.bsl.dimrank.TestConfigs;
import com.bsl.dimrank.cache.AlignmentScoreCache;
import com.bsl.dimrank.cache.CacheUnavailableException;
import com.bsl.dimrank.cache.QueryEmbeddingCache;
import com.bsl.dimrank.config.AlignmentMethod;
import com.bsl.dimrank.config.RetrievalConfig;
import com.bsl.dimrank.config.RetrievalConfigService;
import com.bsl.dimrank.config.RetrievalStrategy;
import com.bsl.dimrank.index.CandidateFetchException;
import com.bsl.dimrank.index.CandidateHit;
import com.bsl.dimrank.index.SimilarityIndexClient;
import com.bsl.dimrank.store.ChunkStoreClient;
import com.bsl.dimrank.store.DimensionScore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CompositeRankerTest {
    private static final String PLAIN_QUERY = "how does ranking work";

    @Mock
    private SimilarityIndexClient similarityIndex;

    @Mock
    private ChunkStoreClient chunkStore;

    @Mock
    private RetrievalConfigService configService;

    private RetrievalConfig sample;
    private RetrievalConfig config;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private AlignmentScoreCache alignmentCache;
    private QueryEmbeddingCache embeddingCache;
    private CompositeRanker ranker;

    @BeforeEach
    void setUp() {
        sample = TestConfigs.sample();
        config = sample;
        clock = new MutableClock(1_000_000L);
        meterRegistry = new SimpleMeterRegistry();
        lenient().when(configService.current()).thenAnswer(invocation -> config);
        lenient().when(similarityIndex.embed(anyString())).thenReturn(List.of(1.0, 0.0));
        lenient().when(similarityIndex.fetchCandidates(anyList(), anyInt())).thenReturn(List.of(
            new CandidateHit("c1", 0.9),
            new CandidateHit("c2", 0.8),
            new CandidateHit("c3", 0.7)
        ));
        lenient().when(chunkStore.getDimensionScores("c1")).thenReturn(Map.of());
        lenient().when(chunkStore.getDimensionScores("c2")).thenReturn(Map.of(
            "utility", DimensionScore.of(1.0),
            "relevance", DimensionScore.of(1.0),
            "clarity", DimensionScore.of(1.0),
            "complexity", DimensionScore.of(1.0),
            "credibility", DimensionScore.of(1.0)
        ));
        lenient().when(chunkStore.getDimensionScores("c3")).thenReturn(Map.of("clarity", DimensionScore.of(0.1)));
        lenient().when(chunkStore.getRecency("c1")).thenReturn(0.0);
        lenient().when(chunkStore.getRecency("c2")).thenReturn(1.0);
        lenient().when(chunkStore.getRecency("c3")).thenReturn(0.0);
        lenient().when(chunkStore.getConfidence("c1")).thenReturn(0.0);
        lenient().when(chunkStore.getConfidence("c2")).thenReturn(1.0);
        lenient().when(chunkStore.getConfidence("c3")).thenReturn(0.0);

        alignmentCache = new AlignmentScoreCache(configService, clock);
        embeddingCache = new QueryEmbeddingCache(configService, clock);
        ranker = ranker(alignmentCache);
    }

    @Test
    void alignedChunkOvertakesMoreSimilarOne() {
        RankResult result = ranker.rank(PLAIN_QUERY, 2, null);

        assertEquals(RankingState.DONE, result.state());
        assertFalse(result.degraded());
        assertEquals("general", result.profileUsed());
        assertEquals(List.of("c2", "c1"), ids(result));
        assertTrue(result.results().get(0).score() > result.results().get(1).score());
        assertEquals(0.36, result.results().get(1).score(), 1e-9);
        assertEquals(3, result.candidatesFetched());
        assertEquals(3, result.candidatesScored());
    }

    @Test
    void fetchesMinCandidatesOrMultipleOfResultCount() {
        ranker.rank(PLAIN_QUERY, 3, null);
        verify(similarityIndex).fetchCandidates(anyList(), eq(20));

        ranker.rank(PLAIN_QUERY, 10, null);
        verify(similarityIndex).fetchCandidates(anyList(), eq(40));
    }

    @Test
    void returnsAllCandidatesWhenFewerThanRequested() {
        RankResult result = ranker.rank(PLAIN_QUERY, 5, null);

        assertEquals(3, result.results().size());
    }

    @Test
    void zeroResultCountReturnsEmptyWithoutFetching() {
        RankResult result = ranker.rank(PLAIN_QUERY, 0, null);

        assertTrue(result.results().isEmpty());
        assertEquals(RankingState.DONE, result.state());
        verify(similarityIndex, never()).fetchCandidates(anyList(), anyInt());
    }

    @Test
    void equalScoresKeepSimilarityOrder() {
        when(similarityIndex.fetchCandidates(anyList(), anyInt())).thenReturn(List.of(
            new CandidateHit("b", 0.5),
            new CandidateHit("a", 0.5),
            new CandidateHit("c", 0.5)
        ));
        when(chunkStore.getDimensionScores(anyString())).thenReturn(Map.of());

        RankResult result = ranker.rank(PLAIN_QUERY, 3, null);

        assertEquals(List.of("b", "a", "c"), ids(result));
    }

    @Test
    void repeatedQueryIsDeterministicAndServedFromCache() {
        RankResult first = ranker.rank(PLAIN_QUERY, 3, null);
        RankResult second = ranker.rank(PLAIN_QUERY, 3, null);

        assertEquals(ids(first), ids(second));
        for (int i = 0; i < first.results().size(); i++) {
            assertEquals(first.results().get(i).score(), second.results().get(i).score(), 0.0);
        }
        verify(chunkStore, times(1)).getDimensionScores("c2");
        verify(similarityIndex, times(1)).embed(anyString());
        assertEquals(3, second.cacheHits());
        assertEquals(3.0, meterRegistry.counter("dr_alignment_cache_hit_total").count(), 0.0);
        assertEquals(3.0, meterRegistry.counter("dr_alignment_cache_miss_total").count(), 0.0);
    }

    @Test
    void exceedingTimeBudgetDegradesRemainingCandidates() {
        when(chunkStore.getRecency(anyString())).thenAnswer(invocation -> {
            clock.advance(150L);
            return 0.5;
        });

        RankResult result = ranker.rank(PLAIN_QUERY, 3, null);

        assertEquals(RankingState.TIMEOUT, result.state());
        assertTrue(result.degraded());
        assertTrue(result.reasonCodes().contains("time_budget_exceeded"));
        assertEquals(3, result.results().size());
        assertEquals(2, result.candidatesScored());
        ScoredCandidate unscored = result.results().stream()
            .filter(candidate -> candidate.chunkId().equals("c3"))
            .findFirst()
            .orElseThrow();
        assertFalse(unscored.dimensionScored());
        assertEquals(0.0, unscored.dimensionAlignment(), 0.0);
        assertEquals(0.0, unscored.recencyScore(), 0.0);
        assertEquals(0.7 * 0.4, unscored.score(), 1e-9);
        verify(chunkStore, never()).getDimensionScores("c3");
        assertEquals(1.0, meterRegistry.counter("dr_rank_timeout_total").count(), 0.0);
    }

    @Test
    void disabledDimensionRankingFallsBackToSimilarityOrder() {
        RetrievalConfig.RetrievalSettings base = sample.getRetrieval();
        config = TestConfigs.withRetrieval(sample, new RetrievalConfig.RetrievalSettings(
            false,
            base.defaultStrategy(),
            base.maxCandidatesMultiplier(),
            base.minCandidates(),
            base.maxProcessingTimeMs(),
            base.enableFallback(),
            base.fallbackStrategy(),
            base.adaptive()
        ));

        RankResult result = ranker.rank(PLAIN_QUERY, 2, null);

        assertEquals(RankingState.FALLBACK, result.state());
        assertTrue(result.degraded());
        assertEquals(List.of("c1", "c2"), ids(result));
        assertTrue(result.reasonCodes().contains("dimension_ranking_disabled"));
        verifyNoInteractions(chunkStore);
        assertEquals(1.0, meterRegistry.counter("dr_rank_fallback_total").count(), 0.0);
    }

    @Test
    void dimensionOnlyStrategyRanksByAlignment() {
        config = TestConfigs.withRetrieval(
            sample,
            TestConfigs.retrieval(sample.getRetrieval(), RetrievalStrategy.DIMENSION_ONLY, 200L, true)
        );

        RankResult result = ranker.rank(PLAIN_QUERY, 3, null);

        assertEquals(ExecutionMode.DIMENSION_ONLY, result.mode());
        assertEquals("c2", result.results().get(0).chunkId());
        for (ScoredCandidate candidate : result.results()) {
            assertEquals(candidate.dimensionAlignment(), candidate.score(), 0.0);
        }
    }

    @Test
    void unknownProfileOverrideUsesDefault() {
        RankResult result = ranker.rank(PLAIN_QUERY, 3, "medical");

        assertEquals("general", result.profileUsed());
        assertTrue(result.reasonCodes().contains("unknown_profile"));
        assertEquals(RankingState.DONE, result.state());
    }

    @Test
    void validOverrideWinsOverDetection() {
        RankResult result = ranker.rank("Research study of a novel algorithm published in a peer-reviewed journal", 3, "legal");

        assertEquals("legal", result.profileUsed());
        assertFalse(result.reasonCodes().contains("profile_detected"));
    }

    @Test
    void detectsProfileFromQueryText() {
        RankResult result = ranker.rank("Research study of a novel algorithm published in a peer-reviewed journal", 3, null);

        assertEquals("researcher", result.profileUsed());
        assertEquals(1.0, result.profileConfidence(), 1e-9);
        assertTrue(result.reasonCodes().contains("profile_detected"));
    }

    @Test
    void filterPhrasesAreReportedAndPenalize() {
        RankResult plain = ranker.rank(PLAIN_QUERY, 3, null);
        RankResult simple = ranker.rank("simple explanation of ranking", 3, null);

        assertEquals(1, simple.constraints().size());
        double plainAlignment = alignmentOf(plain, "c2");
        double simpleAlignment = alignmentOf(simple, "c2");
        assertTrue(simpleAlignment < plainAlignment);
    }

    @Test
    void cachedAlignmentFollowsParsedConstraintsNotQueryText() {
        RankResult plain = ranker.rank(PLAIN_QUERY, 3, null);
        RankResult lowQuality = ranker.rank("low quality docs", 3, null);
        RankResult spaced = ranker.rank("low  quality docs", 3, null);

        assertEquals(1, lowQuality.constraints().size());
        assertTrue(spaced.constraints().isEmpty());
        assertTrue(alignmentOf(lowQuality, "c2") < alignmentOf(plain, "c2"));
        assertEquals(alignmentOf(plain, "c2"), alignmentOf(spaced, "c2"), 0.0);
        assertEquals(3, spaced.cacheHits());
    }

    @Test
    void resultCountAboveGuardrailIsCapped() {
        RankGuardrailsProperties guardrails = new RankGuardrailsProperties();
        guardrails.setMaxResultCount(2);
        CompositeRanker capped = new CompositeRanker(
            configService,
            similarityIndex,
            chunkStore,
            alignmentCache,
            embeddingCache,
            new FallbackController(clock),
            guardrails,
            meterRegistry,
            clock
        );

        RankResult result = capped.rank(PLAIN_QUERY, 3, null);

        assertEquals(List.of("c2", "c1"), ids(result));
        assertTrue(result.reasonCodes().contains("size_capped"));
    }

    @Test
    void candidateFetchFailurePropagates() {
        when(similarityIndex.fetchCandidates(anyList(), anyInt())).thenThrow(new CandidateFetchException("fetch_timeout"));

        CandidateFetchException ex = assertThrows(CandidateFetchException.class, () -> ranker.rank(PLAIN_QUERY, 3, null));
        assertEquals("fetch_timeout", ex.getMessage());
    }

    @Test
    void unexpectedIndexErrorIsWrapped() {
        when(similarityIndex.embed(anyString())).thenThrow(new IllegalStateException("boom"));

        assertThrows(CandidateFetchException.class, () -> ranker.rank(PLAIN_QUERY, 3, null));
    }

    @Test
    void unavailableCacheIsBypassedForTheRestOfTheCall() {
        AlignmentScoreCache brokenCache = mock(AlignmentScoreCache.class);
        when(brokenCache.get(anyLong(), anyString(), anyString(), anyString()))
            .thenThrow(new CacheUnavailableException("down", new IllegalStateException("down")));
        CompositeRanker withBrokenCache = ranker(brokenCache);

        RankResult result = withBrokenCache.rank(PLAIN_QUERY, 3, null);

        assertEquals(RankingState.DONE, result.state());
        assertEquals(List.of("c2", "c1", "c3"), ids(result));
        assertTrue(result.reasonCodes().contains("cache_unavailable"));
        verify(brokenCache, times(1)).get(anyLong(), anyString(), anyString(), anyString());
        verify(brokenCache, never()).put(anyLong(), anyString(), anyString(), anyString(), anyDouble());
    }

    @Test
    void scoringErrorFallsBackWhenEnabled() {
        when(chunkStore.getDimensionScores(anyString())).thenThrow(new IllegalStateException("store down"));

        RankResult result = ranker.rank(PLAIN_QUERY, 2, null);

        assertEquals(RankingState.FALLBACK, result.state());
        assertTrue(result.degraded());
        assertTrue(result.reasonCodes().contains("scoring_error_fallback"));
        assertEquals(List.of("c1", "c2"), ids(result));
    }

    @Test
    void scoringErrorPropagatesWhenFallbackDisabled() {
        config = TestConfigs.withRetrieval(
            sample,
            TestConfigs.retrieval(sample.getRetrieval(), RetrievalStrategy.HYBRID, 200L, false)
        );
        when(chunkStore.getDimensionScores(anyString())).thenThrow(new IllegalStateException("store down"));

        assertThrows(IllegalStateException.class, () -> ranker.rank(PLAIN_QUERY, 2, null));
    }

    @Test
    void reloadInvalidatesCachedScores() {
        when(configService.reload()).thenAnswer(invocation -> config);
        ranker.rank(PLAIN_QUERY, 3, null);

        ranker.reloadConfiguration();
        ranker.rank(PLAIN_QUERY, 3, null);

        verify(configService).reload();
        verify(chunkStore, times(2)).getDimensionScores("c2");
        verify(similarityIndex, times(2)).embed(any());
    }

    @Test
    void scoresFromBeforeReloadAreNotServedAfterIt() {
        RetrievalConfig.AlignmentSettings plain = TestConfigs.plainAlignment(sample.getAlignment());
        RetrievalConfig before = TestConfigs.withAlignment(sample, plain).withGeneration(1L);
        RetrievalConfig after = TestConfigs.withAlignment(sample, new RetrievalConfig.AlignmentSettings(
            AlignmentMethod.MAX,
            plain.normalization(),
            plain.confidenceBoost(),
            plain.profileBonus()
        )).withGeneration(2L);
        config = before;
        when(configService.reload()).thenAnswer(invocation -> {
            config = after;
            return after;
        });
        Map<String, DimensionScore> c2Scores = Map.of(
            "utility", DimensionScore.of(1.0),
            "relevance", DimensionScore.of(1.0),
            "clarity", DimensionScore.of(1.0),
            "complexity", DimensionScore.of(1.0),
            "credibility", DimensionScore.of(1.0)
        );
        AtomicBoolean reloaded = new AtomicBoolean();
        when(chunkStore.getDimensionScores("c2")).thenAnswer(invocation -> {
            if (reloaded.compareAndSet(false, true)) {
                ranker.reloadConfiguration();
            }
            return c2Scores;
        });

        RankResult during = ranker.rank(PLAIN_QUERY, 3, null);
        RankResult next = ranker.rank(PLAIN_QUERY, 3, null);

        assertEquals(1.0 / 5.7, alignmentOf(during, "c2"), 1e-9);
        assertEquals(1.3 / 5.7, alignmentOf(next, "c2"), 1e-9);
    }

    private CompositeRanker ranker(AlignmentScoreCache cache) {
        return new CompositeRanker(
            configService,
            similarityIndex,
            chunkStore,
            cache,
            embeddingCache,
            new FallbackController(clock),
            new RankGuardrailsProperties(),
            meterRegistry,
            clock
        );
    }

    private List<String> ids(RankResult result) {
        return result.results().stream().map(ScoredCandidate::chunkId).toList();
    }

    private double alignmentOf(RankResult result, String chunkId) {
        return result.results().stream()
            .filter(candidate -> candidate.chunkId().equals(chunkId))
            .findFirst()
            .orElseThrow()
            .dimensionAlignment();
    }
}
