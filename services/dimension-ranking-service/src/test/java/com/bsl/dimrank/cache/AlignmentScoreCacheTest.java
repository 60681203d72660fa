package com.bsl.dimrank.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.bsl.dimrank.MutableClock;
import com.bsl.dimrank.TestConfigs;
import com.bsl.dimrank.config.RetrievalConfigService;
import com.bsl.dimrank.filter.DimensionTarget;
import com.bsl.dimrank.filter.FilterConstraint;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AlignmentScoreCacheTest {

    private MutableClock clock;
    private AlignmentScoreCache alignmentCache;
    private QueryEmbeddingCache embeddingCache;

    @BeforeEach
    void setUp() {
        RetrievalConfigService configService = mock(RetrievalConfigService.class);
        when(configService.current()).thenReturn(TestConfigs.sample());
        clock = new MutableClock(0L);
        alignmentCache = new AlignmentScoreCache(configService, clock);
        embeddingCache = new QueryEmbeddingCache(configService, clock);
    }

    @Test
    void keysSeparateGenerationsProfilesConstraintsAndChunks() {
        String simple = CacheKeyUtil.constraintsFingerprint(List.of(
            new FilterConstraint("simple", List.of(DimensionTarget.low("complexity")), 0.8)
        ));
        alignmentCache.put(1L, simple, "c1", "researcher", 0.7);

        assertEquals(0.7, alignmentCache.get(1L, simple, "c1", "researcher").orElseThrow(), 1e-9);
        assertFalse(alignmentCache.get(1L, simple, "c1", "general").isPresent());
        assertFalse(alignmentCache.get(1L, simple, "c2", "researcher").isPresent());
        assertFalse(alignmentCache.get(2L, simple, "c1", "researcher").isPresent());
        assertFalse(alignmentCache.get(1L, CacheKeyUtil.constraintsFingerprint(List.of()), "c1", "researcher").isPresent());
    }

    @Test
    void constraintsFingerprintDependsOnlyOnTargets() {
        String advancedThenSimple = CacheKeyUtil.constraintsFingerprint(List.of(
            new FilterConstraint("advanced", List.of(DimensionTarget.high("complexity"), DimensionTarget.high("technical_depth")), 0.8),
            new FilterConstraint("simple", List.of(DimensionTarget.low("complexity")), 0.8)
        ));
        String reordered = CacheKeyUtil.constraintsFingerprint(List.of(
            new FilterConstraint("basic", List.of(DimensionTarget.low("complexity")), 0.9),
            new FilterConstraint("complex", List.of(DimensionTarget.high("complexity")), 0.8),
            new FilterConstraint("advanced", List.of(DimensionTarget.high("technical_depth"), DimensionTarget.high("complexity")), 0.8)
        ));
        String thresholdOnly = CacheKeyUtil.constraintsFingerprint(List.of(
            new FilterConstraint("solid", List.of(DimensionTarget.atLeast("complexity", 0.7)), 0.8)
        ));

        assertEquals(advancedThenSimple, reordered);
        assertFalse(advancedThenSimple.equals(thresholdOnly));
        assertEquals("none", CacheKeyUtil.constraintsFingerprint(List.of()));
    }

    @Test
    void embeddingsAreKeyedByGenerationAndNormalizedText() {
        embeddingCache.put(1L, CacheKeyUtil.fingerprint("novel algorithms"), List.of(0.1, 0.2));

        assertTrue(embeddingCache.get(1L, CacheKeyUtil.fingerprint("  Novel   ALGORITHMS ")).isPresent());
        assertFalse(embeddingCache.get(2L, CacheKeyUtil.fingerprint("novel algorithms")).isPresent());
    }

    @Test
    void entriesExpireAfterConfiguredTtl() {
        String fingerprint = CacheKeyUtil.fingerprint("q");
        alignmentCache.put(1L, "none", "c1", "general", 0.5);
        embeddingCache.put(1L, fingerprint, List.of(0.1, 0.2));

        clock.advance(3_600_000L - 1L);
        assertTrue(alignmentCache.get(1L, "none", "c1", "general").isPresent());
        assertTrue(embeddingCache.get(1L, fingerprint).isPresent());

        clock.advance(2L);
        assertFalse(alignmentCache.get(1L, "none", "c1", "general").isPresent());
        assertFalse(embeddingCache.get(1L, fingerprint).isPresent());
    }

    @Test
    void invalidateAllEmptiesCache() {
        alignmentCache.put(1L, "none", "c1", "general", 0.5);

        alignmentCache.invalidateAll();

        assertEquals(0, alignmentCache.size());
    }
}
