package com.bsl.dimrank.service;

import com.bsl.dimrank.alignment.AlignmentCalculator;
import com.bsl.dimrank.alignment.AlignmentResult;
import com.bsl.dimrank.cache.AlignmentScoreCache;
import com.bsl.dimrank.cache.CacheKeyUtil;
import com.bsl.dimrank.cache.CacheUnavailableException;
import com.bsl.dimrank.cache.QueryEmbeddingCache;
import com.bsl.dimrank.config.RetrievalConfig;
import com.bsl.dimrank.config.RetrievalConfigService;
import com.bsl.dimrank.filter.FilterConstraint;
import com.bsl.dimrank.filter.FilterParser;
import com.bsl.dimrank.index.CandidateFetchException;
import com.bsl.dimrank.index.CandidateHit;
import com.bsl.dimrank.index.SimilarityIndexClient;
import com.bsl.dimrank.profile.Profile;
import com.bsl.dimrank.profile.ProfileDetector;
import com.bsl.dimrank.profile.ProfileMatch;
import com.bsl.dimrank.profile.ProfileRegistry;
import com.bsl.dimrank.profile.ProfileWeights;
import com.bsl.dimrank.store.ChunkStoreClient;
import com.bsl.dimrank.store.DimensionScore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ranks the candidates of a vector search by blending similarity with profile-weighted
 * dimension alignment, recency and confidence.
 *
 * <p>Every call walks {@link RankingState}: the profile is resolved, candidates are
 * over-fetched from the index, each one is scored against the time budget and the blended
 * list is sorted and truncated. A call that runs out of time keeps the scores it already has
 * and finishes in {@link RankingState#TIMEOUT}; a call the {@link FallbackController}
 * degrades finishes in {@link RankingState#FALLBACK} with a similarity-only ordering.
 */
@Service
public class CompositeRanker {
    private static final Logger log = LoggerFactory.getLogger(CompositeRanker.class);

    private final RetrievalConfigService configService;
    private final SimilarityIndexClient similarityIndex;
    private final ChunkStoreClient chunkStore;
    private final AlignmentScoreCache alignmentCache;
    private final QueryEmbeddingCache queryEmbeddingCache;
    private final FallbackController fallbackController;
    private final RankGuardrailsProperties guardrails;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public CompositeRanker(
        RetrievalConfigService configService,
        SimilarityIndexClient similarityIndex,
        ChunkStoreClient chunkStore,
        AlignmentScoreCache alignmentCache,
        QueryEmbeddingCache queryEmbeddingCache,
        FallbackController fallbackController,
        RankGuardrailsProperties guardrails,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this.configService = configService;
        this.similarityIndex = similarityIndex;
        this.chunkStore = chunkStore;
        this.alignmentCache = alignmentCache;
        this.queryEmbeddingCache = queryEmbeddingCache;
        this.fallbackController = fallbackController;
        this.guardrails = guardrails;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Ranks the query's candidates. {@code resultCount} is capped at
     * {@code dimrank.guardrails.max-result-count} (reason {@code size_capped}); the result never
     * holds more than the capped count, nor fewer unless the index returned fewer candidates.
     */
    public RankResult rank(String queryText, int resultCount, String profileOverride) {
        long started = clock.millis();
        RetrievalConfig config = configService.current();
        RetrievalConfig.RetrievalSettings retrieval = config.getRetrieval();
        ProfileRegistry registry = config.getProfiles();
        List<String> reasonCodes = new ArrayList<>();
        CallContext context = new CallContext(config, CacheKeyUtil.fingerprint(queryText), reasonCodes);

        int size = resolveSize(resultCount, reasonCodes);
        FallbackDecision decision = fallbackController.decide(retrieval);
        if (decision.reasonCode() != null) {
            reasonCodes.add(decision.reasonCode());
        }

        if (decision.mode() == ExecutionMode.VECTOR_ONLY) {
            Profile profile = resolveOverrideOnly(profileOverride, registry, reasonCodes);
            List<CandidateHit> hits = size == 0 ? List.of() : fetchCandidates(queryText, size, context);
            meterRegistry.counter("dr_rank_fallback_total").increment();
            List<ScoredCandidate> ordered = similarityOnly(hits, profile.getId(), size);
            return finish(
                context, queryText, ordered, profile, 0.0, true, RankingState.FALLBACK, decision.mode(), List.of(),
                hits.size(), 0, started
            );
        }

        ProfileResolution resolution = resolveProfile(queryText, profileOverride, config, reasonCodes);
        Profile profile = resolution.profile();
        List<FilterConstraint> constraints = FilterParser.parse(queryText, config.getFilters());
        if (config.getLogging().logFilters() && !constraints.isEmpty()) {
            log.info("filters profile={} constraints={}", profile.getId(), describe(constraints));
        }

        if (size == 0) {
            return finish(
                context, queryText, List.of(), profile, resolution.confidence(), decision.degraded(), RankingState.DONE,
                decision.mode(), constraints, 0, 0, started
            );
        }

        List<CandidateHit> hits = fetchCandidates(queryText, size, context);
        long scoringStarted = clock.millis();

        ScoringOutcome outcome;
        try {
            outcome = scoreCandidates(hits, profile, constraints, scoringStarted, context);
        } catch (CandidateFetchException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            if (!retrieval.enableFallback()) {
                throw ex;
            }
            log.warn("dimension scoring failed; falling back to similarity order: {}", ex.getMessage(), ex);
            reasonCodes.add("scoring_error_fallback");
            meterRegistry.counter("dr_rank_fallback_total").increment();
            List<ScoredCandidate> ordered = similarityOnly(hits, profile.getId(), size);
            return finish(
                context, queryText, ordered, profile, resolution.confidence(), true, RankingState.FALLBACK,
                ExecutionMode.VECTOR_ONLY, constraints, hits.size(), 0, started
            );
        }

        if (outcome.timedOut()) {
            reasonCodes.add("time_budget_exceeded");
            meterRegistry.counter("dr_rank_timeout_total").increment();
        }
        fallbackController.recordOutcome(retrieval, decision, outcome.timedOut());

        List<ScoredCandidate> ranked = blend(outcome.scored(), profile, decision.mode(), size);
        RankingState terminal = outcome.timedOut() ? RankingState.TIMEOUT : RankingState.DONE;
        return finish(
            context, queryText, ranked, profile, resolution.confidence(), decision.degraded() || outcome.timedOut(),
            terminal, decision.mode(), constraints, hits.size(), outcome.scoredCount(), started
        );
    }

    /**
     * Reloads the retrieval configuration and drops every cached score, since cached values
     * were computed under the previous profiles.
     */
    public RetrievalConfig reloadConfiguration() {
        RetrievalConfig reloaded = configService.reload();
        alignmentCache.invalidateAll();
        queryEmbeddingCache.invalidateAll();
        return reloaded;
    }

    private ProfileResolution resolveProfile(
        String queryText,
        String profileOverride,
        RetrievalConfig config,
        List<String> reasonCodes
    ) {
        ProfileRegistry registry = config.getProfiles();
        if (!isBlank(profileOverride)) {
            return new ProfileResolution(resolveOverrideOnly(profileOverride, registry, reasonCodes), 1.0);
        }
        RetrievalConfig.DetectionSettings detection = config.getDetection();
        ProfileMatch match = ProfileDetector.detect(queryText, registry, detection.enabled(), detection.confidenceThreshold());
        if (match.detected()) {
            reasonCodes.add("profile_detected");
        }
        return new ProfileResolution(match.profile(), match.confidence());
    }

    private Profile resolveOverrideOnly(String profileOverride, ProfileRegistry registry, List<String> reasonCodes) {
        if (isBlank(profileOverride)) {
            return registry.defaultProfile();
        }
        Optional<Profile> requested = registry.get(profileOverride);
        if (requested.isPresent()) {
            return requested.get();
        }
        log.warn("unknown profile override '{}'; using {}", profileOverride, ProfileRegistry.DEFAULT_PROFILE_ID);
        reasonCodes.add("unknown_profile");
        return registry.defaultProfile();
    }

    private List<CandidateHit> fetchCandidates(String queryText, int size, CallContext context) {
        RetrievalConfig.RetrievalSettings retrieval = context.config().getRetrieval();
        long requested = Math.max((long) retrieval.minCandidates(), (long) size * retrieval.maxCandidatesMultiplier());
        int count = (int) Math.min(requested, Math.max(size, guardrails.getMaxCandidates()));
        if (requested > count) {
            context.reasonCodes().add("candidates_capped");
        }

        List<Double> embedding = embedQuery(queryText, context);
        List<CandidateHit> hits;
        try {
            hits = similarityIndex.fetchCandidates(embedding, count);
        } catch (CandidateFetchException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new CandidateFetchException("fetch_failed", ex);
        }
        if (hits == null) {
            throw new CandidateFetchException("fetch_null_response");
        }
        List<CandidateHit> distinct = new ArrayList<>(Math.min(hits.size(), count));
        Set<String> seen = new HashSet<>();
        for (CandidateHit hit : hits) {
            if (distinct.size() >= count) {
                break;
            }
            if (hit == null || isBlank(hit.chunkId()) || !seen.add(hit.chunkId())) {
                continue;
            }
            distinct.add(hit);
        }
        return distinct;
    }

    private List<Double> embedQuery(String queryText, CallContext context) {
        boolean cacheEnabled = context.config().getCaching().enableQueryCache();
        if (cacheEnabled && context.cacheUsable()) {
            try {
                Optional<List<Double>> cached = queryEmbeddingCache.get(context.config().getGeneration(), context.fingerprint());
                if (cached.isPresent()) {
                    return cached.get();
                }
            } catch (CacheUnavailableException ex) {
                context.disableCache(ex);
            }
        }
        List<Double> embedding;
        try {
            embedding = similarityIndex.embed(queryText);
        } catch (CandidateFetchException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new CandidateFetchException("embed_failed", ex);
        }
        if (embedding == null || embedding.isEmpty()) {
            throw new CandidateFetchException("embed_empty_vector");
        }
        if (cacheEnabled && context.cacheUsable()) {
            try {
                queryEmbeddingCache.put(context.config().getGeneration(), context.fingerprint(), embedding);
            } catch (CacheUnavailableException ex) {
                context.disableCache(ex);
            }
        }
        return embedding;
    }

    private ScoringOutcome scoreCandidates(
        List<CandidateHit> hits,
        Profile profile,
        List<FilterConstraint> constraints,
        long scoringStarted,
        CallContext context
    ) {
        RetrievalConfig config = context.config();
        long budgetMs = config.getRetrieval().maxProcessingTimeMs();
        List<ScoredCandidate> scored = new ArrayList<>(hits.size());
        boolean timedOut = false;
        int scoredCount = 0;
        String constraintsKey = CacheKeyUtil.constraintsFingerprint(constraints);

        for (int i = 0; i < hits.size(); i++) {
            CandidateHit hit = hits.get(i);
            double similarity = clamp01(hit.similarity());
            if (!timedOut && clock.millis() - scoringStarted > budgetMs) {
                timedOut = true;
                log.debug("time budget {}ms exhausted after {} of {} candidates", budgetMs, scoredCount, hits.size());
            }
            if (timedOut) {
                scored.add(new ScoredCandidate(hit.chunkId(), i, similarity, 0.0, 0.0, 0.0, profile.getId(), 0.0, false));
                continue;
            }
            double alignment = alignmentFor(hit.chunkId(), profile, constraints, constraintsKey, context);
            double recency = clamp01(chunkStore.getRecency(hit.chunkId()));
            double confidence = clamp01(chunkStore.getConfidence(hit.chunkId()));
            scored.add(new ScoredCandidate(hit.chunkId(), i, similarity, alignment, recency, confidence, profile.getId(), 0.0, true));
            scoredCount++;
        }
        return new ScoringOutcome(scored, scoredCount, timedOut);
    }

    private double alignmentFor(
        String chunkId,
        Profile profile,
        List<FilterConstraint> constraints,
        String constraintsKey,
        CallContext context
    ) {
        RetrievalConfig config = context.config();
        boolean cacheEnabled = config.getCaching().enableDimensionCache();
        if (cacheEnabled && context.cacheUsable()) {
            try {
                Optional<Double> cached = alignmentCache.get(config.getGeneration(), constraintsKey, chunkId, profile.getId());
                if (cached.isPresent()) {
                    context.cacheHits++;
                    meterRegistry.counter("dr_alignment_cache_hit_total").increment();
                    return cached.get();
                }
                context.cacheMisses++;
                meterRegistry.counter("dr_alignment_cache_miss_total").increment();
            } catch (CacheUnavailableException ex) {
                context.disableCache(ex);
            }
        }

        Map<String, DimensionScore> dimensionScores = chunkStore.getDimensionScores(chunkId);
        Profile chunkProfile = config.getProfiles().bestMatchingProfile(dimensionScores).orElse(null);
        AlignmentResult result = AlignmentCalculator.calculate(
            dimensionScores,
            profile,
            constraints,
            chunkProfile,
            config.getAlignment(),
            config.getFilters()
        );
        if (config.getLogging().logScoringDetails()) {
            log.debug(
                "alignment chunk={} profile={} chunk_profile={} dims={} penalized={} aggregate={} normalized={} boost={} bonus={} value={}",
                chunkId,
                profile.getId(),
                chunkProfile == null ? null : chunkProfile.getId(),
                result.dimensionsUsed(),
                result.penalizedTargets(),
                result.aggregate(),
                result.normalized(),
                result.confidenceBoost(),
                result.profileBonus(),
                result.value()
            );
        }

        if (cacheEnabled && context.cacheUsable()) {
            try {
                alignmentCache.put(config.getGeneration(), constraintsKey, chunkId, profile.getId(), result.value());
            } catch (CacheUnavailableException ex) {
                context.disableCache(ex);
            }
        }
        return result.value();
    }

    private List<ScoredCandidate> blend(List<ScoredCandidate> scored, Profile profile, ExecutionMode mode, int size) {
        ProfileWeights weights = profile.getWeights();
        List<ScoredCandidate> blended = new ArrayList<>(scored.size());
        for (ScoredCandidate candidate : scored) {
            double score;
            if (mode == ExecutionMode.DIMENSION_ONLY) {
                score = candidate.dimensionAlignment();
            } else {
                score = candidate.semanticSimilarity() * weights.semanticSimilarity()
                    + candidate.dimensionAlignment() * weights.dimensionAlignment()
                    + candidate.recencyScore() * weights.recencyScore()
                    + candidate.confidenceScore() * weights.confidenceScore();
            }
            blended.add(withScore(candidate, score));
        }
        sortScored(blended);
        return truncate(blended, size);
    }

    private List<ScoredCandidate> similarityOnly(List<CandidateHit> hits, String profileId, int size) {
        List<ScoredCandidate> ordered = new ArrayList<>(hits.size());
        for (int i = 0; i < hits.size(); i++) {
            CandidateHit hit = hits.get(i);
            double similarity = clamp01(hit.similarity());
            ordered.add(new ScoredCandidate(hit.chunkId(), i, similarity, 0.0, 0.0, 0.0, profileId, similarity, false));
        }
        sortScored(ordered);
        return truncate(ordered, size);
    }

    private void sortScored(List<ScoredCandidate> scored) {
        scored.sort(
            Comparator.comparingDouble(ScoredCandidate::score).reversed()
                .thenComparingInt(ScoredCandidate::similarityRank)
        );
    }

    private List<ScoredCandidate> truncate(List<ScoredCandidate> scored, int size) {
        if (scored.size() <= size) {
            return scored;
        }
        return new ArrayList<>(scored.subList(0, size));
    }

    private ScoredCandidate withScore(ScoredCandidate candidate, double score) {
        return new ScoredCandidate(
            candidate.chunkId(),
            candidate.similarityRank(),
            candidate.semanticSimilarity(),
            candidate.dimensionAlignment(),
            candidate.recencyScore(),
            candidate.confidenceScore(),
            candidate.profileId(),
            score,
            candidate.dimensionScored()
        );
    }

    private RankResult finish(
        CallContext context,
        String queryText,
        List<ScoredCandidate> results,
        Profile profile,
        double profileConfidence,
        boolean degraded,
        RankingState state,
        ExecutionMode mode,
        List<FilterConstraint> constraints,
        int candidatesFetched,
        int candidatesScored,
        long started
    ) {
        long tookMs = clock.millis() - started;
        if (context.config().getLogging().logPerformance()) {
            log.info(
                "rank profile={} mode={} state={} degraded={} fetched={} scored={} returned={} cache_hits={} cache_misses={} took_ms={}",
                profile.getId(),
                mode,
                state,
                degraded,
                candidatesFetched,
                candidatesScored,
                results.size(),
                context.cacheHits,
                context.cacheMisses,
                tookMs
            );
        }
        if (log.isDebugEnabled()) {
            log.debug("rank query_len={} reasons={}", queryText == null ? 0 : queryText.length(), context.reasonCodes());
        }
        return new RankResult(
            results,
            profile.getId(),
            profileConfidence,
            degraded,
            state,
            mode,
            context.reasonCodes(),
            constraints,
            candidatesFetched,
            candidatesScored,
            context.cacheHits,
            context.cacheMisses,
            tookMs
        );
    }

    private int resolveSize(int resultCount, List<String> reasonCodes) {
        int size = Math.max(resultCount, 0);
        if (size > guardrails.getMaxResultCount()) {
            size = guardrails.getMaxResultCount();
            reasonCodes.add("size_capped");
        }
        return size;
    }

    private String describe(List<FilterConstraint> constraints) {
        List<String> parts = new ArrayList<>(constraints.size());
        for (FilterConstraint constraint : constraints) {
            parts.add(constraint.phrase() + "->" + constraint.targets());
        }
        return String.join(", ", parts);
    }

    private static double clamp01(double value) {
        if (Double.isNaN(value) || value <= 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private record ProfileResolution(Profile profile, double confidence) {}

    private record ScoringOutcome(List<ScoredCandidate> scored, int scoredCount, boolean timedOut) {}

    private static final class CallContext {
        private final RetrievalConfig config;
        private final String fingerprint;
        private final List<String> reasonCodes;
        private boolean cacheUsable = true;
        private int cacheHits;
        private int cacheMisses;

        private CallContext(RetrievalConfig config, String fingerprint, List<String> reasonCodes) {
            this.config = config;
            this.fingerprint = fingerprint;
            this.reasonCodes = reasonCodes;
        }

        RetrievalConfig config() {
            return config;
        }

        String fingerprint() {
            return fingerprint;
        }

        List<String> reasonCodes() {
            return reasonCodes;
        }

        boolean cacheUsable() {
            return cacheUsable;
        }

        // the rest of this call recomputes every score instead of touching the cache again
        void disableCache(CacheUnavailableException ex) {
            if (cacheUsable) {
                log.debug("score cache unavailable; continuing without cache", ex);
                reasonCodes.add("cache_unavailable");
            }
            cacheUsable = false;
        }
    }
}
