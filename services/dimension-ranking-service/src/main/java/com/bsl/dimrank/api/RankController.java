package com.bsl.dimrank.api;

import com.bsl.dimrank.api.dto.ErrorResponse;
import com.bsl.dimrank.api.dto.ProfileResponse;
import com.bsl.dimrank.api.dto.RankRequest;
import com.bsl.dimrank.api.dto.RankResponse;
import com.bsl.dimrank.config.RetrievalConfig;
import com.bsl.dimrank.config.RetrievalConfigService;
import com.bsl.dimrank.filter.DimensionTarget;
import com.bsl.dimrank.filter.FilterConstraint;
import com.bsl.dimrank.profile.Profile;
import com.bsl.dimrank.profile.ProfileRegistry;
import com.bsl.dimrank.profile.ScoringFactor;
import com.bsl.dimrank.service.CompositeRanker;
import com.bsl.dimrank.service.RankGuardrailsProperties;
import com.bsl.dimrank.service.RankResult;
import com.bsl.dimrank.service.ScoredCandidate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RankController {
    private final CompositeRanker ranker;
    private final RetrievalConfigService configService;
    private final RankGuardrailsProperties guardrails;

    public RankController(
        CompositeRanker ranker,
        RetrievalConfigService configService,
        RankGuardrailsProperties guardrails
    ) {
        this.ranker = ranker;
        this.configService = configService;
        this.guardrails = guardrails;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/rank")
    public ResponseEntity<?> rank(
        @RequestBody(required = false) RankRequest request,
        @RequestHeader(value = RequestIdUtil.TRACE_HEADER, required = false) String traceHeader,
        @RequestHeader(value = RequestIdUtil.REQUEST_HEADER, required = false) String requestHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestHeader);

        if (request == null || isBlank(request.getQuery())) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "query is required", traceId, requestId)
            );
        }
        if (request.getQuery().length() > guardrails.getMaxQueryLength()) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse(
                    "bad_request",
                    "query exceeds " + guardrails.getMaxQueryLength() + " characters",
                    traceId,
                    requestId
                )
            );
        }
        int resultCount = request.getResultCount() == null
            ? guardrails.getDefaultResultCount()
            : request.getResultCount();
        if (resultCount < 0 || resultCount > guardrails.getMaxResultCount()) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse(
                    "bad_request",
                    "result_count must be between 0 and " + guardrails.getMaxResultCount(),
                    traceId,
                    requestId
                )
            );
        }

        RankResult result = ranker.rank(request.getQuery(), resultCount, request.getProfile());
        return ResponseEntity.ok(toResponse(result, traceId, requestId));
    }

    @GetMapping("/profiles")
    public Map<String, Object> profiles() {
        return profilesBody(configService.current());
    }

    @PostMapping("/profiles/reload")
    public Map<String, Object> reloadProfiles() {
        return profilesBody(ranker.reloadConfiguration());
    }

    private Map<String, Object> profilesBody(RetrievalConfig config) {
        ProfileRegistry registry = config.getProfiles();
        List<ProfileResponse> profiles = new ArrayList<>(registry.size());
        for (Profile profile : registry.profiles()) {
            ProfileResponse item = new ProfileResponse();
            item.setId(profile.getId());
            item.setDescription(profile.getDescription());
            item.setTargetUsers(profile.getTargetUsers());
            item.setDefaultProfile(ProfileRegistry.DEFAULT_PROFILE_ID.equals(profile.getId()));
            Map<String, Double> weights = new LinkedHashMap<>();
            for (ScoringFactor factor : ScoringFactor.values()) {
                weights.put(factor.key(), profile.getWeights().get(factor));
            }
            item.setWeights(weights);
            item.setDimensions(profile.getDimensions());
            profiles.add(item);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("default_profile", ProfileRegistry.DEFAULT_PROFILE_ID);
        body.put("strategy", config.getRetrieval().defaultStrategy().name().toLowerCase(Locale.ROOT));
        body.put("profiles", profiles);
        return body;
    }

    private RankResponse toResponse(RankResult result, String traceId, String requestId) {
        RankResponse response = new RankResponse();
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setTookMs(result.tookMs());
        response.setProfileUsed(result.profileUsed());
        response.setProfileConfidence(result.profileConfidence());
        response.setDegraded(result.degraded());
        response.setState(result.state().name());
        response.setMode(result.mode().name().toLowerCase(Locale.ROOT));
        response.setReasonCodes(result.reasonCodes());

        List<RankResponse.Hit> hits = new ArrayList<>(result.results().size());
        int rank = 1;
        for (ScoredCandidate candidate : result.results()) {
            RankResponse.Hit hit = new RankResponse.Hit();
            hit.setChunkId(candidate.chunkId());
            hit.setRank(rank++);
            hit.setScore(candidate.score());
            hit.setSemanticSimilarity(candidate.semanticSimilarity());
            hit.setDimensionAlignment(candidate.dimensionAlignment());
            hit.setRecencyScore(candidate.recencyScore());
            hit.setConfidenceScore(candidate.confidenceScore());
            hit.setSimilarityRank(candidate.similarityRank());
            hit.setDimensionScored(candidate.dimensionScored());
            hits.add(hit);
        }
        response.setResults(hits);

        List<RankResponse.Constraint> constraints = new ArrayList<>(result.constraints().size());
        for (FilterConstraint constraint : result.constraints()) {
            RankResponse.Constraint item = new RankResponse.Constraint();
            item.setPhrase(constraint.phrase());
            item.setConfidence(constraint.confidence());
            List<RankResponse.Target> targets = new ArrayList<>(constraint.targets().size());
            for (DimensionTarget target : constraint.targets()) {
                RankResponse.Target t = new RankResponse.Target();
                t.setDimension(target.dimension());
                t.setLevel(target.level().name().toLowerCase(Locale.ROOT));
                t.setThreshold(target.threshold());
                targets.add(t);
            }
            item.setTargets(targets);
            constraints.add(item);
        }
        response.setConstraints(constraints);

        RankResponse.Stats stats = new RankResponse.Stats();
        stats.setCandidatesFetched(result.candidatesFetched());
        stats.setCandidatesScored(result.candidatesScored());
        stats.setCacheHits(result.cacheHits());
        stats.setCacheMisses(result.cacheMisses());
        response.setStats(stats);
        return response;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
