package com.bsl.dimrank.service;

import com.bsl.dimrank.config.RetrievalConfig;
import com.bsl.dimrank.config.RetrievalStrategy;
import com.bsl.dimrank.resilience.CircuitBreaker;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides per call whether a query runs the hybrid pipeline or degrades.
 *
 * <p>The {@code adaptive} strategy runs hybrid until {@code adaptive.consecutive_timeouts}
 * hybrid queries in a row hit the time budget. It then serves {@code fallback_strategy} for
 * {@code adaptive.cooldown_ms} and tries hybrid again afterwards.
 */
@Component
public class FallbackController {
    private static final Logger log = LoggerFactory.getLogger(FallbackController.class);

    private final Clock clock;
    private final AtomicReference<AdaptiveCircuit> circuit = new AtomicReference<>();

    public FallbackController(Clock clock) {
        this.clock = clock;
    }

    public FallbackDecision decide(RetrievalConfig.RetrievalSettings settings) {
        if (!settings.enableDimensionRanking()) {
            return new FallbackDecision(ExecutionMode.VECTOR_ONLY, true, "dimension_ranking_disabled");
        }
        return switch (settings.defaultStrategy()) {
            case VECTOR_ONLY -> new FallbackDecision(ExecutionMode.VECTOR_ONLY, true, "strategy_vector_only");
            case DIMENSION_ONLY -> new FallbackDecision(ExecutionMode.DIMENSION_ONLY, false, null);
            case HYBRID -> new FallbackDecision(ExecutionMode.HYBRID, false, null);
            case ADAPTIVE -> decideAdaptive(settings);
        };
    }

    /**
     * Feeds the outcome of a hybrid query run under the adaptive strategy back into the
     * downgrade circuit. Other strategies ignore outcomes.
     */
    public void recordOutcome(RetrievalConfig.RetrievalSettings settings, FallbackDecision decision, boolean timedOut) {
        if (settings.defaultStrategy() != RetrievalStrategy.ADAPTIVE || decision.mode() != ExecutionMode.HYBRID) {
            return;
        }
        CircuitBreaker breaker = breakerFor(settings.adaptive());
        if (!timedOut) {
            breaker.recordSuccess();
            return;
        }
        breaker.recordFailure();
        if (breaker.isOpen()) {
            log.warn(
                "adaptive strategy downgraded to {} for {}ms after {} consecutive timeouts",
                settings.fallbackStrategy(),
                settings.adaptive().cooldownMs(),
                settings.adaptive().consecutiveTimeouts()
            );
        }
    }

    private FallbackDecision decideAdaptive(RetrievalConfig.RetrievalSettings settings) {
        if (!settings.enableFallback()) {
            return new FallbackDecision(ExecutionMode.HYBRID, false, null);
        }
        CircuitBreaker breaker = breakerFor(settings.adaptive());
        if (breaker.allowRequest()) {
            return new FallbackDecision(ExecutionMode.HYBRID, false, null);
        }
        ExecutionMode downgraded = settings.fallbackStrategy() == RetrievalStrategy.DIMENSION_ONLY
            ? ExecutionMode.DIMENSION_ONLY
            : ExecutionMode.VECTOR_ONLY;
        return new FallbackDecision(downgraded, true, "adaptive_downgrade");
    }

    private CircuitBreaker breakerFor(RetrievalConfig.AdaptiveSettings adaptive) {
        AdaptiveCircuit existing = circuit.get();
        if (existing != null && existing.settings().equals(adaptive)) {
            return existing.breaker();
        }
        AdaptiveCircuit created = new AdaptiveCircuit(
            adaptive,
            new CircuitBreaker(adaptive.consecutiveTimeouts(), adaptive.cooldownMs(), clock)
        );
        if (circuit.compareAndSet(existing, created)) {
            return created.breaker();
        }
        return circuit.get().breaker();
    }

    private record AdaptiveCircuit(RetrievalConfig.AdaptiveSettings settings, CircuitBreaker breaker) {}
}
