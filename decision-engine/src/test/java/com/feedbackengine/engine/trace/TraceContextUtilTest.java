package com.feedbackengine.engine.trace;

import com.feedbackengine.engine.trace.TraceContextUtil.DecisionContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextUtilTest {

    private static final DecisionContext CONTEXT = DecisionContext.of("d-1", "BTCUSD", "live");

    @Test
    @DisplayName("decision id, asset and session travel upstream through the Reactor Context")
    void reactorContext() {
        Mono<DecisionContext> read = Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getDecisionContext(ctx)));

        StepVerifier.create(TraceContextUtil.withDecisionContext(read, CONTEXT))
            .expectNext(CONTEXT)
            .verifyComplete();
    }

    @Test
    @DisplayName("missing keys and null parts read as unknown")
    void unknownDefaults() {
        StepVerifier.create(Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getDecisionContext(ctx))))
            .expectNext(DecisionContext.of(null, null, null))
            .verifyComplete();

        DecisionContext partial = DecisionContext.of("d-2", null, null);
        assertEquals("d-2", partial.decisionId());
        assertEquals("unknown", partial.assetPair());
        assertEquals("unknown", partial.session());
    }

    @Test
    @DisplayName("MDC holds every key during the log action and is cleared afterwards")
    void mdcScoped() {
        Map<String, String> seen = new HashMap<>();

        TraceContextUtil.withMdc(CONTEXT, () -> {
            seen.put(TraceContextUtil.DECISION_ID_KEY, MDC.get(TraceContextUtil.DECISION_ID_KEY));
            seen.put(TraceContextUtil.ASSET_KEY, MDC.get(TraceContextUtil.ASSET_KEY));
            seen.put(TraceContextUtil.SESSION_KEY, MDC.get(TraceContextUtil.SESSION_KEY));
        });

        assertEquals(Map.of("decisionId", "d-1", "asset", "BTCUSD", "session", "live"), seen);
        assertNull(MDC.get(TraceContextUtil.DECISION_ID_KEY));
        assertNull(MDC.get(TraceContextUtil.ASSET_KEY));
        assertNull(MDC.get(TraceContextUtil.SESSION_KEY));
    }

    @Test
    @DisplayName("MDC is cleared even when the log action throws")
    void mdcClearedOnFailure() {
        assertThrows(IllegalStateException.class, () -> TraceContextUtil.withMdc(CONTEXT, () -> {
            throw new IllegalStateException("boom");
        }));

        assertNull(MDC.get(TraceContextUtil.DECISION_ID_KEY));
    }
}
