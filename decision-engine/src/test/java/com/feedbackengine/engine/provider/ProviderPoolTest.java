package com.feedbackengine.engine.provider;

import com.feedbackengine.common.model.MarketSnapshot;
import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.TradeAction;
import com.feedbackengine.engine.StubProvider;
import com.feedbackengine.engine.logger.DecisionFlowLogger;
import com.feedbackengine.engine.trace.TraceContextUtil.DecisionContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ProviderPoolTest {

    private static final MarketSnapshot SNAPSHOT = MarketSnapshot.of("BTCUSD", "1h",
        Instant.parse("2024-06-12T13:00:00Z"), 100, 101, 99, 100.5, 1_000, Map.of());

    private static DecisionContext context(String decisionId) {
        return DecisionContext.of(decisionId, SNAPSHOT.assetPair(), "test");
    }

    private static Set<String> ids(List<ProviderVote> votes) {
        return votes.stream().map(ProviderVote::providerId).collect(Collectors.toSet());
    }

    @Test
    @DisplayName("collects one vote per provider with measured latency")
    void collectsAllVotes() {
        ProviderPool pool = new ProviderPool(List.of(
            StubProvider.voting("alpha", TradeAction.BUY, 80),
            StubProvider.voting("beta", TradeAction.SELL, 60)), Duration.ofSeconds(2), new DecisionFlowLogger());

        StepVerifier.create(pool.collectVotes(SNAPSHOT, context("d-1")))
            .assertNext(votes -> {
                assertEquals(Set.of("alpha", "beta"), ids(votes));
                assertTrue(votes.stream().allMatch(v -> v.latency() != null));
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("a failing provider is dropped, the others still vote")
    void failingProviderDropped() {
        ProviderPool pool = new ProviderPool(List.of(
            StubProvider.voting("alpha", TradeAction.BUY, 80),
            StubProvider.failing("broken")), Duration.ofSeconds(2), new DecisionFlowLogger());

        StepVerifier.create(pool.collectVotes(SNAPSHOT, context("d-2")))
            .assertNext(votes -> assertEquals(Set.of("alpha"), ids(votes)))
            .verifyComplete();
    }

    @Test
    @DisplayName("a slow provider is excluded after the timeout instead of blocking the pool")
    void slowProviderTimesOut() {
        ProviderPool pool = new ProviderPool(List.of(
            StubProvider.voting("alpha", TradeAction.BUY, 80),
            StubProvider.slow("sleepy", TradeAction.SELL, Duration.ofSeconds(5))),
            Duration.ofMillis(200), new DecisionFlowLogger());

        Duration elapsed = StepVerifier.create(pool.collectVotes(SNAPSHOT, context("d-3")))
            .assertNext(votes -> assertEquals(Set.of("alpha"), ids(votes)))
            .verifyComplete();

        assertTrue(elapsed.compareTo(Duration.ofSeconds(3)) < 0, "pool waited " + elapsed);
    }

    @Test
    @DisplayName("no providers → empty vote list")
    void noProviders() {
        ProviderPool pool = new ProviderPool(List.of(), Duration.ofSeconds(1), new DecisionFlowLogger());

        assertTrue(pool.collectVotesBlocking(SNAPSHOT, context("d-4")).isEmpty());
    }

    @Test
    @DisplayName("non-positive timeout is rejected")
    void invalidTimeout() {
        assertThrows(IllegalArgumentException.class,
            () -> new ProviderPool(List.of(), Duration.ZERO, new DecisionFlowLogger()));
    }
}
