package com.feedbackengine.engine.config;

import com.feedbackengine.common.cache.DecisionCache;
import com.feedbackengine.common.consensus.EnsembleAggregator;
import com.feedbackengine.common.model.AggregationTier;
import com.feedbackengine.common.model.Decision;
import com.feedbackengine.common.model.TradeAction;
import com.feedbackengine.common.risk.RiskGatekeeper;
import com.feedbackengine.common.weights.ThompsonSamplingWeightOptimizer;
import com.feedbackengine.engine.StubProvider;
import com.feedbackengine.engine.feedback.OutcomeFeedbackService;
import com.feedbackengine.engine.pipeline.DecisionPipeline;
import com.feedbackengine.engine.pipeline.DecisionSession;
import com.feedbackengine.engine.provider.DecisionProvider;
import com.feedbackengine.engine.provider.ProviderPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @TempDir
    Path stateDir;

    private ApplicationContextRunner runner() {
        return new ApplicationContextRunner()
            .withUserConfiguration(EngineConfig.class)
            .withBean("alpha", DecisionProvider.class, () -> StubProvider.voting("alpha", TradeAction.BUY, 80))
            .withBean("beta", DecisionProvider.class, () -> StubProvider.voting("beta", TradeAction.SELL, 60))
            .withPropertyValues("engine.persistence.state-dir=" + stateDir);
    }

    @Test
    @DisplayName("context wires pipeline, live session and feedback service from engine.* properties")
    void wiresEngine() {
        runner()
            .withPropertyValues(
                "engine.voting-strategy=MAJORITY",
                "engine.provider-timeout=3s",
                "engine.fallback-weights.gamma=0.5",
                "engine.risk.max-drawdown=0.1")
            .run(context -> {
                assertNull(context.getStartupFailure());
                assertNotNull(context.getBean(DecisionPipeline.class));
                assertNotNull(context.getBean(OutcomeFeedbackService.class));
                assertEquals("MAJORITY", context.getBean(EnsembleAggregator.class).configuredStrategy());
                assertEquals(Duration.ofSeconds(3), context.getBean(ProviderPool.class).timeout());
                assertEquals(Set.of("alpha", "beta"), Set.copyOf(context.getBean(ProviderPool.class).providerIds()));
                assertEquals(0.1, context.getBean(RiskGatekeeper.class).config().maxDrawdown(), 1e-9);

                ThompsonSamplingWeightOptimizer optimizer = context.getBean(ThompsonSamplingWeightOptimizer.class);
                assertTrue(optimizer.isKnown("alpha"));
                assertTrue(optimizer.isKnown("gamma"));

                DecisionSession live = context.getBean(DecisionSession.class);
                assertEquals("live", live.name());
                assertNotNull(live.journal());
                assertEquals(stateDir.resolve(EngineConfig.JOURNAL_FILE), live.journal().path());
            });
    }

    @Test
    @DisplayName("journal can be disabled")
    void journalDisabled() {
        runner()
            .withPropertyValues("engine.persistence.journal-enabled=false")
            .run(context -> assertNull(context.getBean(DecisionSession.class).journal()));
    }

    @Test
    @DisplayName("decision cache written by one context is loaded by the next")
    void cacheSurvivesRestart() {
        Decision decision = Decision.signalOnly("d1", "BTCUSD", Instant.now(), TradeAction.BUY, 70,
            AggregationTier.MAJORITY, List.of(), "cached");

        runner().run(context -> assertTrue(context.getBean(DecisionCache.class).put("k1", decision)));
        assertTrue(Files.exists(stateDir.resolve(EngineConfig.CACHE_FILE)));

        runner().run(context -> {
            DecisionCache cache = context.getBean(DecisionCache.class);
            assertEquals(1, cache.size());
            assertEquals("d1", cache.get("k1").orElseThrow().id());
        });

        runner()
            .withPropertyValues("engine.persistence.cache-enabled=false")
            .run(context -> assertEquals(0, context.getBean(DecisionCache.class).size()));
    }

    @Test
    @DisplayName("invalid risk limits fail startup")
    void invalidConfigFails() {
        runner()
            .withPropertyValues("engine.risk.correlation-threshold=1.5")
            .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("corrupt weight state fails startup unless a fresh start is requested")
    void corruptState() throws Exception {
        Files.writeString(stateDir.resolve(EngineConfig.WEIGHTS_FILE), "{broken");

        runner().run(context -> assertNotNull(context.getStartupFailure()));

        runner()
            .withPropertyValues("engine.persistence.fresh-start-on-corruption=true")
            .run(context -> assertNull(context.getStartupFailure()));
    }
}
