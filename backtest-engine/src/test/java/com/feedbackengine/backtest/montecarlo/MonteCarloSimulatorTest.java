package com.feedbackengine.backtest.montecarlo;

import com.feedbackengine.backtest.ReplayFixtures;
import com.feedbackengine.backtest.replay.CancellationToken;
import com.feedbackengine.common.exception.ConfigurationException;
import com.feedbackengine.common.model.MarketSnapshot;
import com.feedbackengine.engine.pipeline.DecisionSession;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MonteCarloSimulatorTest {

    private static final List<MarketSnapshot> RALLY = ReplayFixtures.bars(
        new double[]{100, 101, 102, 103, 104, 105, 105, 105},
        new int[]{1, 0, 0, 0, 0, -1, 0, 0});

    private static MonteCarloSimulator simulator(int paths, double std) {
        return new MonteCarloSimulator(ReplayFixtures.engine(), paths, std, 4, Clock.systemUTC());
    }

    @Test
    @DisplayName("zero noise → every path ends on the same equity")
    void zeroNoiseCollapses() {
        MonteCarloReport report = simulator(1000, 0.0).simulate(ReplayFixtures.session(3L), RALLY, 3L);

        assertEquals(1000, report.completedPaths());
        assertFalse(report.cancelled());
        assertEquals(report.p5(), report.p95(), 1e-9);
        assertEquals(report.worst(), report.best(), 1e-9);
        assertEquals(0.0, report.stdDev(), 1e-9);
        assertTrue(report.p50() > 10_000.0);
    }

    @Test
    @DisplayName("noisy paths → ordered percentiles, reproducible for a seed")
    void noisyPaths() {
        MonteCarloReport first  = simulator(64, 0.01).simulate(ReplayFixtures.session(3L), RALLY, 11L);
        MonteCarloReport second = simulator(64, 0.01).simulate(ReplayFixtures.session(3L), RALLY, 11L);

        assertEquals(64, first.completedPaths());
        assertTrue(first.worst() <= first.p5());
        assertTrue(first.p5() <= first.p50());
        assertTrue(first.p50() <= first.p95());
        assertTrue(first.p95() <= first.best());
        assertTrue(first.stdDev() > 0);
        assertEquals(first.p50(), second.p50(), 1e-9);
        assertEquals(first.valueAtRisk95(), second.valueAtRisk95(), 1e-9);
    }

    @Test
    @DisplayName("paths never write into the base session")
    void baseUntouched() {
        DecisionSession base = ReplayFixtures.session(3L);

        simulator(8, 0.01).simulate(base, RALLY, 5L);

        assertEquals(0, base.memory().size());
        assertEquals(0, base.optimizer().state("alpha").observations());
    }

    @Test
    @DisplayName("cancelled before start → no paths, flagged")
    void cancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        MonteCarloReport report = simulator(16, 0.01).simulate(ReplayFixtures.session(3L), RALLY, 5L, token);

        assertTrue(report.cancelled());
        assertEquals(0, report.completedPaths());
        assertEquals(16, report.requestedPaths());
    }

    @Test
    @DisplayName("perturbation is reproducible and keeps bars consistent")
    void perturb() {
        List<MarketSnapshot> a = MonteCarloSimulator.perturb(RALLY, 0.05, new Well19937c(42L));
        List<MarketSnapshot> b = MonteCarloSimulator.perturb(RALLY, 0.05, new Well19937c(42L));

        assertEquals(a, b);
        assertNotEquals(RALLY.get(0).close(), a.get(0).close());
        for (MarketSnapshot s : a) {
            assertTrue(s.high() >= s.low());
            assertTrue(s.close() > 0);
        }
        assertSame(RALLY, MonteCarloSimulator.perturb(RALLY, 0.0, new Well19937c(42L)));
    }

    @Test
    @DisplayName("noise above 0.5 or no paths is a configuration error")
    void invalidConfig() {
        assertThrows(ConfigurationException.class, () -> simulator(10, 0.6));
        assertThrows(ConfigurationException.class, () -> simulator(0, 0.01));
    }
}
