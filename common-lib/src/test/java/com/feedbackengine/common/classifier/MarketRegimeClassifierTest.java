package com.feedbackengine.common.classifier;

import com.feedbackengine.common.model.MarketRegime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketRegimeClassifierTest {

    @Test
    @DisplayName("fewer than three closes → UNKNOWN")
    void tooShort() {
        assertEquals(MarketRegime.UNKNOWN, MarketRegimeClassifier.classify(List.of(100.0, 101.0)));
        assertEquals(MarketRegime.UNKNOWN, MarketRegimeClassifier.classify(null));
    }

    @Test
    @DisplayName("large alternating swings → VOLATILE")
    void volatileSwings() {
        assertEquals(MarketRegime.VOLATILE,
            MarketRegimeClassifier.classify(List.of(100.0, 110.0, 95.0, 112.0, 90.0)));
    }

    @Test
    @DisplayName("steady drift upward → TRENDING")
    void trending() {
        List<Double> closes = new ArrayList<>();
        for (int i = 0; i < 60; i++) closes.add(100.0 + i * 0.5);

        assertEquals(MarketRegime.TRENDING, MarketRegimeClassifier.classify(closes));
    }

    @Test
    @DisplayName("small oscillation around a mean → RANGING")
    void ranging() {
        List<Double> closes = new ArrayList<>();
        for (int i = 0; i < 60; i++) closes.add(i % 2 == 0 ? 100.0 : 100.5);
        closes.add(100.25);

        assertEquals(MarketRegime.RANGING, MarketRegimeClassifier.classify(closes));
    }
}
