package com.feedbackengine.common.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceMetricsTest {

    @Test
    @DisplayName("net return and max drawdown from the equity curve")
    void drawdownAndReturn() {
        PerformanceReport report = PerformanceMetrics.evaluate(List.of(100.0, 110.0, 99.0, 120.0), List.of(), 252);

        assertEquals(0.2, report.netReturn(), 1e-12);
        assertEquals(0.1, report.maxDrawdown(), 1e-12);
        assertEquals(0, report.trades());
    }

    @Test
    @DisplayName("flat equity → Sharpe 0")
    void flatSharpe() {
        assertEquals(0.0, PerformanceMetrics.sharpe(List.of(100.0, 100.0, 100.0), 252), 0.0);
    }

    @Test
    @DisplayName("steady gains → positive Sharpe; steady losses → negative")
    void sharpeSign() {
        assertTrue(PerformanceMetrics.sharpe(List.of(100.0, 101.0, 103.0, 104.0), 252) > 0);
        assertTrue(PerformanceMetrics.sharpe(List.of(100.0, 99.0, 97.0, 96.0), 252) < 0);
    }

    @Test
    @DisplayName("current drawdown measures the last point against the peak")
    void currentDrawdown() {
        assertEquals(0.25, PerformanceMetrics.currentDrawdown(List.of(100.0, 200.0, 150.0)), 1e-12);
    }
}
