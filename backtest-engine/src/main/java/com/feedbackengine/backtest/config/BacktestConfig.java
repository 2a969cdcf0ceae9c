package com.feedbackengine.backtest.config;

import com.feedbackengine.backtest.learning.LearningValidationAnalyzer;
import com.feedbackengine.backtest.montecarlo.MonteCarloSimulator;
import com.feedbackengine.backtest.replay.BacktestReplayEngine;
import com.feedbackengine.backtest.replay.BacktestSettings;
import com.feedbackengine.backtest.replay.FillSimulator;
import com.feedbackengine.backtest.walkforward.WalkForwardAnalyzer;
import com.feedbackengine.backtest.walkforward.WalkForwardSplitter;
import com.feedbackengine.engine.config.EngineConfig;
import com.feedbackengine.engine.feedback.OutcomeFeedbackService;
import com.feedbackengine.engine.pipeline.DecisionPipeline;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Clock;

/** Backtest components on top of the live engine wiring. */
@Configuration
@Import(EngineConfig.class)
@EnableConfigurationProperties(BacktestProperties.class)
public class BacktestConfig {

    @Bean
    public FillSimulator fillSimulator(BacktestProperties properties) {
        return new FillSimulator(properties.getSlippagePct(), properties.getFeePct());
    }

    @Bean
    public BacktestReplayEngine backtestReplayEngine(BacktestProperties properties, DecisionPipeline decisionPipeline,
                                                     OutcomeFeedbackService outcomeFeedbackService,
                                                     FillSimulator fillSimulator) {
        properties.validate();
        BacktestSettings settings = new BacktestSettings(properties.getInitialBalance(), properties.getAssetType(),
            properties.getPeriodsPerYear(), properties.getRegimeLookback());
        return new BacktestReplayEngine(decisionPipeline, outcomeFeedbackService, fillSimulator, settings);
    }

    @Bean
    public WalkForwardAnalyzer walkForwardAnalyzer(BacktestProperties properties, BacktestReplayEngine backtestReplayEngine,
                                                   Clock engineClock) {
        BacktestProperties.WalkForward wf = properties.getWalkForward();
        return new WalkForwardAnalyzer(backtestReplayEngine,
            new WalkForwardSplitter(wf.getWindowSize(), wf.getTrainRatio(), wf.getStep()), engineClock);
    }

    @Bean
    public MonteCarloSimulator monteCarloSimulator(BacktestProperties properties, BacktestReplayEngine backtestReplayEngine,
                                                   Clock engineClock) {
        BacktestProperties.MonteCarlo mc = properties.getMonteCarlo();
        return new MonteCarloSimulator(backtestReplayEngine, mc.getNumSimulations(), mc.getPriceNoiseStd(),
            mc.getParallelism(), engineClock);
    }

    @Bean
    public LearningValidationAnalyzer learningValidationAnalyzer() {
        return new LearningValidationAnalyzer();
    }
}
