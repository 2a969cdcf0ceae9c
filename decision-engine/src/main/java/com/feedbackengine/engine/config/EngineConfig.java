package com.feedbackengine.engine.config;

import com.feedbackengine.common.cache.DecisionCache;
import com.feedbackengine.common.cache.DecisionCacheStore;
import com.feedbackengine.common.consensus.EnsembleAggregator;
import com.feedbackengine.common.consensus.StackingModel;
import com.feedbackengine.common.memory.PortfolioMemory;
import com.feedbackengine.common.memory.PortfolioMemoryStore;
import com.feedbackengine.common.risk.ExposureReservationManager;
import com.feedbackengine.common.risk.PositionSizer;
import com.feedbackengine.common.risk.RiskGatekeeper;
import com.feedbackengine.common.weights.JsonFileWeightStateStore;
import com.feedbackengine.common.weights.ThompsonSamplingWeightOptimizer;
import com.feedbackengine.common.weights.WeightStateStore;
import com.feedbackengine.engine.feedback.OutcomeFeedbackService;
import com.feedbackengine.engine.journal.DecisionJournal;
import com.feedbackengine.engine.logger.DecisionFlowLogger;
import com.feedbackengine.engine.pipeline.DecisionPipeline;
import com.feedbackengine.engine.pipeline.DecisionSession;
import com.feedbackengine.engine.provider.DecisionProvider;
import com.feedbackengine.engine.provider.ProviderPool;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Wires the pure common-lib components into the live engine. All learning state
 * (weights, memory, journal, decision cache) lives under {@code engine.persistence.state-dir}.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
@Import({DecisionFlowLogger.class, OutcomeFeedbackService.class})
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    static final String WEIGHTS_FILE = "provider_weights.json";
    static final String MEMORY_FILE  = "portfolio_memory.json";
    static final String JOURNAL_FILE = "decisions.jsonl";
    static final String CACHE_FILE   = "decision_cache.json";

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderPool providerPool(ObjectProvider<DecisionProvider> providers, EngineProperties properties,
                                     DecisionFlowLogger flowLogger) {
        properties.validate();
        List<DecisionProvider> registered = providers.orderedStream().toList();
        if (registered.isEmpty()) {
            log.warn("[EngineConfig] No DecisionProvider beans registered; every decision will fail.");
        }
        return new ProviderPool(registered, properties.getProviderTimeout(), flowLogger);
    }

    @Bean
    public EnsembleAggregator ensembleAggregator(EngineProperties properties, ObjectMapper objectMapper) {
        StackingModel model = properties.getStackingModelPath() != null
            ? StackingModel.load(Path.of(properties.getStackingModelPath()), objectMapper)
            : StackingModel.defaults();
        return new EnsembleAggregator(properties.getVotingStrategy(), properties.getFallbackWeights(),
            properties.getProviderPriority(), model);
    }

    @Bean
    public PositionSizer positionSizer(EngineProperties properties) {
        EngineProperties.Sizing s = properties.getSizing();
        return new PositionSizer(s.getRiskPct(), s.getStopLossPct(), s.isDynamicStopLoss(),
            s.getAtrMultiplier(), s.getMinStopLossPct(), s.getMaxStopLossPct());
    }

    @Bean
    public WeightStateStore weightStateStore(EngineProperties properties, ObjectMapper objectMapper) {
        return new JsonFileWeightStateStore(stateFile(properties, WEIGHTS_FILE), objectMapper,
            properties.getPersistence().isFreshStartOnCorruption());
    }

    @Bean
    public ThompsonSamplingWeightOptimizer weightOptimizer(EngineProperties properties, ProviderPool providerPool,
                                                           WeightStateStore weightStateStore) {
        Set<String> providerIds = new LinkedHashSet<>(providerPool.providerIds());
        providerIds.addAll(properties.getProviderPriority());
        providerIds.addAll(properties.getFallbackWeights().keySet());
        return new ThompsonSamplingWeightOptimizer(providerIds, weightStateStore, properties.getWeightSeed());
    }

    @Bean
    public PortfolioMemoryStore portfolioMemoryStore(EngineProperties properties, ObjectMapper objectMapper) {
        return new PortfolioMemoryStore(stateFile(properties, MEMORY_FILE), objectMapper,
            properties.getPersistence().isFreshStartOnCorruption());
    }

    @Bean
    public PortfolioMemory portfolioMemory(PortfolioMemoryStore portfolioMemoryStore) {
        return portfolioMemoryStore.loadMemory();
    }

    @Bean
    public RiskGatekeeper riskGatekeeper(EngineProperties properties, Clock engineClock) {
        ExposureReservationManager reservations = new ExposureReservationManager(
            properties.getRisk().getMaxExposurePct(), properties.getRisk().getReservationTtl(), engineClock);
        return new RiskGatekeeper(properties.toGatekeeperConfig(), reservations, engineClock);
    }

    @Bean
    public DecisionCache decisionCache(EngineProperties properties, ObjectMapper objectMapper, Clock engineClock) {
        EngineProperties.Persistence persistence = properties.getPersistence();
        if (!persistence.isCacheEnabled()) {
            return new DecisionCache(engineClock);
        }
        DecisionCache cache = new DecisionCache(engineClock, new DecisionCacheStore(
            stateFile(properties, CACHE_FILE), objectMapper, persistence.isFreshStartOnCorruption()));
        cache.evictOlderThan(persistence.getCacheMaxAge());
        return cache;
    }

    @Bean
    public DecisionJournal decisionJournal(EngineProperties properties, ObjectMapper objectMapper) {
        return new DecisionJournal(stateFile(properties, JOURNAL_FILE), objectMapper);
    }

    /** The canonical live session. Replays fork their own. */
    @Bean
    public DecisionSession liveSession(EngineProperties properties, ThompsonSamplingWeightOptimizer weightOptimizer,
                                       PortfolioMemory portfolioMemory, RiskGatekeeper riskGatekeeper,
                                       DecisionCache decisionCache, DecisionJournal decisionJournal,
                                       PortfolioMemoryStore portfolioMemoryStore) {
        DecisionJournal journal = properties.getPersistence().isJournalEnabled() ? decisionJournal : null;
        return new DecisionSession("live", weightOptimizer, portfolioMemory, riskGatekeeper,
            decisionCache, journal, portfolioMemoryStore);
    }

    @Bean
    public DecisionPipeline decisionPipeline(ProviderPool providerPool, EnsembleAggregator ensembleAggregator,
                                             PositionSizer positionSizer, DecisionFlowLogger flowLogger) {
        log.info("[EngineConfig] Decision pipeline ready. strategy={} providers={} timeout={}",
            ensembleAggregator.configuredStrategy(), providerPool.providerIds(), providerPool.timeout());
        return new DecisionPipeline(providerPool, ensembleAggregator, positionSizer, flowLogger);
    }

    private static Path stateFile(EngineProperties properties, String fileName) {
        return Path.of(properties.getPersistence().getStateDir()).resolve(fileName);
    }
}
