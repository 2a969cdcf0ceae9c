package com.feedbackengine.engine.config;

import com.feedbackengine.common.consensus.VotingStrategyType;
import com.feedbackengine.common.exception.ConfigurationException;
import com.feedbackengine.common.risk.RiskGatekeeperConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Bound from {@code engine.*}. Defaults live in {@code application.yml}. */
@Data
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    private VotingStrategyType votingStrategy = VotingStrategyType.WEIGHTED;
    private List<String> providerPriority = new ArrayList<>();
    private Map<String, Double> fallbackWeights = new LinkedHashMap<>();
    /** Optional JSON meta-learner for the STACKING strategy; built-in coefficients when unset. */
    private String stackingModelPath;
    private Duration providerTimeout = Duration.ofSeconds(10);
    private long weightSeed = 42L;

    private Sizing sizing = new Sizing();
    private Risk risk = new Risk();
    private Persistence persistence = new Persistence();

    @Data
    public static class Sizing {
        private double riskPct = 0.01;
        private double stopLossPct = 0.02;
        private boolean dynamicStopLoss = false;
        private double atrMultiplier = 2.0;
        private double minStopLossPct = 0.01;
        private double maxStopLossPct = 0.05;
    }

    @Data
    public static class Risk {
        private double maxDrawdown = 0.05;
        private double correlationThreshold = 0.7;
        private double varConfidence = 0.95;
        private double maxVarPct = 0.05;
        private double maxExposurePct = 1.0;
        private Duration maxDataAge = Duration.ofMinutes(15);
        private double volatilityThreshold = 0.05;
        private double minVolatileConfidence = 80.0;
        private Duration reservationTtl = Duration.ofSeconds(300);
    }

    @Data
    public static class Persistence {
        private String stateDir = "data";
        private boolean freshStartOnCorruption = false;
        private boolean journalEnabled = true;
        private boolean cacheEnabled = true;
        private Duration cacheMaxAge = Duration.ofDays(90);
    }

    /** @throws ConfigurationException on the first invalid value */
    public void validate() {
        if (votingStrategy == null) {
            throw new ConfigurationException("engine.voting-strategy must be set");
        }
        if (providerTimeout == null || providerTimeout.isNegative() || providerTimeout.isZero()) {
            throw new ConfigurationException("engine.provider-timeout must be positive, got " + providerTimeout);
        }
        fallbackWeights.forEach((provider, weight) -> {
            if (weight == null || !Double.isFinite(weight) || weight < 0) {
                throw new ConfigurationException("engine.fallback-weights." + provider + " must be >= 0, got " + weight);
            }
        });
        if (risk.reservationTtl == null || risk.reservationTtl.isNegative() || risk.reservationTtl.isZero()) {
            throw new ConfigurationException("engine.risk.reservation-ttl must be positive");
        }
        if (persistence.stateDir == null || persistence.stateDir.isBlank()) {
            throw new ConfigurationException("engine.persistence.state-dir must not be blank");
        }
        if (persistence.cacheMaxAge == null || persistence.cacheMaxAge.isNegative() || persistence.cacheMaxAge.isZero()) {
            throw new ConfigurationException("engine.persistence.cache-max-age must be positive");
        }
        toGatekeeperConfig();
    }

    public RiskGatekeeperConfig toGatekeeperConfig() {
        return new RiskGatekeeperConfig(risk.maxDrawdown, risk.correlationThreshold, risk.varConfidence,
            risk.maxVarPct, risk.maxExposurePct, risk.maxDataAge, risk.volatilityThreshold,
            risk.minVolatileConfidence);
    }
}
