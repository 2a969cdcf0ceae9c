package com.feedbackengine.engine.provider;

import com.feedbackengine.common.model.MarketSnapshot;
import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.engine.logger.DecisionFlowLogger;
import com.feedbackengine.engine.trace.TraceContextUtil;
import com.feedbackengine.engine.trace.TraceContextUtil.DecisionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;

/**
 * Fans a snapshot out to every registered {@link DecisionProvider} in parallel.
 *
 * <p>Each provider call runs on {@code boundedElastic} under one shared timeout.
 * A provider that throws, times out or abstains contributes no vote; the pool
 * never fails because of a single provider. Vote order is completion order;
 * the aggregator imposes priority order itself.
 */
public class ProviderPool {

    private static final Logger log = LoggerFactory.getLogger(ProviderPool.class);

    private final List<DecisionProvider> providers;
    private final Duration timeout;
    private final DecisionFlowLogger flowLogger;

    public ProviderPool(List<DecisionProvider> providers, Duration timeout, DecisionFlowLogger flowLogger) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("provider timeout must be positive, got " + timeout);
        }
        this.providers  = List.copyOf(providers);
        this.timeout    = timeout;
        this.flowLogger = flowLogger;
    }

    public List<String> providerIds() {
        return providers.stream().map(DecisionProvider::providerId).toList();
    }

    public Duration timeout() {
        return timeout;
    }

    public Mono<List<ProviderVote>> collectVotes(MarketSnapshot snapshot, DecisionContext context) {
        Mono<List<ProviderVote>> pipeline = Flux.fromIterable(providers)
            .flatMap(provider -> callProvider(provider, snapshot))
            .collectList()
            .doOnEach(flowLogger.stage(DecisionFlowLogger.VOTES_COLLECTED));
        return TraceContextUtil.withDecisionContext(pipeline, context);
    }

    /** Blocking bridge for the synchronous pipeline; never waits longer than the timeout plus a grace period. */
    public List<ProviderVote> collectVotesBlocking(MarketSnapshot snapshot, DecisionContext context) {
        List<ProviderVote> votes = collectVotes(snapshot, context).block(timeout.plusSeconds(1));
        return votes == null ? List.of() : votes;
    }

    private Mono<ProviderVote> callProvider(DecisionProvider provider, MarketSnapshot snapshot) {
        return Mono.fromCallable(() -> {
                long start = System.nanoTime();
                ProviderVote vote = provider.decide(snapshot);
                return vote == null ? null : vote.withLatency(Duration.ofNanos(System.nanoTime() - start));
            })
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .doOnSuccess(vote -> {
                if (vote != null) {
                    log.debug("[ProviderPool] Vote received. provider={} asset={} action={} confidence={} latencyMs={}",
                        provider.providerId(), snapshot.assetPair(), vote.action(), vote.confidence(),
                        vote.latency() != null ? vote.latency().toMillis() : null);
                }
            })
            .onErrorResume(e -> {
                log.warn("[ProviderPool] Provider dropped. provider={} asset={} error={}",
                    provider.providerId(), snapshot.assetPair(), e.toString());
                return Mono.empty();
            });
    }
}
