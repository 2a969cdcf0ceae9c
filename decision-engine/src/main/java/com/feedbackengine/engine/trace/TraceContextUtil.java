package com.feedbackengine.engine.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

/**
 * Decision context propagation. Reactor Context carries the decision id, asset and
 * session name inside reactive chains; MDC holds them only for the duration of a
 * single log action.
 *
 * <pre>
 *     return TraceContextUtil.withDecisionContext(votes, DecisionContext.of(decisionId, asset, session));
 * </pre>
 */
public final class TraceContextUtil {

    public static final String DECISION_ID_KEY = "decisionId";
    public static final String ASSET_KEY       = "asset";
    public static final String SESSION_KEY     = "session";

    static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /** Keys identifying one decision; {@code null} parts read as {@code "unknown"}. */
    public record DecisionContext(String decisionId, String assetPair, String session) {

        public DecisionContext {
            decisionId = decisionId == null ? UNKNOWN : decisionId;
            assetPair  = assetPair == null ? UNKNOWN : assetPair;
            session    = session == null ? UNKNOWN : session;
        }

        public static DecisionContext of(String decisionId, String assetPair, String session) {
            return new DecisionContext(decisionId, assetPair, session);
        }
    }

    /** Call at the end of pipeline assembly; {@code contextWrite} propagates upstream. */
    public static <T> Mono<T> withDecisionContext(Mono<T> mono, DecisionContext context) {
        return mono.contextWrite(ctx -> put(ctx, context));
    }

    /** @return the context written by {@link #withDecisionContext}, with {@code "unknown"} for missing keys */
    public static DecisionContext getDecisionContext(ContextView ctx) {
        return new DecisionContext(ctx.getOrDefault(DECISION_ID_KEY, UNKNOWN),
            ctx.getOrDefault(ASSET_KEY, UNKNOWN), ctx.getOrDefault(SESSION_KEY, UNKNOWN));
    }

    public static void withMdc(DecisionContext context, Runnable logAction) {
        MDC.put(DECISION_ID_KEY, context.decisionId());
        MDC.put(ASSET_KEY, context.assetPair());
        MDC.put(SESSION_KEY, context.session());
        try {
            logAction.run();
        } finally {
            MDC.remove(DECISION_ID_KEY);
            MDC.remove(ASSET_KEY);
            MDC.remove(SESSION_KEY);
        }
    }

    private static Context put(Context ctx, DecisionContext context) {
        return ctx.put(DECISION_ID_KEY, context.decisionId())
            .put(ASSET_KEY, context.assetPair())
            .put(SESSION_KEY, context.session());
    }
}
