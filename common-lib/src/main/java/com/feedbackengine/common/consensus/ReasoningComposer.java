package com.feedbackengine.common.consensus;

import com.feedbackengine.common.model.ProviderVote;
import com.feedbackengine.common.model.TradeAction;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the human-readable explanation attached to a draft: supporters first
 * (rationale cut at 150 chars), then dissenters (cut at 100 chars).
 */
public final class ReasoningComposer {

    static final int SUPPORTER_LIMIT = 150;
    static final int DISSENTER_LIMIT = 100;

    private ReasoningComposer() {}

    public static String compose(TradeAction action, String strategy, List<ProviderVote> votes) {
        StringBuilder sb = new StringBuilder();
        sb.append(action).append(" via ").append(strategy)
          .append(" (").append(votes.size()).append(" votes)");

        String supporters = votes.stream()
            .filter(v -> v.action() == action)
            .map(v -> line(v, SUPPORTER_LIMIT))
            .collect(Collectors.joining("; "));
        String dissenters = votes.stream()
            .filter(v -> v.action() != action)
            .map(v -> line(v, DISSENTER_LIMIT))
            .collect(Collectors.joining("; "));

        if (!supporters.isEmpty()) sb.append(". Supporting: ").append(supporters);
        if (!dissenters.isEmpty()) sb.append(". Dissenting: ").append(dissenters);
        return sb.toString();
    }

    private static String line(ProviderVote vote, int limit) {
        String rationale = vote.rationale() == null ? "" : vote.rationale().strip();
        if (rationale.length() > limit) rationale = rationale.substring(0, limit) + "...";
        return String.format("[%s %s@%.0f] %s", vote.providerId(), vote.action(), vote.confidence(), rationale);
    }
}
