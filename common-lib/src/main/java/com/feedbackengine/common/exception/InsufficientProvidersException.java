package com.feedbackengine.common.exception;

/**
 * Raised when no usable provider vote survives any of the four aggregation tiers.
 * Always propagated to the caller, never converted into a HOLD decision.
 */
public class InsufficientProvidersException extends EngineException {

    private final String assetPair;
    private final int receivedVotes;

    public InsufficientProvidersException(String assetPair, int receivedVotes) {
        super("EnsembleAggregator", "No valid provider votes for " + assetPair
            + " (received=" + receivedVotes + ", valid=0)");
        this.assetPair = assetPair;
        this.receivedVotes = receivedVotes;
    }

    public String getAssetPair() {
        return assetPair;
    }

    public int getReceivedVotes() {
        return receivedVotes;
    }
}
