package com.feedbackengine.common.exception;

public class ReadOnlyMemoryException extends EngineException {

    public ReadOnlyMemoryException(String tradeId) {
        super("PortfolioMemory", "Memory is read-only; refusing to record outcome tradeId=" + tradeId);
    }
}
