package com.feedbackengine.engine.provider;

import com.feedbackengine.common.model.Decision;
import com.feedbackengine.common.model.ExecutionResult;

/** Broker or simulator that turns an approved decision into a fill. */
public interface ExecutionGateway {

    ExecutionResult execute(Decision decision);
}
