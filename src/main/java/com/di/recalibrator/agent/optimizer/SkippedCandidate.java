package com.di.recalibrator.agent.optimizer;

import com.di.recalibrator.agent.backtest.SkipReason;
import com.di.recalibrator.model.HyperParameters;
import lombok.Value;

@Value
public class SkippedCandidate {
    HyperParameters parameters;
    SkipReason reason;
    String message;
}
