package com.di.recalibrator.agent.trigger;

import com.di.recalibrator.model.DriftReport;
import com.di.recalibrator.model.PerformanceSnapshot;
import com.di.recalibrator.model.TriggerReason;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of one trigger evaluation. {@code primaryReason} is the highest-priority condition
 * that fired; {@code reasons} lists all of them.
 */
@Value
@Builder
public class TriggerDecision {

    String horizon;
    boolean triggered;
    TriggerReason primaryReason;
    @Singular
    List<TriggerReason> reasons;
    /** Human-readable explanation of every condition checked. */
    @Singular
    List<String> explanations;
    PerformanceSnapshot snapshot;
    DriftReport drift;

    public String reasonCode() {
        return primaryReason != null ? primaryReason.getCode() : "none";
    }

    public boolean firedOn(TriggerReason reason) {
        return reasons.contains(reason);
    }

    public String explanation() {
        return String.join("; ", explanations);
    }
}
