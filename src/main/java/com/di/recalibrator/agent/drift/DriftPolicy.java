package com.di.recalibrator.agent.drift;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DriftPolicy {

    /** Reference sample: the observations preceding the recent sample. */
    @Builder.Default
    int referenceSize = 90;
    /** Recent sample: the newest observations. */
    @Builder.Default
    int recentSize = 30;
    /** Below this many values in either sample the report is NONE. */
    @Builder.Default
    int minSampleSize = 10;
    @Builder.Default
    double significanceLevel = 0.05;
    @Builder.Default
    double ksHighPValue = 0.01;
    @Builder.Default
    double ksHighStatistic = 0.3;
    @Builder.Default
    double ksMediumPValue = 0.05;
    @Builder.Default
    double ksMediumStatistic = 0.2;
    @Builder.Default
    double psiMedium = 0.10;
    @Builder.Default
    double psiHigh = 0.25;
    @Builder.Default
    int psiBins = 10;
}
