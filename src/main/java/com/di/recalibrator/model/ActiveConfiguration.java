package com.di.recalibrator.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * The configuration forecast jobs read for one horizon. Exactly one exists per horizon and only
 * the deployment manager writes it.
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder(alphabetic = true)
public class ActiveConfiguration {

    public static final int SCHEMA_VERSION = 1;

    int schemaVersion;
    String horizon;
    String versionId;
    HyperParameters parameters;
    /** Metrics recorded when this configuration was promoted; the validator baseline. */
    MetricsBundle metrics;
    Instant promotedAt;
    String candidateFingerprint;
}
