package com.di.recalibrator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;

/**
 * A configuration proposed by the optimizer, scored over a backtest window. Immutable; it is
 * either discarded or promoted.
 */
@Value
@Builder
@Jacksonized
public class CandidateConfiguration {

    String horizon;
    HyperParameters parameters;
    MetricsBundle metrics;
    /** Stable hash of horizon and parameters; equal fingerprints mean the same configuration. */
    String fingerprint;
    Instant evaluatedAt;

    public static CandidateConfiguration of(String horizon, HyperParameters parameters,
                                            MetricsBundle metrics, Instant evaluatedAt) {
        return CandidateConfiguration.builder()
                .horizon(horizon)
                .parameters(parameters)
                .metrics(metrics)
                .fingerprint(fingerprintOf(horizon, parameters))
                .evaluatedAt(evaluatedAt)
                .build();
    }

    public static String fingerprintOf(String horizon, HyperParameters p) {
        String canonical = String.format(Locale.ROOT, "%s|%d|%d|%.6f",
                horizon, p.getContextLength(), p.getNumSamples(), p.getTemperature());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
