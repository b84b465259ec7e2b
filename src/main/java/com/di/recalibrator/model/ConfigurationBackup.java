package com.di.recalibrator.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Copy of the live configuration taken immediately before a deployment. Never mutated.
 * An {@code absent} backup records that no configuration existed; restoring it removes the
 * live file.
 */
@Value
@Builder
public class ConfigurationBackup {

    String backupId;
    String horizon;
    Instant takenAt;
    String sourceVersionId;
    Path path;
    boolean absent;
}
