package com.di.recalibrator.agent.deployment;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeploymentResult {

    String horizon;
    /** True when this call changed the live configuration. */
    boolean deployed;
    /** The candidate was already live; nothing was written. */
    boolean alreadyActive;
    String versionId;
    String previousVersionId;
    String backupId;
}
