package com.di.recalibrator.agent.deployment;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Used when recalibrator.audit.git-enabled=false (the default).
 */
@Component
@ConditionalOnProperty(name = "recalibrator.audit.git-enabled", havingValue = "false", matchIfMissing = true)
public class NoOpAuditMirror implements AuditMirror {

    @Override
    public void record(String horizon, Path configFile, String message) {
        // no-op
    }
}
