package com.di.recalibrator.agent.deployment;

import java.nio.file.Path;

/**
 * Optional version-controlled record of configuration changes. The history store stays the
 * authoritative record; a mirror failure never undoes a change.
 */
public interface AuditMirror {

    void record(String horizon, Path configFile, String message);
}
