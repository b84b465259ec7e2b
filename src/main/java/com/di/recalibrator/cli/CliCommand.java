package com.di.recalibrator.cli;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operator commands. The first non-option argument names the command.
 */
public enum CliCommand {
    RUN("run", "run --horizon=<h> | --all [--dry-run]"),
    VALIDATE("validate", "validate --horizon=<h>"),
    ROLLBACK("rollback", "rollback --horizon=<h> [--reason=<text>]"),
    STATUS("status", "status [--horizon=<h>]"),
    HISTORY("history", "history --horizon=<h> [--limit=<n>]"),
    REPORT_JOB("report-job", "report-job --horizon=<h> --outcome=success|failure [--version=<id>] [--message=<text>]");

    private final String name;
    private final String usage;

    CliCommand(String name, String usage) {
        this.name = name;
        this.usage = usage;
    }

    public String getName() {
        return name;
    }

    public String getUsage() {
        return usage;
    }

    public static Optional<CliCommand> fromName(String name) {
        return Arrays.stream(values()).filter(c -> c.name.equalsIgnoreCase(name)).findFirst();
    }
}
