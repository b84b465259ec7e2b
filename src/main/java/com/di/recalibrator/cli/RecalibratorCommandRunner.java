package com.di.recalibrator.cli;

import com.di.recalibrator.agent.deployment.DeploymentManager;
import com.di.recalibrator.agent.deployment.MonitoringWindow;
import com.di.recalibrator.agent.orchestrator.RecalibrationOrchestrator;
import com.di.recalibrator.agent.orchestrator.RunOutcome;
import com.di.recalibrator.agent.orchestrator.RunStatus;
import com.di.recalibrator.config.HorizonPolicyService;
import com.di.recalibrator.exception.InfrastructureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

/**
 * Command-line entry point. Parses the command, dispatches it and keeps the exit code for
 * {@link org.springframework.boot.SpringApplication#exit}.
 * <p>
 * Exit codes: 0 no action or success, 1 candidate rejected, 2 operational failure or usage error.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "recalibrator.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RecalibratorCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    private static final int DEFAULT_HISTORY_LIMIT = 20;

    private final RecalibrationOrchestrator orchestrator;
    private final DeploymentManager deploymentManager;
    private final HorizonPolicyService policyService;
    private final StatusReporter reporter;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    public RecalibratorCommandRunner(RecalibrationOrchestrator orchestrator,
                                     DeploymentManager deploymentManager,
                                     HorizonPolicyService policyService,
                                     StatusReporter reporter) {
        this(orchestrator, deploymentManager, policyService, reporter, System.out);
    }

    RecalibratorCommandRunner(RecalibrationOrchestrator orchestrator,
                              DeploymentManager deploymentManager,
                              HorizonPolicyService policyService,
                              StatusReporter reporter,
                              PrintStream out) {
        this.orchestrator = orchestrator;
        this.deploymentManager = deploymentManager;
        this.policyService = policyService;
        this.reporter = reporter;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            return usage("no command given");
        }
        Optional<CliCommand> command = CliCommand.fromName(positional.get(0));
        if (command.isEmpty()) {
            return usage("unknown command '" + positional.get(0) + "'");
        }
        try {
            return switch (command.get()) {
                case RUN -> runCommand(args);
                case VALIDATE -> validate(args);
                case ROLLBACK -> rollback(args);
                case STATUS -> status(args);
                case HISTORY -> history(args);
                case REPORT_JOB -> reportJob(args);
            };
        } catch (UsageException e) {
            return usage(e.getMessage());
        } catch (InfrastructureException e) {
            log.error("[CLI] {} failed: {}", command.get().getName(), e.getMessage(), e);
            out.println("failed: " + e.getMessage());
            return RunStatus.FAILED.getExitCode();
        }
    }

    // ------------------------------------------------------------------ //
    // Commands                                                            //
    // ------------------------------------------------------------------ //

    private int runCommand(ApplicationArguments args) {
        boolean dryRun = args.containsOption("dry-run");
        if (args.containsOption("all")) {
            if (args.containsOption("horizon")) {
                throw new UsageException("--all and --horizon are mutually exclusive");
            }
            List<RunOutcome> outcomes = orchestrator.runAll(dryRun);
            outcomes.forEach(o -> reporter.printOutcome(o, out));
            return outcomes.stream().mapToInt(RunOutcome::exitCode).max().orElse(EXIT_OK);
        }
        RunOutcome outcome = orchestrator.run(horizon(args), dryRun);
        reporter.printOutcome(outcome, out);
        return outcome.exitCode();
    }

    private int validate(ApplicationArguments args) {
        RunOutcome outcome = orchestrator.validate(horizon(args));
        reporter.printOutcome(outcome, out);
        return outcome.exitCode();
    }

    private int rollback(ApplicationArguments args) {
        String horizon = horizon(args);
        String reason = option(args, "reason").orElse("operator request");
        deploymentManager.closeExpiredWindow(horizon);
        if (!deploymentManager.rollback(horizon, reason)) {
            out.println(horizon + ": no backup to roll back to");
            return RunStatus.FAILED.getExitCode();
        }
        out.println(horizon + ": rolled back (" + reason + ")");
        return EXIT_OK;
    }

    private int status(ApplicationArguments args) {
        List<String> horizons = args.containsOption("horizon") ? List.of(horizon(args)) : policyService.horizons();
        horizons.forEach(deploymentManager::closeExpiredWindow);
        reporter.printStatus(horizons, out);
        return EXIT_OK;
    }

    private int history(ApplicationArguments args) {
        String horizon = horizon(args);
        int limit = option(args, "limit").map(RecalibratorCommandRunner::parseLimit).orElse(DEFAULT_HISTORY_LIMIT);
        reporter.printHistory(horizon, limit, out);
        return EXIT_OK;
    }

    private int reportJob(ApplicationArguments args) {
        String horizon = horizon(args);
        String outcome = option(args, "outcome")
                .orElseThrow(() -> new UsageException("--outcome=success|failure is required"));
        boolean success;
        if ("success".equalsIgnoreCase(outcome)) {
            success = true;
        } else if ("failure".equalsIgnoreCase(outcome)) {
            success = false;
        } else {
            throw new UsageException("--outcome must be success or failure, got '" + outcome + "'");
        }
        Optional<MonitoringWindow> window = deploymentManager.recordJobOutcome(horizon,
                option(args, "version").orElse(null), success, option(args, "message").orElse(null));
        out.println(horizon + ": " + window
                .map(w -> w.getVersionId() + " " + w.getOutcome().getCode() + " (" + w.getExecutions()
                        + " executions, " + w.getFailures() + " failures)")
                .orElse("no monitoring window"));
        return EXIT_OK;
    }

    // ------------------------------------------------------------------ //
    // Parsing                                                             //
    // ------------------------------------------------------------------ //

    private String horizon(ApplicationArguments args) {
        String horizon = option(args, "horizon").orElseThrow(() -> new UsageException("--horizon=<h> is required"));
        if (!policyService.isKnownHorizon(horizon)) {
            throw new UsageException("unknown horizon '" + horizon + "', configured: " + policyService.horizons());
        }
        return horizon;
    }

    private static Optional<String> option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0).trim());
    }

    private static int parseLimit(String raw) {
        try {
            int limit = Integer.parseInt(raw);
            if (limit <= 0) {
                throw new UsageException("--limit must be positive");
            }
            return limit;
        } catch (NumberFormatException e) {
            throw new UsageException("--limit must be a number, got '" + raw + "'");
        }
    }

    private int usage(String problem) {
        out.println("error: " + problem);
        out.println("usage:");
        for (CliCommand command : CliCommand.values()) {
            out.println("  " + command.getUsage());
        }
        return EXIT_USAGE;
    }

    static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
