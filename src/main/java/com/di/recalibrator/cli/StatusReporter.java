package com.di.recalibrator.cli;

import com.di.recalibrator.agent.deployment.ConfigurationRepository;
import com.di.recalibrator.agent.deployment.DeploymentManager;
import com.di.recalibrator.agent.deployment.MonitoringWindow;
import com.di.recalibrator.agent.history.HistoryStore;
import com.di.recalibrator.agent.orchestrator.RunOutcome;
import com.di.recalibrator.model.ActiveConfiguration;
import com.di.recalibrator.model.HistoryEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

/**
 * Renders operator output: per-horizon status, history rows and run outcomes.
 */
@Component
@RequiredArgsConstructor
public class StatusReporter {

    private final ConfigurationRepository repository;
    private final DeploymentManager deploymentManager;
    private final HistoryStore historyStore;
    private final ObjectMapper objectMapper;

    public void printStatus(List<String> horizons, PrintStream out) {
        for (String horizon : horizons) {
            out.println(statusLine(horizon));
        }
    }

    String statusLine(String horizon) {
        StringBuilder line = new StringBuilder(horizon);
        Optional<ActiveConfiguration> active = repository.read(horizon);
        if (active.isPresent()) {
            line.append("  version=").append(active.get().getVersionId())
                    .append("  params=").append(active.get().getParameters().describe())
                    .append("  promotedAt=").append(active.get().getPromotedAt());
        } else {
            line.append("  version=none");
        }
        line.append("  state=").append(deploymentManager.state(horizon));
        deploymentManager.monitoringWindow(horizon)
                .filter(MonitoringWindow::isOpen)
                .ifPresent(w -> line.append("  monitoring=")
                        .append(w.getExecutions()).append('/').append(w.getMaxExecutions()).append(" executions, ")
                        .append(w.getFailures()).append('/').append(w.getFailureThreshold()).append(" failures, until ")
                        .append(w.getDeadline()));
        historyStore.latestAttempt(horizon).ifPresent(e -> line.append("  lastAttempt=")
                .append(e.getTimestamp()).append(' ').append(e.getDecision()));
        return line.toString();
    }

    public void printHistory(String horizon, int limit, PrintStream out) {
        List<HistoryEntry> entries = historyStore.recent(horizon, limit);
        if (entries.isEmpty()) {
            out.println(horizon + ": no history");
            return;
        }
        for (HistoryEntry entry : entries) {
            out.println(toJson(entry));
        }
    }

    public void printOutcome(RunOutcome outcome, PrintStream out) {
        StringBuilder line = new StringBuilder()
                .append(outcome.getHorizon()).append(": ").append(outcome.getStatus());
        if (outcome.isDryRun()) {
            line.append(" (dry run)");
        }
        if (outcome.getMessage() != null) {
            line.append(" - ").append(outcome.getMessage());
        }
        out.println(line);
        if (outcome.getValidation() != null) {
            out.println("  validation: " + outcome.getValidation().summary());
        }
        if (outcome.getOptimization() != null && !outcome.getOptimization().getSkipped().isEmpty()) {
            out.println("  skipped: " + outcome.getOptimization().getSkipped().size() + " candidate(s)");
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render " + value.getClass().getSimpleName(), e);
        }
    }
}
