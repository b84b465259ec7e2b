package com.di.recalibrator.adapter;

import com.di.recalibrator.agent.backtest.SkipReason;
import com.di.recalibrator.config.RecalibratorProperties;
import com.di.recalibrator.exception.BacktestException;
import com.di.recalibrator.model.ForecastTrace;
import com.di.recalibrator.model.HyperParameters;
import com.di.recalibrator.port.BacktestEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Calls the model-serving backtest as an external process. The request is fed to the
 * process's stdin as JSON; it must print a {@link ForecastTrace} as JSON on stdout and exit 0.
 * <pre>
 * recalibrator:
 *   backtest:
 *     command: python -m forecaster.backtest
 *     timeout: 5m
 * </pre>
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "recalibrator.backtest.engine", havingValue = "command", matchIfMissing = true)
public class CommandBacktestEngine implements BacktestEngine {

    private final List<String> command;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public CommandBacktestEngine(RecalibratorProperties props, ObjectMapper objectMapper) {
        this.command = splitCommand(props.getBacktest().getCommand());
        this.timeout = props.getBacktest().getTimeout();
        this.objectMapper = objectMapper;
    }

    @Value
    @Builder
    static class BacktestRequest {
        String horizon;
        HyperParameters parameters;
        List<Double> series;
        int window;
    }

    @Override
    public ForecastTrace backtest(String horizon, HyperParameters parameters, List<Double> series, int window) {
        if (command.isEmpty()) {
            throw new BacktestException(SkipReason.BACKTEST_FAILED, "recalibrator.backtest.command is not configured");
        }
        BacktestRequest request = BacktestRequest.builder()
                .horizon(horizon)
                .parameters(parameters)
                .series(series)
                .window(window)
                .build();
        Path requestFile = null;
        Path responseFile = null;
        Process process = null;
        try {
            requestFile = Files.createTempFile("backtest-", ".request.json");
            responseFile = Files.createTempFile("backtest-", ".response.json");
            objectMapper.writeValue(requestFile.toFile(), request);
            long start = System.nanoTime();
            try {
                process = new ProcessBuilder(command)
                        .redirectInput(requestFile.toFile())
                        .redirectOutput(responseFile.toFile())
                        .redirectError(ProcessBuilder.Redirect.INHERIT)
                        .start();
            } catch (IOException e) {
                throw new BacktestException(SkipReason.BACKTEST_FAILED, "cannot start " + command, e);
            }
            // output goes to a file so a child that never closes stdout cannot outlive the timeout
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new BacktestException(SkipReason.BACKTEST_FAILED, "backtest exceeded " + timeout);
            }
            if (process.exitValue() != 0) {
                throw new BacktestException(SkipReason.BACKTEST_FAILED, "backtest exited with " + process.exitValue());
            }
            ForecastTrace trace = objectMapper.readValue(responseFile.toFile(), ForecastTrace.class);
            if (trace.getLatencyMs() <= 0 && trace.getPoints() != null && !trace.getPoints().isEmpty()) {
                double perPoint = (System.nanoTime() - start) / 1_000_000.0 / trace.getPoints().size();
                trace = trace.toBuilder().latencyMs(perPoint).build();
            }
            log.debug("[BACKTEST] {} {} returned {} points", horizon, parameters.describe(),
                    trace.getPoints() == null ? 0 : trace.getPoints().size());
            return trace;
        } catch (IOException e) {
            destroy(process);
            throw new BacktestException(SkipReason.BACKTEST_FAILED, "backtest I/O failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            destroy(process);
            Thread.currentThread().interrupt();
            throw new BacktestException(SkipReason.BACKTEST_FAILED, "interrupted while waiting for backtest", e);
        } finally {
            deleteQuietly(requestFile);
            deleteQuietly(responseFile);
        }
    }

    private static void destroy(Process process) {
        if (process != null) {
            process.destroyForcibly();
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[BACKTEST] cannot delete temp file {}: {}", file, e.getMessage());
        }
    }

    static List<String> splitCommand(String cmd) {
        List<String> out = new ArrayList<>();
        if (cmd == null) {
            return out;
        }
        boolean inQuote = false;
        StringBuilder cur = new StringBuilder();
        for (int i = 0; i < cmd.length(); i++) {
            char c = cmd.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
            } else if (Character.isWhitespace(c) && !inQuote) {
                if (cur.length() > 0) {
                    out.add(cur.toString());
                    cur.setLength(0);
                }
            } else {
                cur.append(c);
            }
        }
        if (cur.length() > 0) {
            out.add(cur.toString());
        }
        return out;
    }
}
