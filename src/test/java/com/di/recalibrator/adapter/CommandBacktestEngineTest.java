package com.di.recalibrator.adapter;

import com.di.recalibrator.agent.backtest.SkipReason;
import com.di.recalibrator.config.RecalibratorConfig;
import com.di.recalibrator.config.RecalibratorProperties;
import com.di.recalibrator.exception.BacktestException;
import com.di.recalibrator.model.ForecastTrace;
import com.di.recalibrator.model.HyperParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CommandBacktestEngine Tests")
class CommandBacktestEngineTest {

    private static final HyperParameters PARAMS = HyperParameters.builder()
            .contextLength(90).numSamples(100).temperature(1.0).build();

    @TempDir
    Path tempDir;

    // ============================================================================
    // Command parsing
    // ============================================================================

    @Test
    @DisplayName("Commands split on whitespace and keep double-quoted arguments together")
    void testSplitCommand() {
        assertEquals(List.of("python", "-m", "forecaster.backtest"),
                CommandBacktestEngine.splitCommand("  python -m   forecaster.backtest "));
        assertEquals(List.of("run", "--model", "chronos small", "--fast"),
                CommandBacktestEngine.splitCommand("run --model \"chronos small\" --fast"));
        assertTrue(CommandBacktestEngine.splitCommand("").isEmpty());
        assertTrue(CommandBacktestEngine.splitCommand(null).isEmpty());
    }

    @Test
    @DisplayName("An unconfigured command fails the point instead of the run")
    void testUnconfiguredCommand() {
        CommandBacktestEngine engine = engine("");

        BacktestException e = assertThrows(BacktestException.class,
                () -> engine.backtest("7d", PARAMS, List.of(1.0, 2.0), 1));
        assertEquals(SkipReason.BACKTEST_FAILED, e.getReason());
    }

    // ============================================================================
    // External process
    // ============================================================================

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("Reads the trace the process prints on stdout")
    void testReadsTraceFromProcess() throws Exception {
        Path script = script("backtest.sh", """
                cat > /dev/null
                echo '{"points":[{"actual":100.0,"predicted":98.0,"lower":90.0,"upper":110.0}],"latencyMs":12.5}'
                """);

        ForecastTrace trace = engine("sh " + script).backtest("7d", PARAMS, List.of(1.0, 2.0), 1);

        assertEquals(1, trace.getPoints().size());
        assertEquals(98.0, trace.getPoints().get(0).getPredicted(), 1e-9);
        assertEquals(12.5, trace.getLatencyMs(), 1e-9);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("A non-zero exit fails the point with the exit code")
    void testNonZeroExit() throws Exception {
        Path script = script("failing.sh", """
                cat > /dev/null
                exit 3
                """);

        BacktestException e = assertThrows(BacktestException.class,
                () -> engine("sh " + script).backtest("7d", PARAMS, List.of(1.0), 1));
        assertTrue(e.getMessage().contains("exited with 3"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("A process that outlives the timeout is killed and its late trace ignored")
    void testTimeoutCutsOffSlowProcess() throws Exception {
        Path script = script("slow.sh", """
                cat > /dev/null
                sleep 4
                echo '{"points":[{"actual":100.0,"predicted":98.0,"lower":90.0,"upper":110.0}],"latencyMs":12.5}'
                """);
        CommandBacktestEngine engine = engine("sh " + script, Duration.ofMillis(500));

        long start = System.nanoTime();
        BacktestException e = assertThrows(BacktestException.class,
                () -> engine.backtest("7d", PARAMS, List.of(1.0), 1));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(SkipReason.BACKTEST_FAILED, e.getReason());
        assertTrue(e.getMessage().contains("exceeded"), e.getMessage());
        assertTrue(elapsedMs < 3000, "took " + elapsedMs + "ms");
    }

    private CommandBacktestEngine engine(String command) {
        return engine(command, Duration.ofSeconds(30));
    }

    private CommandBacktestEngine engine(String command, Duration timeout) {
        RecalibratorProperties props = new RecalibratorProperties();
        props.getBacktest().setCommand(command);
        props.getBacktest().setTimeout(timeout);
        return new CommandBacktestEngine(props, RecalibratorConfig.newObjectMapper());
    }

    private Path script(String name, String body) throws Exception {
        return Files.writeString(tempDir.resolve(name), body);
    }
}
