package com.di.recalibrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single binding for all recalibration configuration. Values under {@code recalibrator.*} are
 * the defaults for every horizon; {@code recalibrator.overrides.<horizon>.*} replaces any of them
 * for one horizon.
 *
 * <pre>
 * recalibrator:
 *   policy-version: 2026-10-01
 *   horizons: 7d,15d,30d,90d
 *   storage:
 *     config-dir: ./state/config
 *   trigger:
 *     degradation-threshold: 0.15
 *     time-ceiling: 14d
 *   overrides:
 *     90d:
 *       context-lengths: 365,540,730
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "recalibrator")
public class RecalibratorProperties {

    /** Recorded on each history entry so decisions can be traced to the thresholds in force. */
    @NotBlank
    private String policyVersion = "1";

    /** Horizons handled by {@code run --all} and {@code status}. */
    @NotEmpty
    private List<String> horizons = new ArrayList<>(List.of("7d", "15d", "30d", "90d"));

    /** Worker threads for {@code run --all}. */
    @Min(1)
    private int runAllParallelism = 4;

    @Valid
    private Storage storage = new Storage();
    @Valid
    private Locking locking = new Locking();
    @Valid
    private Trigger trigger = new Trigger();
    @Valid
    private Drift drift = new Drift();
    @Valid
    private Optimizer optimizer = new Optimizer();
    @Valid
    private Validation validation = new Validation();
    @Valid
    private Monitoring monitoring = new Monitoring();
    @Valid
    private Backtest backtest = new Backtest();
    @Valid
    private Audit audit = new Audit();

    /** Per-horizon overrides, keyed by horizon name. */
    private Map<String, HorizonOverrides> overrides = new LinkedHashMap<>();

    // ------------------------------------------------------------------ //
    // Storage and locking                                                 //
    // ------------------------------------------------------------------ //

    @Data
    public static class Storage {
        /** Live configuration files, one {@code <horizon>.json} each; backups under {@code backups/}. */
        @NotBlank
        private String configDir = "./state/config";
        /** Append-only history, one {@code <horizon>.jsonl} each. */
        @NotBlank
        private String historyDir = "./state/history";
        /** Lock files and monitoring windows. */
        @NotBlank
        private String stateDir = "./state/run";
        /** Observation files written by the forecast jobs, one directory per horizon. */
        @NotBlank
        private String dataDir = "./data";
        /** {@code jsonl} (default) or {@code memory}. */
        private String historyStore = "jsonl";
    }

    @Data
    public static class Locking {
        /** How long short critical sections (deploy write, job reports, rollback) wait for the config lock. */
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private Duration retryInterval = Duration.ofMillis(200);
    }

    // ------------------------------------------------------------------ //
    // Trigger and drift                                                   //
    // ------------------------------------------------------------------ //

    @Data
    public static class Trigger {
        @DecimalMin("0.0")
        private double degradationThreshold = 0.15;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double significanceLevel = 0.05;
        private Duration timeCeiling = Duration.ofDays(14);
        private Duration coolDown = Duration.ofDays(14);
        private Duration shortWindow = Duration.ofDays(14);
        private Duration baselineWindow = Duration.ofDays(60);
        @Min(1)
        private int minShortObservations = 7;
        @Min(1)
        private int minBaselineObservations = 20;
    }

    @Data
    public static class Drift {
        @Min(2)
        private int referenceSize = 90;
        @Min(2)
        private int recentSize = 30;
        @Min(2)
        private int minSampleSize = 10;
        private double ksHighPValue = 0.01;
        private double ksHighStatistic = 0.3;
        private double ksMediumPValue = 0.05;
        private double ksMediumStatistic = 0.2;
        private double psiMedium = 0.10;
        private double psiHigh = 0.25;
        @Min(2)
        private int psiBins = 10;
    }

    // ------------------------------------------------------------------ //
    // Optimizer, validation, monitoring                                   //
    // ------------------------------------------------------------------ //

    @Data
    public static class Optimizer {
        @NotEmpty
        private List<Integer> contextLengths = new ArrayList<>(List.of(90, 180, 365));
        @NotEmpty
        private List<Integer> numSamples = new ArrayList<>(List.of(50, 100, 200));
        @NotEmpty
        private List<Double> temperatures = new ArrayList<>(List.of(0.8, 1.0, 1.2));
        @Min(1)
        private int backtestWindow = 30;
        private Duration maxWallClock = Duration.ofMinutes(30);
        private Duration estimatedEvaluationTime = Duration.ofSeconds(30);
    }

    @Data
    public static class Validation {
        private double minPrimaryImprovementPct = 5.0;
        private double minSecondaryImprovementPct = 3.0;
        private double maxDispersionIncreasePct = 10.0;
        private double maxLatencyIncreasePct = 50.0;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minIntervalCoverage = 0.90;
        @DecimalMin("0.0")
        private double maxAbsBias = 5.0;
        /** Re-run active and candidate on identical data and attach both to the report. */
        private boolean shadowComparison = false;
    }

    @Data
    public static class Monitoring {
        private Duration window = Duration.ofMinutes(60);
        @Min(1)
        private int maxExecutions = 5;
        @Min(1)
        private int failureThreshold = 3;
    }

    // ------------------------------------------------------------------ //
    // External collaborators                                              //
    // ------------------------------------------------------------------ //

    @Data
    public static class Backtest {
        /** Model-serving command; receives a JSON request on stdin and prints a forecast trace. */
        private String command = "";
        private Duration timeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Audit {
        /** Commit every configuration change in the config directory's git repository. */
        private boolean gitEnabled = false;
        private String gitExecutable = "git";
    }

    /**
     * Nullable per-horizon values; null keeps the default.
     */
    @Data
    public static class HorizonOverrides {
        private Double degradationThreshold;
        private Duration timeCeiling;
        private Duration coolDown;
        private List<Integer> contextLengths;
        private List<Integer> numSamples;
        private List<Double> temperatures;
        private Integer backtestWindow;
        private Duration maxWallClock;
        private Double minIntervalCoverage;
        private Double maxAbsBias;
        private Boolean shadowComparison;
        private Duration monitoringWindow;
        private Integer monitoringExecutions;
        private Integer failureThreshold;
    }
}
