package com.di.recalibrator.agent.deployment;

import com.di.recalibrator.config.RecalibratorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Commits each configuration change in the git repository that contains the config directory.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "recalibrator.audit.git-enabled", havingValue = "true")
public class GitAuditMirror implements AuditMirror {

    private static final long TIMEOUT_SECONDS = 30;

    private final String git;

    public GitAuditMirror(RecalibratorProperties props) {
        this.git = props.getAudit().getGitExecutable();
    }

    @Override
    public void record(String horizon, Path configFile, String message) {
        Path dir = configFile.toAbsolutePath().getParent();
        String file = configFile.getFileName().toString();
        try {
            run(dir, List.of(git, "add", "-A", "--", file));
            run(dir, List.of(git, "commit", "-m", message, "--", file));
            log.info("[AUDIT] {} committed {}: {}", horizon, file, message);
        } catch (IOException e) {
            log.warn("[AUDIT] {} git mirror failed for {}: {}", horizon, file, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[AUDIT] {} interrupted while committing {}", horizon, file);
        }
    }

    private static void run(Path dir, List<String> command) throws IOException, InterruptedException {
        Path output = Files.createTempFile("git-audit-", ".log");
        try {
            Process process = new ProcessBuilder(command)
                    .directory(dir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException(String.join(" ", command) + " timed out");
            }
            if (process.exitValue() != 0) {
                String text = Files.readString(output, StandardCharsets.UTF_8).trim();
                throw new IOException(String.join(" ", command) + " exited " + process.exitValue() + ": " + text);
            }
        } finally {
            Files.deleteIfExists(output);
        }
    }
}
