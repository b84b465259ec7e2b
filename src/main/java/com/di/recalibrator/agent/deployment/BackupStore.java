package com.di.recalibrator.agent.deployment;

import com.di.recalibrator.config.RecalibratorProperties;
import com.di.recalibrator.exception.InfrastructureException;
import com.di.recalibrator.model.ConfigurationBackup;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Timestamped, write-once copies of live configurations under
 * {@code <config-dir>/backups/<horizon>/}. File names are {@code <seq>_<timestamp>.json}, or
 * {@code .absent} when there was nothing to copy; the highest sequence number is the latest.
 */
@Slf4j
@Component
public class BackupStore {

    static final String JSON_SUFFIX = ".json";
    static final String ABSENT_SUFFIX = ".absent";
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'");

    private final Path backupRoot;
    private final AtomicFileWriter writer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public BackupStore(RecalibratorProperties props, AtomicFileWriter writer, ObjectMapper objectMapper, Clock clock) {
        this(Paths.get(props.getStorage().getConfigDir()).resolve("backups"), writer, objectMapper, clock);
    }

    public BackupStore(Path backupRoot, AtomicFileWriter writer, ObjectMapper objectMapper, Clock clock) {
        this.backupRoot = backupRoot;
        this.writer = writer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Copies {@code current} byte for byte and verifies the copy by reading it back.
     *
     * @param current live bytes, or null when the horizon has no configuration yet
     * @throws InfrastructureException if the write or the verification fails; no backup is left behind
     */
    public ConfigurationBackup backup(String horizon, byte[] current, String sourceVersionId) {
        Path dir = backupRoot.resolve(horizon);
        Instant takenAt = clock.instant();
        boolean absent = current == null;
        Path path = null;
        try {
            Files.createDirectories(dir);
            String backupId = String.format("%06d_%s", nextSequence(dir), TS.format(takenAt.atOffset(ZoneOffset.UTC)));
            path = dir.resolve(backupId + (absent ? ABSENT_SUFFIX : JSON_SUFFIX));
            byte[] content = absent ? ("{\"horizon\":\"" + horizon + "\",\"absent\":true}").getBytes(StandardCharsets.UTF_8) : current;
            writer.write(path, content);
            if (!Arrays.equals(content, Files.readAllBytes(path))) {
                Files.deleteIfExists(path);
                throw new InfrastructureException(InfrastructureException.Stage.BACKUP, horizon,
                        "backup " + path + " does not match the live configuration");
            }
            log.info("[BACKUP] {} saved {} (source version {})", horizon, path.getFileName(),
                    absent ? "none" : sourceVersionId);
            return ConfigurationBackup.builder()
                    .backupId(backupId)
                    .horizon(horizon)
                    .takenAt(takenAt)
                    .sourceVersionId(sourceVersionId)
                    .path(path)
                    .absent(absent)
                    .build();
        } catch (IOException e) {
            throw new InfrastructureException(InfrastructureException.Stage.BACKUP, horizon,
                    "cannot write backup " + (path != null ? path : dir), e);
        }
    }

    public Optional<ConfigurationBackup> latest(String horizon) {
        List<ConfigurationBackup> all = list(horizon);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    /** All backups for a horizon, oldest first. */
    public List<ConfigurationBackup> list(String horizon) {
        Path dir = backupRoot.resolve(horizon);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(BackupStore::isBackupFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .map(p -> describe(horizon, p))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new InfrastructureException(InfrastructureException.Stage.ROLLBACK, horizon, "cannot list " + dir, e);
        }
    }

    public byte[] read(ConfigurationBackup backup) {
        try {
            return Files.readAllBytes(backup.getPath());
        } catch (IOException e) {
            throw new InfrastructureException(InfrastructureException.Stage.ROLLBACK, backup.getHorizon(),
                    "cannot read backup " + backup.getPath(), e);
        }
    }

    private ConfigurationBackup describe(String horizon, Path path) {
        String name = path.getFileName().toString();
        boolean absent = name.endsWith(ABSENT_SUFFIX);
        String backupId = name.substring(0, name.length() - (absent ? ABSENT_SUFFIX : JSON_SUFFIX).length());
        Instant takenAt = LocalDateTime.parse(backupId.substring(backupId.indexOf('_') + 1), TS).toInstant(ZoneOffset.UTC);
        String sourceVersionId = null;
        if (!absent) {
            try {
                JsonNode node = objectMapper.readTree(path.toFile());
                sourceVersionId = node.path("versionId").asText(null);
            } catch (IOException e) {
                log.warn("[BACKUP] {} unreadable version in {}: {}", horizon, name, e.getMessage());
            }
        }
        return ConfigurationBackup.builder()
                .backupId(backupId)
                .horizon(horizon)
                .takenAt(takenAt)
                .sourceVersionId(sourceVersionId)
                .path(path)
                .absent(absent)
                .build();
    }

    private static int nextSequence(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(BackupStore::isBackupFile)
                    .map(p -> p.getFileName().toString())
                    .mapToInt(n -> Integer.parseInt(n.substring(0, n.indexOf('_'))))
                    .max()
                    .orElse(0) + 1;
        }
    }

    private static boolean isBackupFile(Path p) {
        String n = p.getFileName().toString();
        return !n.startsWith(".") && n.indexOf('_') > 0 && (n.endsWith(JSON_SUFFIX) || n.endsWith(ABSENT_SUFFIX));
    }
}
