package com.di.recalibrator.agent.deployment;

import com.di.recalibrator.config.RecalibratorConfig;
import com.di.recalibrator.exception.InfrastructureException;
import com.di.recalibrator.model.ConfigurationBackup;
import com.di.recalibrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Backup and atomic write Tests")
class BackupStoreTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private BackupStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-01T12:30:45.123Z"));
        store = new BackupStore(tempDir.resolve("backups"), new AtomicFileWriter(), RecalibratorConfig.newObjectMapper(), clock);
    }

    @Test
    @DisplayName("Backups are byte-identical copies named by sequence and timestamp")
    void testBackupIsByteIdentical() {
        byte[] live = "{\n  \"horizon\" : \"7d\",\n  \"versionId\" : \"7d-v1\"\n}".getBytes(StandardCharsets.UTF_8);

        ConfigurationBackup backup = store.backup("7d", live, "7d-v1");

        assertEquals("000001_20261001T123045123Z", backup.getBackupId());
        assertFalse(backup.isAbsent());
        assertArrayEquals(live, store.read(backup));
        ConfigurationBackup listed = store.latest("7d").orElseThrow();
        assertEquals(backup.getBackupId(), listed.getBackupId());
        assertEquals("7d-v1", listed.getSourceVersionId());
        assertEquals(backup.getTakenAt(), listed.getTakenAt());
    }

    @Test
    @DisplayName("No live file produces an absent marker")
    void testAbsentMarker() {
        ConfigurationBackup backup = store.backup("7d", null, null);
        assertTrue(backup.isAbsent());
        assertTrue(backup.getPath().getFileName().toString().endsWith(".absent"));
        assertTrue(store.latest("7d").orElseThrow().isAbsent());
    }

    @Test
    @DisplayName("Latest is the highest sequence, even within the same millisecond")
    void testOrdering() {
        store.backup("7d", null, null);
        store.backup("7d", "{\"versionId\":\"a\"}".getBytes(StandardCharsets.UTF_8), "a");
        clock.advance(Duration.ofSeconds(1));
        store.backup("7d", "{\"versionId\":\"b\"}".getBytes(StandardCharsets.UTF_8), "b");

        List<ConfigurationBackup> all = store.list("7d");
        assertEquals(3, all.size());
        assertEquals(List.of("000001", "000002", "000003"),
                all.stream().map(b -> b.getBackupId().substring(0, 6)).collect(Collectors.toList()));
        assertEquals("b", store.latest("7d").orElseThrow().getSourceVersionId());
        assertTrue(store.list("15d").isEmpty());
    }

    @Test
    @DisplayName("A failed backup write leaves no backup behind")
    void testFailedBackupWrite() throws IOException {
        BackupStore failing = new BackupStore(tempDir.resolve("backups"), new AtomicFileWriter() {
            @Override
            protected void beforeRename(Path temp, Path target) throws IOException {
                throw new IOException("disk full");
            }
        }, RecalibratorConfig.newObjectMapper(), clock);

        InfrastructureException e = assertThrows(InfrastructureException.class,
                () -> failing.backup("7d", "{}".getBytes(StandardCharsets.UTF_8), "v"));

        assertEquals(InfrastructureException.Stage.BACKUP, e.getStage());
        assertTrue(store.list("7d").isEmpty());
        try (Stream<Path> files = Files.list(tempDir.resolve("backups/7d"))) {
            assertEquals(0, files.count());
        }
    }

    @Test
    @DisplayName("Atomic write replaces existing content in one step")
    void testAtomicWriteReplaces() throws IOException {
        AtomicFileWriter writer = new AtomicFileWriter();
        Path target = tempDir.resolve("config/7d.json");
        writer.write(target, "old".getBytes(StandardCharsets.UTF_8));
        writer.write(target, "new".getBytes(StandardCharsets.UTF_8));

        assertEquals("new", Files.readString(target));
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertEquals(List.of(target), files.collect(Collectors.toList()));
        }
    }
}
