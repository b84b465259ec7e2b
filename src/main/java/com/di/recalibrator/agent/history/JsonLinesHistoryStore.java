package com.di.recalibrator.agent.history;

import com.di.recalibrator.config.RecalibratorProperties;
import com.di.recalibrator.exception.InfrastructureException;
import com.di.recalibrator.model.HistoryEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * History as one JSON Lines file per horizon ({@code <history-dir>/<horizon>.jsonl}).
 * <p>
 * An entry is committed once its terminating newline is on disk: appends are fsynced, and a
 * trailing line without a newline (an interrupted append) is ignored by readers and truncated
 * by the next writer. Existing lines are never rewritten. Appends hold an exclusive lock on the
 * file so that separate processes writing the same horizon do not interleave.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "recalibrator.storage.history-store", havingValue = "jsonl", matchIfMissing = true)
public class JsonLinesHistoryStore implements HistoryStore {

    private static final byte NEWLINE = '\n';
    // FileLock is held per JVM, so writers in this process queue on the path first
    private static final Map<Path, Object> APPEND_LOCKS = new ConcurrentHashMap<>();

    private final Path historyDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonLinesHistoryStore(RecalibratorProperties props, ObjectMapper objectMapper) {
        this(Paths.get(props.getStorage().getHistoryDir()), objectMapper);
    }

    public JsonLinesHistoryStore(Path historyDir, ObjectMapper objectMapper) {
        this.historyDir = historyDir;
        this.objectMapper = objectMapper;
    }

    public Path fileFor(String horizon) {
        return historyDir.resolve(horizon + ".jsonl");
    }

    @Override
    public void append(HistoryEntry entry) {
        String horizon = entry.getHorizon();
        byte[] line;
        try {
            line = objectMapper.writeValueAsBytes(entry);
        } catch (JsonProcessingException e) {
            throw new InfrastructureException(InfrastructureException.Stage.HISTORY_APPEND, horizon,
                    "cannot serialize history entry", e);
        }
        Path file = fileFor(horizon);
        synchronized (APPEND_LOCKS.computeIfAbsent(file.toAbsolutePath().normalize(), f -> new Object())) {
            try {
                Files.createDirectories(historyDir);
                try (FileChannel channel = FileChannel.open(file,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.READ);
                     FileLock ignored = channel.lock()) {
                    long committedEnd = committedLength(channel);
                    if (committedEnd < channel.size()) {
                        log.warn("[HISTORY] {}: dropping {} bytes of an interrupted append",
                                file, channel.size() - committedEnd);
                        channel.truncate(committedEnd);
                    }
                    ByteBuffer buffer = ByteBuffer.allocate(line.length + 1);
                    buffer.put(line).put(NEWLINE).flip();
                    channel.position(committedEnd);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(true);
                }
            } catch (IOException e) {
                throw new InfrastructureException(InfrastructureException.Stage.HISTORY_APPEND, horizon,
                        "cannot append to " + file, e);
            }
        }
        log.debug("[HISTORY] {} appended {} {}", horizon, entry.getEventType(), entry.getEntryId());
    }

    @Override
    public List<HistoryEntry> entries(String horizon) {
        Path file = fileFor(horizon);
        if (!Files.exists(file)) {
            return List.of();
        }
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new InfrastructureException(InfrastructureException.Stage.HISTORY_READ, horizon,
                    "cannot read " + file, e);
        }
        List<HistoryEntry> entries = new ArrayList<>();
        int lineStart = 0;
        int lineNumber = 0;
        for (int i = 0; i < content.length; i++) {
            if (content[i] != NEWLINE) {
                continue;
            }
            lineNumber++;
            String line = new String(content, lineStart, i - lineStart, StandardCharsets.UTF_8).trim();
            lineStart = i + 1;
            if (line.isEmpty()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, HistoryEntry.class));
            } catch (JsonProcessingException e) {
                throw new InfrastructureException(InfrastructureException.Stage.HISTORY_READ, horizon,
                        "corrupt entry at " + file + ":" + lineNumber, e);
            }
        }
        return entries;
    }

    /** Offset just past the last newline; bytes beyond it were never committed. */
    private static long committedLength(FileChannel channel) throws IOException {
        long size = channel.size();
        if (size == 0) {
            return 0;
        }
        ByteBuffer one = ByteBuffer.allocate(1);
        for (long pos = size - 1; pos >= 0; pos--) {
            one.clear();
            channel.read(one, pos);
            if (one.get(0) == NEWLINE) {
                return pos + 1;
            }
        }
        return 0;
    }
}
