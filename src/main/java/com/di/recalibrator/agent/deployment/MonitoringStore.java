package com.di.recalibrator.agent.deployment;

import com.di.recalibrator.config.RecalibratorProperties;
import com.di.recalibrator.exception.InfrastructureException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * The latest monitoring window per horizon, at {@code <state-dir>/monitoring/<horizon>.json}.
 */
@Component
public class MonitoringStore {

    private final Path dir;
    private final ObjectMapper objectMapper;
    private final AtomicFileWriter writer;

    @Autowired
    public MonitoringStore(RecalibratorProperties props, ObjectMapper objectMapper, AtomicFileWriter writer) {
        this(Paths.get(props.getStorage().getStateDir()).resolve("monitoring"), objectMapper, writer);
    }

    public MonitoringStore(Path dir, ObjectMapper objectMapper, AtomicFileWriter writer) {
        this.dir = dir;
        this.objectMapper = objectMapper;
        this.writer = writer;
    }

    public Optional<MonitoringWindow> read(String horizon) {
        Path file = dir.resolve(horizon + ".json");
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), MonitoringWindow.class));
        } catch (IOException e) {
            throw new InfrastructureException(InfrastructureException.Stage.MONITORING, horizon, "cannot read " + file, e);
        }
    }

    public boolean isOpen(String horizon) {
        return read(horizon).map(MonitoringWindow::isOpen).orElse(false);
    }

    public void write(MonitoringWindow window) {
        Path file = dir.resolve(window.getHorizon() + ".json");
        try {
            writer.write(file, objectMapper.writeValueAsBytes(window));
        } catch (IOException e) {
            throw new InfrastructureException(InfrastructureException.Stage.MONITORING, window.getHorizon(),
                    "cannot write " + file, e);
        }
    }

    public void delete(String horizon) {
        Path file = dir.resolve(horizon + ".json");
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new InfrastructureException(InfrastructureException.Stage.MONITORING, horizon, "cannot delete " + file, e);
        }
    }
}
