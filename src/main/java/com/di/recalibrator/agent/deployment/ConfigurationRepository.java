package com.di.recalibrator.agent.deployment;

import com.di.recalibrator.config.RecalibratorProperties;
import com.di.recalibrator.exception.InfrastructureException;
import com.di.recalibrator.model.ActiveConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Live configuration files, {@code <config-dir>/<horizon>.json}: pretty-printed JSON with
 * sorted keys so successive versions diff cleanly. Forecast jobs read these files directly.
 */
@Component
public class ConfigurationRepository {

    private final Path configDir;
    private final ObjectMapper mapper;
    private final AtomicFileWriter writer;

    @Autowired
    public ConfigurationRepository(RecalibratorProperties props, ObjectMapper objectMapper, AtomicFileWriter writer) {
        this(Paths.get(props.getStorage().getConfigDir()), objectMapper, writer);
    }

    public ConfigurationRepository(Path configDir, ObjectMapper objectMapper, AtomicFileWriter writer) {
        this.configDir = configDir;
        this.mapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.writer = writer;
    }

    public Path getConfigDir() {
        return configDir;
    }

    public Path livePath(String horizon) {
        return configDir.resolve(horizon + ".json");
    }

    public Optional<byte[]> readBytes(String horizon) {
        Path live = livePath(horizon);
        if (!Files.exists(live)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(live));
        } catch (IOException e) {
            throw new InfrastructureException(InfrastructureException.Stage.BACKUP, horizon, "cannot read " + live, e);
        }
    }

    public Optional<ActiveConfiguration> read(String horizon) {
        return readBytes(horizon).map(bytes -> parse(horizon, bytes));
    }

    public ActiveConfiguration parse(String horizon, byte[] bytes) {
        try {
            return mapper.readValue(bytes, ActiveConfiguration.class);
        } catch (IOException e) {
            throw new InfrastructureException(InfrastructureException.Stage.BACKUP, horizon,
                    "live configuration is not valid JSON: " + livePath(horizon), e);
        }
    }

    public byte[] serialize(ActiveConfiguration config) {
        try {
            return mapper.writeValueAsBytes(config);
        } catch (IOException e) {
            throw new InfrastructureException(InfrastructureException.Stage.WRITE, config.getHorizon(),
                    "cannot serialize configuration " + config.getVersionId(), e);
        }
    }

    /** Atomically replaces the live file with {@code config}. */
    public void write(ActiveConfiguration config) {
        replace(config.getHorizon(), serialize(config), InfrastructureException.Stage.WRITE);
    }

    /** Atomically replaces the live file with previously saved bytes. */
    public void restore(String horizon, byte[] content) {
        replace(horizon, content, InfrastructureException.Stage.ROLLBACK);
    }

    /** Removes the live file; used when restoring a horizon that had no configuration. */
    public void remove(String horizon) {
        try {
            Files.deleteIfExists(livePath(horizon));
        } catch (IOException e) {
            throw new InfrastructureException(InfrastructureException.Stage.ROLLBACK, horizon,
                    "cannot remove " + livePath(horizon), e);
        }
    }

    private void replace(String horizon, byte[] content, InfrastructureException.Stage stage) {
        Path live = livePath(horizon);
        try {
            writer.write(live, content);
        } catch (IOException e) {
            throw new InfrastructureException(stage, horizon, "atomic write of " + live + " failed", e);
        }
    }
}
