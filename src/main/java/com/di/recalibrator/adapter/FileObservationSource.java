package com.di.recalibrator.adapter;

import com.di.recalibrator.config.RecalibratorProperties;
import com.di.recalibrator.exception.InfrastructureException;
import com.di.recalibrator.model.ErrorObservation;
import com.di.recalibrator.port.ObservationSource;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;

/**
 * Reads observations the forecast jobs export as JSON arrays under
 * {@code <data-dir>/<horizon>/}: {@code errors.json}, {@code features.json} and
 * {@code series.json}. A missing file means no data yet.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "recalibrator.observations.source", havingValue = "file", matchIfMissing = true)
public class FileObservationSource implements ObservationSource {

    static final String ERRORS_FILE = "errors.json";
    static final String FEATURES_FILE = "features.json";
    static final String SERIES_FILE = "series.json";

    private final Path dataDir;
    private final ObjectMapper objectMapper;

    public FileObservationSource(RecalibratorProperties props, ObjectMapper objectMapper) {
        this.dataDir = Paths.get(props.getStorage().getDataDir());
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ErrorObservation> errorObservations(String horizon) {
        List<ErrorObservation> observations = read(horizon, ERRORS_FILE, new TypeReference<List<ErrorObservation>>() {});
        return observations.stream()
                .sorted(Comparator.comparing(ErrorObservation::getObservedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }

    @Override
    public List<Double> featureValues(String horizon) {
        return read(horizon, FEATURES_FILE, new TypeReference<List<Double>>() {});
    }

    @Override
    public List<Double> historicalSeries(String horizon) {
        return read(horizon, SERIES_FILE, new TypeReference<List<Double>>() {});
    }

    private <T> List<T> read(String horizon, String fileName, TypeReference<List<T>> type) {
        Path file = dataDir.resolve(horizon).resolve(fileName);
        if (!Files.exists(file)) {
            log.debug("[OBSERVATIONS] {} not found; treating as empty", file);
            return List.of();
        }
        try {
            List<T> values = objectMapper.readValue(file.toFile(), type);
            return values != null ? values : List.of();
        } catch (IOException e) {
            throw new InfrastructureException(InfrastructureException.Stage.OBSERVATIONS, horizon,
                    "cannot read " + file, e);
        }
    }
}
