package com.di.recalibrator.agent.notification;

import com.di.recalibrator.config.RecalibratorConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LoggingNotificationPublisher Tests")
class LoggingNotificationPublisherTest {

    private static final RecalibrationEvent EVENT = RecalibrationEvent.builder()
            .type(RecalibrationEventType.DEPLOYED)
            .timestamp(Instant.parse("2026-10-01T00:00:00Z"))
            .horizon("7d")
            .attemptId("a-1")
            .versionId("7d-v1")
            .metricDeltas(Map.of("rmsePct", -6.0))
            .build();

    @Test
    @DisplayName("Events serialize with ISO timestamps and their deltas")
    void testEventSerializes() throws Exception {
        String json = RecalibratorConfig.newObjectMapper().writeValueAsString(EVENT);

        assertTrue(json.contains("\"type\":\"DEPLOYED\""));
        assertTrue(json.contains("\"timestamp\":\"2026-10-01T00:00:00Z\""));
        assertTrue(json.contains("\"rmsePct\":-6.0"));
    }

    @Test
    @DisplayName("Publishing never throws and leaves no MDC behind")
    void testPublishDoesNotThrow() {
        ObjectMapper broken = new ObjectMapper() {
            @Override
            public String writeValueAsString(Object value) throws JsonProcessingException {
                throw new JsonProcessingException("boom") { };
            }
        };

        assertDoesNotThrow(() -> new LoggingNotificationPublisher(broken).publish(EVENT));
        assertDoesNotThrow(() -> new LoggingNotificationPublisher(RecalibratorConfig.newObjectMapper()).publish(EVENT));
        assertNull(MDC.get("eventType"));
    }
}
