package com.di.recalibrator.agent.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Default publisher: writes each event as one JSON log line with {@code eventType} in the MDC,
 * for a log shipper to route.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingNotificationPublisher implements NotificationPublisher {

    private final ObjectMapper objectMapper;

    @Override
    public void publish(RecalibrationEvent event) {
        MDC.put("eventType", event.getType().name());
        try {
            String json = objectMapper.writeValueAsString(event);
            if (event.getType() == RecalibrationEventType.RUN_FAILED
                    || event.getType() == RecalibrationEventType.ROLLED_BACK) {
                log.warn("[EVENT] {}", json);
            } else {
                log.info("[EVENT] {}", json);
            }
        } catch (JsonProcessingException e) {
            log.error("[EVENT] could not serialize {} for {}: {}", event.getType(), event.getHorizon(), e.getMessage());
        } finally {
            MDC.remove("eventType");
        }
    }
}
