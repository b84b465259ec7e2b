package com.di.recalibrator.agent.notification;

/**
 * Outbound notification seam. The transport lives outside this service; publishers must not
 * throw into the pipeline.
 */
public interface NotificationPublisher {

    void publish(RecalibrationEvent event);
}
