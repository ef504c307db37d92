package com.company.sla.service;

import com.company.sla.exception.NotificationDeliveryException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.Collections;
import java.util.Map;

/**
 * Writes notifications into the host's notifications table, where its realtime layer picks them up.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcNotificationSink implements NotificationSink {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Tracer tracer;
    private final Clock clock;

    @Override
    @CircuitBreaker(name = "notificationSink", fallbackMethod = "deliveryFallback")
    public void createNotification(String profileId, String type, String title, String message,
                                   Map<String, Object> metadata) {
        Span span = tracer.spanBuilder("sla.notification.create")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("notification.type", type);
            span.setAttribute("profile.id", profileId);

            jdbcTemplate.update("""
                INSERT INTO notifications (id, user_id, type, title, message, metadata, created_at)
                VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, ?)
                """,
                    profileId,
                    type,
                    title,
                    message,
                    objectMapper.writeValueAsString(metadata != null ? metadata : Collections.emptyMap()),
                    Timestamp.from(clock.instant())
            );

            log.debug("Notification {} stored for profile {}", type, profileId);

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to store notification");
            throw new NotificationDeliveryException("Failed to store " + type + " notification for " + profileId, e);
        } finally {
            span.end();
        }
    }

    private void deliveryFallback(String profileId, String type, String title, String message,
                                  Map<String, Object> metadata, Throwable t) {
        if (t instanceof NotificationDeliveryException) {
            throw (NotificationDeliveryException) t;
        }
        log.warn("Notification sink unavailable, dropping {} for profile {}: {}", type, profileId, t.getMessage());
        throw new NotificationDeliveryException("Notification sink unavailable", t);
    }
}
