package com.serge.appointments.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards committed appointment events to the Redis channel that notification and analytics
 * consumers subscribe to. Publishing problems are logged and dropped.
 */
@Component
public class AppointmentEventRelay {
    private static final Logger log = LoggerFactory.getLogger(AppointmentEventRelay.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String channel;

    public AppointmentEventRelay(StringRedisTemplate redis,
                                 ObjectMapper objectMapper,
                                 @Value("${events.channel:appointments.events}") String channel) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.channel = channel;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onCommitted(AppointmentEvent event) {
        try {
            redis.convertAndSend(channel, objectMapper.writeValueAsString(event));
            log.debug("events.published channel={} type={} appointmentId={}", channel, event.type(), event.appointmentId());
        } catch (Exception e) {
            log.warn("events.publish_failed channel={} type={} appointmentId={} err={}",
                    channel, event.type(), event.appointmentId(), e.toString());
        }
    }
}
