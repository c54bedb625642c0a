package com.al.shopsync.service.sync;

import com.al.shopsync.config.ShopSyncProperties;
import com.al.shopsync.model.SyncEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

/**
 * Logs sync events and publishes them to the events exchange with routing key
 * {@code sync.<entity>.<event>}.
 */
@Component
@Slf4j
public class RabbitSyncEventPublisher implements SyncEventListener {

    private final RabbitTemplate rabbitTemplate;
    private final String exchange;
    private final boolean enabled;

    public RabbitSyncEventPublisher(RabbitTemplate rabbitTemplate, ShopSyncProperties properties) {
        this.rabbitTemplate = rabbitTemplate;
        this.exchange = properties.getEvents().getExchange();
        this.enabled = properties.getEvents().isEnabled();
    }

    @Override
    public void onEvent(SyncEvent event) {
        log.info("Sync job {} {}: {}/{} processed, {} successful, {} failed", event.getJobId(),
                event.getEvent().getValue(), event.getProcessedCount(), event.getTotalCount(),
                event.getSuccessful(), event.getFailed());
        if (!enabled) {
            return;
        }
        try {
            rabbitTemplate.convertAndSend(exchange, event.routingKey(), event);
        } catch (AmqpException e) {
            log.error("Failed to publish sync event {} for job {}: {}", event.routingKey(), event.getJobId(),
                    e.getMessage());
            // the sync continues without events
        }
    }
}
