package com.al.shopsync.service.sync;

import com.al.shopsync.config.ShopSyncProperties;
import com.al.shopsync.model.SyncEvent;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.SyncEventType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class RabbitSyncEventPublisherTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    private static SyncEvent event() {
        return SyncEvent.builder()
                .event(SyncEventType.PROGRESS)
                .jobId("job-1")
                .entityType(EntityType.ARTICLES)
                .processedCount(50)
                .totalCount(120)
                .timestamp(Instant.now())
                .build();
    }

    @Test
    public void testOnEvent_PublishesWithRoutingKey() {
        RabbitSyncEventPublisher publisher = new RabbitSyncEventPublisher(rabbitTemplate, new ShopSyncProperties());
        SyncEvent event = event();

        publisher.onEvent(event);

        verify(rabbitTemplate).convertAndSend("shop-sync.events", "sync.articles.progress", event);
    }

    @Test
    public void testOnEvent_Disabled() {
        ShopSyncProperties properties = new ShopSyncProperties();
        properties.getEvents().setEnabled(false);

        new RabbitSyncEventPublisher(rabbitTemplate, properties).onEvent(event());

        verifyNoInteractions(rabbitTemplate);
    }

    @Test
    public void testOnEvent_BrokerDown() {
        doThrow(new AmqpConnectException(new ConnectException("Connection refused")))
                .when(rabbitTemplate).convertAndSend(anyString(), anyString(), any(Object.class));
        RabbitSyncEventPublisher publisher = new RabbitSyncEventPublisher(rabbitTemplate, new ShopSyncProperties());

        assertDoesNotThrow(() -> publisher.onEvent(event()));
    }
}
