package com.al.shopsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RabbitMQConfig {

    @Value("${shop-sync.events.exchange:shop-sync.events}")
    private String exchangeName;

    @Value("${shop-sync.events.queue:shop-sync.progress}")
    private String progressQueueName;

    @Value("${shop-sync.events.routing-pattern:sync.#}")
    private String routingPattern;

    @Bean
    Exchange syncEventsExchange() {
        return ExchangeBuilder.topicExchange(exchangeName).durable(true).build();
    }

    // --- Progress monitoring ---

    @Bean
    Queue syncProgressQueue() {
        return QueueBuilder.durable(progressQueueName)
                .withArgument("x-message-ttl", 86_400_000) // keep events for a day
                .build();
    }

    @Bean
    Binding syncProgressBinding() {
        return BindingBuilder.bind(syncProgressQueue())
                .to(syncEventsExchange())
                .with(routingPattern)
                .noargs();
    }

    @Bean
    MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }
}
