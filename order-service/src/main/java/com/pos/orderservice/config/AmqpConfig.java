package com.pos.orderservice.config;

import org.springframework.amqp.core.*;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AmqpConfig {

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.dlq";
    public static final String DLQ_ROUTING_KEY = "dlq";

    public static final String ORDER_EXCHANGE = "order_events_exchange";
    public static final String MENU_EXCHANGE = "menu_events_exchange";

    public static final String Q_MENU_UPDATES = "q.order.menu.updates";

    public static final String ROUTING_KEY_MENU_ALL = "menu.item.#";
    public static final String ROUTING_KEY_MENU_ITEM_UPDATED = "menu.item.updated";
    public static final String ROUTING_KEY_MENU_ITEM_DELETED = "menu.item.deleted";

    // Published by this service through the outbox
    public static final String ROUTING_KEY_ORDER_CREATED = "order.created";
    public static final String ROUTING_KEY_CANCELLATION_REQUESTED = "order.cancellation_requested";
    public static final String ROUTING_KEY_CANCELLATION_APPROVED = "order.cancellation_approved";
    public static final String ROUTING_KEY_CANCELLATION_REJECTED = "order.cancellation_rejected";

    @Bean
    public TopicExchange deadLetterExchange() {
        return new TopicExchange(DLX_NAME);
    }

    @Bean
    public Queue deadLetterQueue() {
        return new Queue(DLQ_NAME);
    }

    @Bean
    public Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue()).to(deadLetterExchange()).with("#");
    }

    @Bean
    public TopicExchange orderEventsExchange() {
        return new TopicExchange(ORDER_EXCHANGE);
    }

    @Bean
    public TopicExchange menuEventsExchange() {
        return new TopicExchange(MENU_EXCHANGE);
    }

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    @Bean
    public Queue menuUpdateQueue() {
        return createDurableQueue(Q_MENU_UPDATES);
    }

    @Bean
    public Binding menuUpdateBinding(Queue menuUpdateQueue, TopicExchange menuEventsExchange) {
        return BindingBuilder.bind(menuUpdateQueue).to(menuEventsExchange).with(ROUTING_KEY_MENU_ALL);
    }

    private Queue createDurableQueue(String queueName) {
        return QueueBuilder.durable(queueName)
                .withArgument("x-dead-letter-exchange", DLX_NAME)
                .withArgument("x-dead-letter-routing-key", DLQ_ROUTING_KEY)
                .build();
    }
}
