package com.kyper.storefront.infrastructure.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyper.storefront.infrastructure.messaging.events.OrderPlacedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for order events.
 * Only called after the order transaction committed; a failed publish is logged
 * and never affects the order.
 *
 * Topic partitioning strategy:
 * - Key: order id (all events of one order land on the same partition)
 *
 * @author Storefront Team
 */
@Service
public class OrderEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(OrderEventPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String orderTopic;
    private final boolean enabled;

    public OrderEventPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${storefront.kafka.order-topic:storefront-orders}") String orderTopic,
            @Value("${storefront.kafka.enabled:false}") boolean enabled
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.orderTopic = orderTopic;
        this.enabled = enabled;
    }

    /**
     * Publish order placed event.
     *
     * @param event Order placed event
     */
    public void publishOrderPlaced(OrderPlacedEvent event) {
        if (!enabled) {
            logger.debug("Kafka publishing disabled, skipping order placed event for order: {}", event.getOrderId());
            return;
        }

        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    orderTopic,
                    String.valueOf(event.getOrderId()),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published order placed event for order: {}, partition: {}",
                            event.getOrderId(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish order placed event for order: {}", event.getOrderId(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing order placed event for order: {}", event.getOrderId(), e);
        } catch (Exception e) {
            // send() can fail synchronously, e.g. when broker metadata cannot be fetched
            logger.error("Error publishing order placed event for order: {}", event.getOrderId(), e);
        }
    }
}
