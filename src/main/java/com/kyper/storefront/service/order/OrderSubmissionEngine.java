package com.kyper.storefront.service.order;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyper.storefront.domain.model.Order;
import com.kyper.storefront.exception.OrderInfrastructureException;
import com.kyper.storefront.exception.OrderSubmissionException;
import com.kyper.storefront.exception.OrderValidationException;
import com.kyper.storefront.exception.PoolExhaustedException;
import com.kyper.storefront.infrastructure.cache.RedisCacheService;
import com.kyper.storefront.infrastructure.messaging.OrderEventPublisher;
import com.kyper.storefront.infrastructure.messaging.events.OrderPlacedEvent;
import com.kyper.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.kyper.storefront.service.order.OrderSubmission.OrderLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Places orders.
 *
 * One submission is one database transaction on one pooled connection:
 * 1. Validate the payload (no connection is touched on failure)
 * 2. Insert the order header and capture its generated id
 * 3. For each item, in payload order: insert the line item, then decrement stock
 * 4. Commit, or roll everything back on the first failure
 *
 * Items are processed sequentially in payload order so that row locks on
 * products are taken in a deterministic order within one submission.
 * Concurrent submissions share nothing but the connection pool; conflicting
 * stock decrements serialize on the database row lock.
 *
 * Product cache eviction, the order placed event and metrics happen only
 * after commit.
 *
 * @author Storefront Team
 */
@Service
public class OrderSubmissionEngine {

    private static final Logger logger = LoggerFactory.getLogger(OrderSubmissionEngine.class);

    private final OrderSubmissionValidator validator;
    private final OrderTransactionExecutor transactionExecutor;
    private final OrderStore orderStore;
    private final InventoryLedger inventoryLedger;
    private final ObjectMapper objectMapper;
    private final RedisCacheService cacheService;
    private final OrderEventPublisher eventPublisher;
    private final StorefrontMetricsService metricsService;

    public OrderSubmissionEngine(
            OrderSubmissionValidator validator,
            OrderTransactionExecutor transactionExecutor,
            OrderStore orderStore,
            InventoryLedger inventoryLedger,
            ObjectMapper objectMapper,
            RedisCacheService cacheService,
            OrderEventPublisher eventPublisher,
            StorefrontMetricsService metricsService
    ) {
        this.validator = validator;
        this.transactionExecutor = transactionExecutor;
        this.orderStore = orderStore;
        this.inventoryLedger = inventoryLedger;
        this.objectMapper = objectMapper;
        this.cacheService = cacheService;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    /**
     * Submit an order.
     *
     * @param submission Order payload
     * @return Committed order summary
     * @throws OrderValidationException if the payload is invalid (nothing touched)
     * @throws OrderSubmissionException if the transaction failed (rolled back, connection released)
     */
    public SubmittedOrder submit(OrderSubmission submission) {
        long startTime = System.currentTimeMillis();

        String shippingAddress;
        try {
            validator.validate(submission);
            shippingAddress = serializeShippingAddress(submission.getShippingAddress());
        } catch (OrderValidationException e) {
            logger.warn("Rejected order payload: {}", e.getFieldErrors());
            metricsService.recordOrderRejected("VALIDATION");
            throw e;
        }

        String status = resolveStatus(submission.getStatus());
        List<OrderLine> lines = submission.getItems();

        logger.info("Submitting order: user={}, items={}, total={}",
                submission.getUserId(), lines.size(), submission.getTotal());

        SubmittedOrder submitted;
        try {
            submitted = transactionExecutor.execute(() -> writeOrder(submission, shippingAddress, status));
        } catch (OrderSubmissionException e) {
            if (e instanceof OrderInfrastructureException || e instanceof PoolExhaustedException) {
                logger.error("Order submission failed and was rolled back: user={}, reason={}",
                        submission.getUserId(), e.getReason(), e);
                metricsService.recordError(e.getReason(), "submitOrder");
            } else {
                logger.warn("Order submission rejected and rolled back: user={}, reason={}, message={}",
                        submission.getUserId(), e.getReason(), e.getMessage());
            }
            metricsService.recordOrderRejected(e.getReason());
            throw e;
        }

        afterCommit(submission, submitted);

        metricsService.recordOrderSubmitted(submitted.getItemCount());
        metricsService.recordSubmissionLatency(System.currentTimeMillis() - startTime);

        logger.info("Committed order: {} with {} items", submitted.getOrderId(), submitted.getItemCount());
        return submitted;
    }

    /**
     * Transactional body. Runs on the transaction's connection; any exception
     * rolls back every write made here.
     */
    private SubmittedOrder writeOrder(OrderSubmission submission, String shippingAddress, String status) {
        Long orderId = orderStore.insertOrder(
                submission.getUserId(),
                submission.getTotal(),
                shippingAddress,
                status
        );

        for (OrderLine line : submission.getItems()) {
            orderStore.insertLineItem(orderId, line.getProductId(), line.getQuantity(), line.getPrice());
            inventoryLedger.decrementStock(line.getProductId(), line.getQuantity());
        }

        return new SubmittedOrder(orderId, status, submission.getTotal(), submission.getItems().size());
    }

    private void afterCommit(OrderSubmission submission, SubmittedOrder submitted) {
        Set<Long> productIds = submission.getItems().stream()
                .map(OrderLine::getProductId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        cacheService.evictProducts(productIds);

        List<OrderPlacedEvent.Line> eventLines = submission.getItems().stream()
                .map(line -> new OrderPlacedEvent.Line(line.getProductId(), line.getQuantity(), line.getPrice()))
                .collect(Collectors.toList());
        eventPublisher.publishOrderPlaced(new OrderPlacedEvent(
                submitted.getOrderId(),
                submission.getUserId(),
                submitted.getTotal(),
                submitted.getStatus(),
                eventLines
        ));
    }

    private String serializeShippingAddress(JsonNode shippingAddress) {
        try {
            return objectMapper.writeValueAsString(shippingAddress);
        } catch (JsonProcessingException e) {
            throw new OrderValidationException("shipping_address", "Shipping address could not be serialized");
        }
    }

    static String resolveStatus(String status) {
        if (status == null || status.isBlank()) {
            return Order.STATUS_PENDING;
        }
        return status.trim();
    }
}
