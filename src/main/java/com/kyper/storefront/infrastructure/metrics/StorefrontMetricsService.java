package com.kyper.storefront.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics service for monitoring and observability.
 * Publishes custom metrics through Micrometer to whatever registry the
 * application runs with.
 *
 * Key Metrics:
 * - Order submissions and rejections (by reason)
 * - Order submission latency
 * - Stock decrements
 * - Cache hit/miss rates
 * - Error rates
 *
 * @author Storefront Team
 */
@Service
public class StorefrontMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(StorefrontMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "storefront.";
    private static final String ORDER_PREFIX = METRIC_PREFIX + "order.";
    private static final String INVENTORY_PREFIX = METRIC_PREFIX + "inventory.";
    private static final String CACHE_PREFIX = METRIC_PREFIX + "cache.";

    public StorefrontMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a committed order.
     *
     * @param itemCount Number of line items in the order
     */
    public void recordOrderSubmitted(int itemCount) {
        Counter.builder(ORDER_PREFIX + "submitted")
                .description("Committed order submissions")
                .register(meterRegistry)
                .increment();
        Counter.builder(ORDER_PREFIX + "items")
                .description("Line items written by committed orders")
                .register(meterRegistry)
                .increment(itemCount);
        logger.debug("Recorded order submission with {} items", itemCount);
    }

    /**
     * Record a rejected or failed order submission.
     *
     * @param reason Failure reason (e.g., "VALIDATION", "INSUFFICIENT_STOCK", "POOL_EXHAUSTED")
     */
    public void recordOrderRejected(String reason) {
        Counter.builder(ORDER_PREFIX + "rejected")
                .tag("reason", reason)
                .description("Rejected or rolled back order submissions")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded order rejection, reason: {}", reason);
    }

    /**
     * Record end-to-end order submission latency.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordSubmissionLatency(long durationMs) {
        Timer.builder(ORDER_PREFIX + "submission.latency")
                .description("Order submission latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a stock decrement applied inside an order transaction.
     * Counted before commit; a rolled back order still shows here.
     *
     * @param productId Product ID
     * @param quantity Quantity removed
     */
    public void recordStockDecrement(Long productId, int quantity) {
        Counter.builder(INVENTORY_PREFIX + "decrement")
                .tag("product_id", String.valueOf(productId))
                .description("Units removed from stock by order submission")
                .register(meterRegistry)
                .increment(quantity);
    }

    /**
     * Record cache hit.
     *
     * @param cacheType Cache type (e.g., "product")
     */
    public void recordCacheHit(String cacheType) {
        Counter.builder(CACHE_PREFIX + "hit")
                .tag("cache_type", cacheType)
                .description("Cache hits")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record cache miss.
     *
     * @param cacheType Cache type (e.g., "product")
     */
    public void recordCacheMiss(String cacheType) {
        Counter.builder(CACHE_PREFIX + "miss")
                .tag("cache_type", cacheType)
                .description("Cache misses")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record application error.
     *
     * @param errorType Error type
     * @param operation Operation that failed
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Application errors")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error: {}, operation: {}", errorType, operation);
    }
}
