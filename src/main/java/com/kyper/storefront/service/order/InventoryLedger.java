package com.kyper.storefront.service.order;

import com.kyper.storefront.exception.InsufficientStockException;
import com.kyper.storefront.exception.OrderConstraintViolationException;
import com.kyper.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.kyper.storefront.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-product stock ledger.
 * Stock only moves through relative decrements; it is never set from a value
 * read earlier, so concurrent orders cannot lose updates.
 *
 * Stock may not go negative: a decrement larger than the stock on hand is
 * rejected and the surrounding order transaction rolls back.
 *
 * @author Storefront Team
 */
@Component
public class InventoryLedger {

    private static final Logger logger = LoggerFactory.getLogger(InventoryLedger.class);

    private final ProductRepository productRepository;
    private final StorefrontMetricsService metricsService;

    public InventoryLedger(ProductRepository productRepository, StorefrontMetricsService metricsService) {
        this.productRepository = productRepository;
        this.metricsService = metricsService;
    }

    /**
     * Decrement a product's stock within the current transaction.
     *
     * @param productId Product ID
     * @param quantity Quantity to remove
     * @throws InsufficientStockException if stock on hand is lower than quantity
     * @throws OrderConstraintViolationException if the product does not exist
     */
    public void decrementStock(Long productId, Integer quantity) {
        int updated = productRepository.decrementStock(productId, quantity);
        if (updated == 1) {
            logger.debug("Decremented stock of product {} by {}", productId, quantity);
            metricsService.recordStockDecrement(productId, quantity);
            return;
        }

        // Nothing updated: tell an unknown product from insufficient stock
        Integer available = productRepository.findStockById(productId);
        if (available == null) {
            throw new OrderConstraintViolationException("Product not found: " + productId);
        }

        logger.warn("Insufficient stock for product {}: requested={}, available={}",
                productId, quantity, available);
        throw new InsufficientStockException(productId, quantity, available);
    }
}
