package com.kyper.storefront.exception;

/**
 * Exception thrown when a stock decrement would drive a product's stock below zero.
 *
 * @author Storefront Team
 */
public class InsufficientStockException extends OrderConstraintViolationException {

    private final Long productId;
    private final Integer requestedQuantity;
    private final Integer availableQuantity;

    public InsufficientStockException(Long productId, Integer requestedQuantity, Integer availableQuantity) {
        super(String.format("Product %d has insufficient stock. Requested: %d, Available: %d",
                productId, requestedQuantity, availableQuantity));
        this.productId = productId;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
    }

    public Long getProductId() {
        return productId;
    }

    public Integer getRequestedQuantity() {
        return requestedQuantity;
    }

    public Integer getAvailableQuantity() {
        return availableQuantity;
    }

    @Override
    public String getReason() {
        return "INSUFFICIENT_STOCK";
    }
}
