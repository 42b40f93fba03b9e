package com.kyper.storefront.infrastructure.messaging.events;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Event published once an order has been committed.
 * Consumed by fulfilment and analytics; carries the line snapshot so consumers
 * do not need to read the order tables.
 *
 * @author Storefront Team
 */
public class OrderPlacedEvent {

    private Long orderId;
    private Long userId;
    private BigDecimal total;
    private String status;
    private List<Line> items = new ArrayList<>();
    private Instant placedAt;

    public OrderPlacedEvent() {
    }

    public OrderPlacedEvent(Long orderId, Long userId, BigDecimal total, String status, List<Line> items) {
        this.orderId = orderId;
        this.userId = userId;
        this.total = total;
        this.status = status;
        this.items = items;
        this.placedAt = Instant.now();
    }

    // Getters and setters
    public Long getOrderId() {
        return orderId;
    }

    public void setOrderId(Long orderId) {
        this.orderId = orderId;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public void setTotal(BigDecimal total) {
        this.total = total;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public List<Line> getItems() {
        return items;
    }

    public void setItems(List<Line> items) {
        this.items = items;
    }

    public Instant getPlacedAt() {
        return placedAt;
    }

    public void setPlacedAt(Instant placedAt) {
        this.placedAt = placedAt;
    }

    /**
     * One ordered product.
     */
    public static class Line {
        private Long productId;
        private Integer quantity;
        private BigDecimal price;

        public Line() {
        }

        public Line(Long productId, Integer quantity, BigDecimal price) {
            this.productId = productId;
            this.quantity = quantity;
            this.price = price;
        }

        public Long getProductId() { return productId; }
        public void setProductId(Long productId) { this.productId = productId; }
        public Integer getQuantity() { return quantity; }
        public void setQuantity(Integer quantity) { this.quantity = quantity; }
        public BigDecimal getPrice() { return price; }
        public void setPrice(BigDecimal price) { this.price = price; }
    }
}
