package com.kyper.storefront.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.kyper.storefront.service.order.OrderSubmission;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Request DTO for placing an order.
 * Not bean-validated here: the order submission engine validates the payload
 * and reports violations with the same field names.
 *
 * @author Storefront Team
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubmitOrderRequest {

    private Long userId;
    private BigDecimal total;
    private JsonNode shippingAddress;
    private String status;
    private List<OrderItemRequest> items;

    public SubmitOrderRequest() {
    }

    /**
     * Convert to the engine payload. Null items stay null so the engine reports them.
     *
     * @return Order submission
     */
    public OrderSubmission toSubmission() {
        return OrderSubmission.builder()
                .userId(userId)
                .total(total)
                .shippingAddress(shippingAddress)
                .status(status)
                .items(items == null ? null : items.stream()
                        .map(item -> item == null ? null : item.toOrderLine())
                        .collect(Collectors.toList()))
                .build();
    }

    // Getters and setters
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

    public JsonNode getShippingAddress() {
        return shippingAddress;
    }

    public void setShippingAddress(JsonNode shippingAddress) {
        this.shippingAddress = shippingAddress;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public List<OrderItemRequest> getItems() {
        return items;
    }

    public void setItems(List<OrderItemRequest> items) {
        this.items = items;
    }
}
