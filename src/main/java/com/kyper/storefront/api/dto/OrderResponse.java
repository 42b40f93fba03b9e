package com.kyper.storefront.api.dto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.TextNode;
import com.kyper.storefront.domain.model.Order;
import com.kyper.storefront.domain.model.User;
import com.kyper.storefront.service.OrderQueryService.OrderWithItems;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for an order with its owner and line items.
 *
 * @author Storefront Team
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderResponse {

    private Long id;
    private Long userId;
    private String userEmail;
    private String userName;
    private BigDecimal total;
    private JsonNode shippingAddress;
    private String status;
    private Instant createdAt;
    private List<OrderItemResponse> items;

    public OrderResponse() {
    }

    /**
     * Create response from an order and its items.
     * The stored shipping address is returned as JSON; rows written by older
     * clients that are not valid JSON come back as a plain string.
     *
     * @param orderWithItems Order with items
     * @param objectMapper Mapper used to parse the stored address
     * @return OrderResponse
     */
    public static OrderResponse from(OrderWithItems orderWithItems, ObjectMapper objectMapper) {
        Order order = orderWithItems.getOrder();
        User user = order.getUser();

        OrderResponse response = new OrderResponse();
        response.setId(order.getId());
        response.setUserId(order.getUserId());
        response.setUserEmail(user != null ? user.getEmail() : null);
        response.setUserName(user != null ? user.getName() : null);
        response.setTotal(order.getTotal());
        response.setShippingAddress(parseAddress(order.getShippingAddress(), objectMapper));
        response.setStatus(order.getStatus());
        response.setCreatedAt(order.getCreatedAt());
        response.setItems(orderWithItems.getItems().stream()
                .map(OrderItemResponse::fromEntity)
                .collect(Collectors.toList()));
        return response;
    }

    private static JsonNode parseAddress(String stored, ObjectMapper objectMapper) {
        if (stored == null) {
            return null;
        }
        try {
            return objectMapper.readTree(stored);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(stored);
        }
    }

    // Getters and setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public String getUserEmail() {
        return userEmail;
    }

    public void setUserEmail(String userEmail) {
        this.userEmail = userEmail;
    }

    public String getUserName() {
        return userName;
    }

    public void setUserName(String userName) {
        this.userName = userName;
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

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public List<OrderItemResponse> getItems() {
        return items;
    }

    public void setItems(List<OrderItemResponse> items) {
        this.items = items;
    }
}
