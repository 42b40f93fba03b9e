package com.kyper.storefront.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.kyper.storefront.service.order.OrderSubmission.OrderLine;

import java.math.BigDecimal;

/**
 * One line of a place-order request.
 * The storefront cart sends the product reference as "id"; "product_id" is accepted too.
 *
 * @author Storefront Team
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderItemRequest {

    @JsonAlias("id")
    private Long productId;
    private Integer quantity;
    private BigDecimal price;

    public OrderItemRequest() {
    }

    public OrderItemRequest(Long productId, Integer quantity, BigDecimal price) {
        this.productId = productId;
        this.quantity = quantity;
        this.price = price;
    }

    public OrderLine toOrderLine() {
        return new OrderLine(productId, quantity, price);
    }

    // Getters and setters
    public Long getProductId() {
        return productId;
    }

    public void setProductId(Long productId) {
        this.productId = productId;
    }

    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }
}
