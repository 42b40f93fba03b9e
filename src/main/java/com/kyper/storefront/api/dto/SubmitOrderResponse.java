package com.kyper.storefront.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.kyper.storefront.service.order.SubmittedOrder;

import java.math.BigDecimal;

/**
 * Response DTO for a committed order.
 *
 * @author Storefront Team
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubmitOrderResponse {

    private Long id;
    private String status;
    private BigDecimal total;
    private Integer itemCount;
    private String message;

    public SubmitOrderResponse() {
    }

    public static SubmitOrderResponse from(SubmittedOrder order) {
        SubmitOrderResponse response = new SubmitOrderResponse();
        response.setId(order.getOrderId());
        response.setStatus(order.getStatus());
        response.setTotal(order.getTotal());
        response.setItemCount(order.getItemCount());
        response.setMessage("Order created successfully");
        return response;
    }

    // Getters and setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public void setTotal(BigDecimal total) {
        this.total = total;
    }

    public Integer getItemCount() {
        return itemCount;
    }

    public void setItemCount(Integer itemCount) {
        this.itemCount = itemCount;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
