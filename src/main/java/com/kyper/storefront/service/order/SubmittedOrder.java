package com.kyper.storefront.service.order;

import java.math.BigDecimal;

/**
 * Result of a committed order submission.
 *
 * @author Storefront Team
 */
public class SubmittedOrder {

    private final Long orderId;
    private final String status;
    private final BigDecimal total;
    private final int itemCount;

    public SubmittedOrder(Long orderId, String status, BigDecimal total, int itemCount) {
        this.orderId = orderId;
        this.status = status;
        this.total = total;
        this.itemCount = itemCount;
    }

    public Long getOrderId() {
        return orderId;
    }

    public String getStatus() {
        return status;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public int getItemCount() {
        return itemCount;
    }
}
