package com.kyper.storefront.service.order;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Place-order payload accepted by {@link OrderSubmissionEngine}.
 *
 * @author Storefront Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderSubmission {

    /**
     * Owning user, null for guest checkout. Existence is enforced by the
     * database foreign key, not pre-checked.
     */
    private Long userId;

    @NotNull(message = "Total is required")
    @DecimalMin(value = "0.0", message = "Total must be zero or greater")
    @Digits(integer = 8, fraction = 2, message = "Total must have at most 8 integer digits and 2 decimals")
    private BigDecimal total;

    /**
     * Structured address, persisted verbatim as JSON.
     */
    @NotNull(message = "Shipping address is required")
    private JsonNode shippingAddress;

    /**
     * Optional status; null or blank means "pending". Length is checked on
     * the trimmed value by {@link OrderSubmissionValidator}.
     */
    private String status;

    @NotEmpty(message = "Order must contain at least one item")
    private List<@NotNull(message = "Item is required") @Valid OrderLine> items;

    /**
     * One requested line: product, quantity and the unit price the client saw.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrderLine {

        @NotNull(message = "Product ID is required")
        private Long productId;

        @NotNull(message = "Quantity is required")
        @Positive(message = "Quantity must be greater than zero")
        private Integer quantity;

        @NotNull(message = "Price is required")
        @DecimalMin(value = "0.0", message = "Price must be zero or greater")
        @Digits(integer = 8, fraction = 2, message = "Price must have at most 8 integer digits and 2 decimals")
        private BigDecimal price;
    }
}
