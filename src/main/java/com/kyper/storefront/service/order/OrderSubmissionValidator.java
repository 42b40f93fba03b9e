package com.kyper.storefront.service.order;

import com.kyper.storefront.domain.model.Order;
import com.kyper.storefront.exception.OrderValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Validates order payloads before any storage interaction.
 * Field names in reported errors use the wire (snake_case) form, e.g.
 * {@code items[0].product_id}.
 *
 * @author Storefront Team
 */
@Component
public class OrderSubmissionValidator {

    private final Validator validator;
    private final int maxItems;

    public OrderSubmissionValidator(
            Validator validator,
            @Value("${storefront.orders.max-items:100}") int maxItems
    ) {
        this.validator = validator;
        this.maxItems = maxItems;
    }

    /**
     * Validate an order payload.
     *
     * @param submission Order payload
     * @throws OrderValidationException listing every violated field
     */
    public void validate(OrderSubmission submission) {
        if (submission == null) {
            throw new OrderValidationException("body", "Order payload is required");
        }

        Map<String, String> fieldErrors = new LinkedHashMap<>();

        Set<ConstraintViolation<OrderSubmission>> violations = validator.validate(submission);
        for (ConstraintViolation<OrderSubmission> violation : violations) {
            fieldErrors.putIfAbsent(toWireName(violation.getPropertyPath().toString()), violation.getMessage());
        }

        // JSON null binds to a NullNode rather than to null
        if (submission.getShippingAddress() != null
                && (submission.getShippingAddress().isNull() || submission.getShippingAddress().isMissingNode())) {
            fieldErrors.putIfAbsent("shipping_address", "Shipping address is required");
        }

        String status = OrderSubmissionEngine.resolveStatus(submission.getStatus());
        if (status.length() > Order.STATUS_MAX_LENGTH) {
            fieldErrors.putIfAbsent("status", "Status must be at most " + Order.STATUS_MAX_LENGTH + " characters");
        }

        if (submission.getItems() != null && submission.getItems().size() > maxItems) {
            fieldErrors.putIfAbsent("items", "Order cannot contain more than " + maxItems + " items");
        }

        if (!fieldErrors.isEmpty()) {
            throw new OrderValidationException(fieldErrors);
        }
    }

    static String toWireName(String propertyPath) {
        StringBuilder wire = new StringBuilder(propertyPath.length() + 8);
        for (char c : propertyPath.toCharArray()) {
            if (Character.isUpperCase(c)) {
                wire.append('_').append(Character.toLowerCase(c));
            } else {
                wire.append(c);
            }
        }
        // container element violations are reported as "items[0].<list element>"
        return wire.toString().replace(".<list element>", "");
    }
}
