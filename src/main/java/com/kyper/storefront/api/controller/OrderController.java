package com.kyper.storefront.api.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyper.storefront.api.dto.OrderResponse;
import com.kyper.storefront.api.dto.SubmitOrderRequest;
import com.kyper.storefront.api.dto.SubmitOrderResponse;
import com.kyper.storefront.exception.OrderValidationException;
import com.kyper.storefront.service.OrderQueryService;
import com.kyper.storefront.service.order.OrderSubmissionEngine;
import com.kyper.storefront.service.order.SubmittedOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for orders.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private static final Logger logger = LoggerFactory.getLogger(OrderController.class);

    private final OrderSubmissionEngine submissionEngine;
    private final OrderQueryService orderQueryService;
    private final ObjectMapper objectMapper;

    public OrderController(
            OrderSubmissionEngine submissionEngine,
            OrderQueryService orderQueryService,
            ObjectMapper objectMapper
    ) {
        this.submissionEngine = submissionEngine;
        this.orderQueryService = orderQueryService;
        this.objectMapper = objectMapper;
    }

    /**
     * Place an order: header, line items and stock decrements commit together
     * or not at all.
     *
     * The body is validated by the submission engine rather than with @Valid
     * so that HTTP and programmatic callers get identical field errors.
     *
     * @param request Order payload
     * @return 201 with the committed order summary
     */
    @PostMapping
    public ResponseEntity<SubmitOrderResponse> createOrder(@RequestBody(required = false) SubmitOrderRequest request) {
        if (request == null) {
            throw new OrderValidationException("body", "Request body is required");
        }

        SubmittedOrder submitted = submissionEngine.submit(request.toSubmission());
        logger.debug("Order {} created via API", submitted.getOrderId());

        return ResponseEntity.status(HttpStatus.CREATED).body(SubmitOrderResponse.from(submitted));
    }

    /**
     * Get all orders, newest first, with customer details and line items.
     *
     * @return List of orders
     */
    @GetMapping
    public ResponseEntity<List<OrderResponse>> getAllOrders() {
        List<OrderResponse> orders = orderQueryService.getAllOrders().stream()
                .map(order -> OrderResponse.from(order, objectMapper))
                .collect(Collectors.toList());
        return ResponseEntity.ok(orders);
    }

    /**
     * Get one order with its line items.
     *
     * @param orderId Order ID
     * @return Order details
     */
    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable Long orderId) {
        return ResponseEntity.ok(OrderResponse.from(orderQueryService.getOrder(orderId), objectMapper));
    }
}
