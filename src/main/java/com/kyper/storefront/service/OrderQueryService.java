package com.kyper.storefront.service;

import com.kyper.storefront.domain.model.Order;
import com.kyper.storefront.domain.model.OrderItem;
import com.kyper.storefront.exception.ResourceNotFoundException;
import com.kyper.storefront.repository.OrderItemRepository;
import com.kyper.storefront.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read side of orders: order headers with their user and line items.
 * Line items for a page of orders are loaded with one query, not one per order.
 *
 * @author Storefront Team
 */
@Service
@Transactional(readOnly = true)
public class OrderQueryService {

    private static final Logger logger = LoggerFactory.getLogger(OrderQueryService.class);

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;

    public OrderQueryService(OrderRepository orderRepository, OrderItemRepository orderItemRepository) {
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
    }

    /**
     * Get all orders, newest first, with their line items.
     *
     * @return Orders with items
     */
    public List<OrderWithItems> getAllOrders() {
        List<Order> orders = orderRepository.findAllWithUser();
        if (orders.isEmpty()) {
            return Collections.emptyList();
        }

        List<Long> orderIds = orders.stream().map(Order::getId).collect(Collectors.toList());
        Map<Long, List<OrderItem>> itemsByOrder = orderItemRepository.findByOrderIdIn(orderIds).stream()
                .collect(Collectors.groupingBy(OrderItem::getOrderId, LinkedHashMap::new, Collectors.toList()));

        logger.debug("Loaded {} orders with {} item groups", orders.size(), itemsByOrder.size());

        return orders.stream()
                .map(order -> new OrderWithItems(order, itemsByOrder.getOrDefault(order.getId(), Collections.emptyList())))
                .collect(Collectors.toList());
    }

    /**
     * Get one order with its line items.
     *
     * @param orderId Order ID
     * @return Order with items
     * @throws ResourceNotFoundException if the order does not exist
     */
    public OrderWithItems getOrder(Long orderId) {
        Order order = orderRepository.findByIdWithUser(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        return new OrderWithItems(order, orderItemRepository.findByOrderIdIn(List.of(orderId)));
    }

    /**
     * Order header paired with its line items.
     */
    public static class OrderWithItems {
        private final Order order;
        private final List<OrderItem> items;

        public OrderWithItems(Order order, List<OrderItem> items) {
            this.order = order;
            this.items = items;
        }

        public Order getOrder() {
            return order;
        }

        public List<OrderItem> getItems() {
            return items;
        }
    }
}
