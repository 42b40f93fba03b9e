package com.kyper.storefront.service.order;

import com.kyper.storefront.domain.model.Order;
import com.kyper.storefront.domain.model.OrderItem;
import com.kyper.storefront.repository.OrderItemRepository;
import com.kyper.storefront.repository.OrderRepository;
import com.kyper.storefront.repository.ProductRepository;
import com.kyper.storefront.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Writes order headers and line items.
 * Must be called inside the order transaction: both writes share the
 * transaction's connection with the stock decrement.
 *
 * @author Storefront Team
 */
@Component
public class OrderStore {

    private static final Logger logger = LoggerFactory.getLogger(OrderStore.class);

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final UserRepository userRepository;
    private final ProductRepository productRepository;

    public OrderStore(
            OrderRepository orderRepository,
            OrderItemRepository orderItemRepository,
            UserRepository userRepository,
            ProductRepository productRepository
    ) {
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.userRepository = userRepository;
        this.productRepository = productRepository;
    }

    /**
     * Insert an order header.
     * The user reference is not loaded; an unknown user fails on the foreign key.
     *
     * @param userId Owning user, or null for a guest order
     * @param total Order total
     * @param shippingAddress Serialized shipping address
     * @param status Initial status
     * @return Generated order ID
     */
    public Long insertOrder(Long userId, BigDecimal total, String shippingAddress, String status) {
        Order order = Order.builder()
                .user(userId != null ? userRepository.getReferenceById(userId) : null)
                .total(total)
                .shippingAddress(shippingAddress)
                .status(status)
                .build();

        Order saved = orderRepository.save(order);
        logger.debug("Inserted order header: {}", saved.getId());
        return saved.getId();
    }

    /**
     * Insert one line item of an order.
     *
     * @param orderId Order created in the same transaction
     * @param productId Product ordered
     * @param quantity Quantity ordered
     * @param priceAtPurchase Unit price snapshot
     * @return Generated line item ID
     */
    public Long insertLineItem(Long orderId, Long productId, Integer quantity, BigDecimal priceAtPurchase) {
        OrderItem item = OrderItem.builder()
                .order(orderRepository.getReferenceById(orderId))
                .product(productRepository.getReferenceById(productId))
                .quantity(quantity)
                .priceAtPurchase(priceAtPurchase)
                .build();

        OrderItem saved = orderItemRepository.save(item);
        logger.debug("Inserted line item {} for order {}: product={}, quantity={}",
                saved.getId(), orderId, productId, quantity);
        return saved.getId();
    }
}
