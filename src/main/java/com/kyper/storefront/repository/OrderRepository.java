package com.kyper.storefront.repository;

import com.kyper.storefront.domain.model.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Order entity.
 *
 * @author Storefront Team
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, Long> {

    /**
     * Find all orders with their owning user, newest first.
     * Guest orders are included (left join).
     *
     * @return List of orders
     */
    @Query("SELECT o FROM Order o LEFT JOIN FETCH o.user ORDER BY o.createdAt DESC, o.id DESC")
    List<Order> findAllWithUser();

    /**
     * Find a single order with its owning user.
     *
     * @param orderId Order ID
     * @return Optional containing the order if found
     */
    @Query("SELECT o FROM Order o LEFT JOIN FETCH o.user WHERE o.id = :orderId")
    Optional<Order> findByIdWithUser(@Param("orderId") Long orderId);
}
