package com.kyper.storefront.repository;

import com.kyper.storefront.domain.model.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository interface for OrderItem entity.
 *
 * @author Storefront Team
 */
@Repository
public interface OrderItemRepository extends JpaRepository<OrderItem, Long> {

    /**
     * Find line items of many orders in one query (bulk fetch).
     *
     * @param orderIds Order IDs
     * @return Line items ordered by order and insertion order
     */
    @Query("SELECT i FROM OrderItem i WHERE i.order.id IN :orderIds ORDER BY i.order.id, i.id")
    List<OrderItem> findByOrderIdIn(@Param("orderIds") Collection<Long> orderIds);
}
