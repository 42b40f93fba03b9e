package com.kyper.storefront.repository;

import com.kyper.storefront.domain.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Product entity.
 * Besides catalog reads it owns the stock decrement used by order submission.
 *
 * @author Storefront Team
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, Long> {

    /**
     * Find all products, newest first.
     *
     * @return List of products
     */
    List<Product> findAllByOrderByCreatedAtDesc();

    /**
     * Atomically decrement stock by a relative amount.
     * The update is a single statement, so concurrent decrements of the same row
     * serialize on the database row lock instead of racing in the application.
     * Rows whose stock is lower than the requested quantity are left untouched.
     *
     * @param productId Product ID
     * @param quantity Quantity to remove from stock
     * @return Number of rows updated (1 if successful, 0 if unknown product or insufficient stock)
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Product p SET p.stock = p.stock - :quantity " +
           "WHERE p.id = :productId AND p.stock >= :quantity")
    int decrementStock(@Param("productId") Long productId, @Param("quantity") Integer quantity);

    /**
     * Get current stock for a product.
     * Lightweight query that only fetches the stock column.
     *
     * @param productId Product ID
     * @return Stock on hand, or null if product not found
     */
    @Query("SELECT p.stock FROM Product p WHERE p.id = :productId")
    Integer findStockById(@Param("productId") Long productId);
}
