package com.kyper.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Product entity representing a catalog item.
 * The stock column is the inventory ledger decremented by order submission.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "products", indexes = {
    @Index(name = "idx_products_category", columnList = "category"),
    @Index(name = "idx_products_created_at", columnList = "created_at")
})
@Check(constraints = "stock >= 0")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "name_es", length = 255)
    private String nameEs;

    @Column(name = "name_en", length = 255)
    private String nameEn;

    /**
     * Current list price. Order line items snapshot the price they were sold at
     * and never read this column back.
     */
    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    /**
     * Quantity on hand. Never negative.
     */
    @Column(name = "stock", nullable = false)
    @Builder.Default
    private Integer stock = 0;

    @Column(name = "image", length = 500)
    private String image;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "description_es", columnDefinition = "TEXT")
    private String descriptionEs;

    @Column(name = "description_en", columnDefinition = "TEXT")
    private String descriptionEn;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        if (stock == null) {
            stock = 0;
        }
    }
}
