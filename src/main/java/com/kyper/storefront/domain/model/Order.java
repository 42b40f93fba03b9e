package com.kyper.storefront.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Order header representing one checkout event.
 * Created exactly once, inside the order submission transaction, and never
 * mutated by it afterwards.
 *
 * @author Storefront Team
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_user_id", columnList = "user_id"),
    @Index(name = "idx_orders_status", columnList = "status"),
    @Index(name = "idx_orders_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    public static final String STATUS_PENDING = "pending";
    public static final int STATUS_MAX_LENGTH = 20;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    /**
     * Owning user. Null for guest checkouts.
     */
    @ManyToOne(fetch = FetchType.LAZY, optional = true)
    @JoinColumn(name = "user_id", foreignKey = @ForeignKey(name = "fk_orders_user"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User user;

    /**
     * Sum of line extensions as computed by the client. Not recomputed here.
     */
    @Column(name = "total", nullable = false, precision = 10, scale = 2)
    private BigDecimal total;

    /**
     * Shipping address, stored as the serialized JSON the client sent.
     */
    @Column(name = "shipping_address", nullable = false, columnDefinition = "TEXT")
    private String shippingAddress;

    /**
     * Order status. Only "pending" has meaning to order submission; other
     * values belong to fulfilment workflows.
     */
    @Column(name = "status", nullable = false, length = STATUS_MAX_LENGTH)
    private String status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();

        if (status == null || status.isBlank()) {
            status = STATUS_PENDING;
        }
    }

    /**
     * Id of the owning user without initializing the lazy association.
     *
     * @return user id, or null for guest orders
     */
    public Long getUserId() {
        return user != null ? user.getId() : null;
    }
}
