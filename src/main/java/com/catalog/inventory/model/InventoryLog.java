package com.catalog.inventory.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * One stock transition of a product. Rows are append-only and go away only
 * together with their product.
 */
@Entity
@Table(name = "inventory_logs", indexes = @Index(name = "idx_inventory_logs_product", columnList = "product_id"))
@Immutable
@Data
@NoArgsConstructor
public class InventoryLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "product_id", nullable = false, updatable = false)
    private Long productId;

    // Read-only association, only there to get the foreign key into the schema
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "product_id", insertable = false, updatable = false)
    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Product product;

    @Column(updatable = false)
    private Integer oldStock;

    @Column(updatable = false)
    private Integer newStock;

    @Column(updatable = false)
    private String changedBy;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private LocalDateTime timestamp;

    public InventoryLog(Long productId, int oldStock, int newStock, String changedBy) {
        this.productId = productId;
        this.oldStock = oldStock;
        this.newStock = newStock;
        this.changedBy = changedBy;
    }

    @PrePersist
    protected void onCreate() {
        timestamp = LocalDateTime.now();
    }
}
