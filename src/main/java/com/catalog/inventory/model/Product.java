package com.catalog.inventory.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Entity
@Table(name = "products")
@Data
public class Product {

    public static final String STATUS_IN_STOCK = "In Stock";
    public static final String STATUS_OUT_OF_STOCK = "Out of Stock";
    public static final int NAME_MAX_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Stored trimmed; uniqueness is checked case-insensitively by ProductService
    @Column(unique = true, nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    private String unit;

    private String category;

    private String brand;

    @Column(nullable = false)
    private Integer stock = 0;

    private String status;

    @Column(length = 2000)
    private String image = "";

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (stock == null)
            stock = 0;
    }

    public static String defaultStatusFor(int stock) {
        return stock > 0 ? STATUS_IN_STOCK : STATUS_OUT_OF_STOCK;
    }
}
