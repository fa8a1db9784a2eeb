package com.catalog.inventory.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields accepted by create and update. Values are kept as sent by the caller;
 * {@code stock} in particular may be a number, a numeric string or garbage and
 * is interpreted by the service.
 */
@Data
@NoArgsConstructor
public class ProductForm {
    private String name;
    private String unit;
    private String category;
    private String brand;
    private String stock;
    private String status;
    private String image;
    private String changedBy;

    public ProductForm(String name, String stock) {
        this.name = name;
        this.stock = stock;
    }
}
