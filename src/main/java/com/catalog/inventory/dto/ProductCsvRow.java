package com.catalog.inventory.dto;

import com.catalog.inventory.model.Product;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Flat projection of a product as it appears in CSV exports.
 */
@JsonPropertyOrder({ "name", "unit", "category", "brand", "stock", "status", "image" })
public record ProductCsvRow(
        String name,
        String unit,
        String category,
        String brand,
        Integer stock,
        String status,
        String image) {

    public static ProductCsvRow of(Product product) {
        return new ProductCsvRow(product.getName(), product.getUnit(), product.getCategory(), product.getBrand(),
                product.getStock(), product.getStatus(), product.getImage());
    }
}
