package com.catalog.inventory.dto;

public record DuplicateEntry(
        String name,
        Long existingId) {
}
