package com.catalog.inventory.exception;

public class NotFoundException extends InventoryException {
    public NotFoundException(String message) {
        super(message);
    }
}
