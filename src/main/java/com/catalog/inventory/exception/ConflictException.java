package com.catalog.inventory.exception;

public class ConflictException extends InventoryException {
    public ConflictException(String message) {
        super(message);
    }
}
