package com.catalog.inventory.exception;

public class ValidationException extends InventoryException {
    public ValidationException(String message) {
        super(message);
    }
}
