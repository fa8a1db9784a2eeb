package com.catalog.inventory.exception;

/**
 * Base type for expected, caller-facing failures of the inventory operations.
 * Unchecked so that a failure inside a {@code @Transactional} method rolls it back.
 */
public abstract class InventoryException extends RuntimeException {

    protected InventoryException(String message) {
        super(message);
    }

    protected InventoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
