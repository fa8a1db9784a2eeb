package com.catalog.inventory.exception;

import com.catalog.inventory.dto.ImportReport;

/**
 * Raised when a bulk import stops part way. Rows counted in {@link #getReport()}
 * are already committed.
 */
public class ImportException extends InventoryException {

    private final ImportReport report;

    public ImportException(String message, ImportReport report, Throwable cause) {
        super(message, cause);
        this.report = report;
    }

    public ImportReport getReport() {
        return report;
    }
}
