package com.catalog.inventory.config;

import com.catalog.inventory.exception.ConflictException;
import com.catalog.inventory.exception.ImportException;
import com.catalog.inventory.exception.InventoryException;
import com.catalog.inventory.exception.NotFoundException;
import com.catalog.inventory.exception.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import jakarta.servlet.http.HttpServletRequest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures of the inventory operations to JSON error bodies of the form
 * {@code {"error": "..."}}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ImportException.class)
    public ResponseEntity<Map<String, Object>> handleImport(HttpServletRequest request, ImportException ex) {
        logger.warn("{} {} failed after {} added, {} skipped: {}", request.getMethod(), request.getRequestURI(),
                ex.getReport().getAdded(), ex.getReport().getSkipped(), ex.getMessage());
        Map<String, Object> body = errorBody(ex.getMessage());
        body.put("report", ex.getReport());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @ExceptionHandler(InventoryException.class)
    public ResponseEntity<Map<String, Object>> handleInventory(HttpServletRequest request, InventoryException ex) {
        HttpStatus status = statusOf(ex);
        logger.warn("{} {} rejected with {}: {}", request.getMethod(), request.getRequestURI(), status.value(),
                ex.getMessage());
        return ResponseEntity.status(status).body(errorBody(ex.getMessage()));
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(errorBody("Malformed request: " + ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(HttpServletRequest request, Exception ex) {
        // Framework errors (unknown route, wrong method, ...) keep their own status
        if (ex instanceof ErrorResponse) {
            return ResponseEntity.status(((ErrorResponse) ex).getStatusCode()).body(errorBody(ex.getMessage()));
        }
        logger.error("{} {} failed", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorBody(ex.getMessage()));
    }

    static HttpStatus statusOf(InventoryException ex) {
        if (ex instanceof ValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof ConflictException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static Map<String, Object> errorBody(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return body;
    }
}
