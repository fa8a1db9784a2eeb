package com.catalog.inventory.controller;

import com.catalog.inventory.repository.ProductRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class StatusController {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(StatusController.class);

    private final ProductRepository productRepository;
    private final String datasourceUrl;

    public StatusController(ProductRepository productRepository,
            @Value("${spring.datasource.url:}") String datasourceUrl) {
        this.productRepository = productRepository;
        this.datasourceUrl = datasourceUrl;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("message", "Product Inventory API");
        return body;
    }

    @GetMapping("/api/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        try {
            long products = productRepository.count();
            Map<String, Object> db = new LinkedHashMap<>();
            db.put("url", datasourceUrl);
            db.put("dynamic", isInMemory(datasourceUrl));
            body.put("ok", true);
            body.put("db", db);
            body.put("products", products);
            return ResponseEntity.ok(body);
        } catch (DataAccessException e) {
            logger.error("Status check could not reach the database", e);
            body.put("ok", false);
            body.put("error", e.getMostSpecificCause().getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
        }
    }

    static boolean isInMemory(String url) {
        return url != null && url.startsWith("jdbc:h2:mem:");
    }
}
