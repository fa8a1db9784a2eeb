package com.catalog.inventory.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "inventory")
public class InventoryProperties {

    /**
     * Attribution written to stock log rows when the caller does not name one.
     */
    private String defaultChangedBy = "admin";

    /**
     * Insert a few sample products on startup when the catalog is empty.
     */
    private boolean seedSampleData = true;

    private Cors cors = new Cors();

    @Data
    public static class Cors {
        /**
         * Browser origins allowed to call /api/**.
         */
        private List<String> allowedOrigins = new ArrayList<>(List.of(
                "http://localhost:5173",
                "http://localhost:3000"));
    }
}
