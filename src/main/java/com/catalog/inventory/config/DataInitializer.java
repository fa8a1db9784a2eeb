package com.catalog.inventory.config;

import com.catalog.inventory.model.Product;
import com.catalog.inventory.repository.ProductRepository;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DataInitializer {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DataInitializer.class);

    @Bean
    CommandLineRunner init(ProductRepository productRepo, InventoryProperties properties) {
        return args -> {
            if (!properties.isSeedSampleData() || productRepo.count() > 0) {
                return;
            }

            // Sample catalog, inserted without stock log entries
            productRepo.save(sample("Apple iPhone 15", "pcs", "Electronics", "Apple", 10));
            productRepo.save(sample("Bananas", "kg", "Groceries", "Dole", 0));
            productRepo.save(sample("Nike Shoes", "pair", "Footwear", "Nike", 5));

            logger.info("Seeded sample products into empty catalog");
        };
    }

    private static Product sample(String name, String unit, String category, String brand, int stock) {
        Product p = new Product();
        p.setName(name);
        p.setUnit(unit);
        p.setCategory(category);
        p.setBrand(brand);
        p.setStock(stock);
        p.setStatus(Product.defaultStatusFor(stock));
        p.setImage("");
        return p;
    }
}
