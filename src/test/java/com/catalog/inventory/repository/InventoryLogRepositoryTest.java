package com.catalog.inventory.repository;

import com.catalog.inventory.model.InventoryLog;
import com.catalog.inventory.model.Product;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class InventoryLogRepositoryTest {

    @Autowired
    private InventoryLogRepository logRepository;

    @Autowired
    private ProductRepository productRepository;

    private Product product(String name) {
        Product p = new Product();
        p.setName(name);
        p.setStock(0);
        p.setStatus(Product.STATUS_OUT_OF_STOCK);
        return productRepository.save(p);
    }

    @Test
    void findByProductId_ShouldReturnNewestFirst() {
        Product p = product("Mushrooms");
        Product other = product("Onions");

        logRepository.save(new InventoryLog(p.getId(), 0, 5, "admin"));
        logRepository.save(new InventoryLog(p.getId(), 5, 2, "admin"));
        logRepository.save(new InventoryLog(other.getId(), 0, 1, "admin"));

        List<InventoryLog> history = logRepository.findByProductIdOrderByTimestampDescIdDesc(p.getId());

        assertEquals(2, history.size());
        assertEquals(5, history.get(0).getOldStock());
        assertEquals(2, history.get(0).getNewStock());
        assertNotNull(history.get(0).getTimestamp());
    }

    @Test
    void deleteByProductId_ShouldOnlyRemoveThatProductsRows() {
        Product p = product("Garlic");
        Product other = product("Leeks");
        logRepository.save(new InventoryLog(p.getId(), 0, 5, "admin"));
        logRepository.save(new InventoryLog(p.getId(), 5, 6, "admin"));
        logRepository.save(new InventoryLog(other.getId(), 0, 1, "admin"));

        assertEquals(2, logRepository.deleteByProductId(p.getId()));

        assertEquals(0, logRepository.countByProductId(p.getId()));
        assertEquals(1, logRepository.countByProductId(other.getId()));
    }

    @Test
    void productSearch_ShouldIgnoreCase() {
        product("Button Mushrooms");
        Product oyster = product("Oyster Mushrooms");

        assertEquals(2, productRepository.findByNameContainingIgnoreCaseOrderByIdDesc("mushroom").size());
        assertTrue(productRepository.findFirstByNameIgnoreCaseOrderByIdAsc("OYSTER MUSHROOMS").isPresent());
        assertFalse(productRepository.existsByNameIgnoreCaseAndIdNot("oyster mushrooms", oyster.getId()));
        assertTrue(productRepository.existsByNameIgnoreCaseAndIdNot("button mushrooms", oyster.getId()));
    }
}
