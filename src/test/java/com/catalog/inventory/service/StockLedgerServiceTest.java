package com.catalog.inventory.service;

import com.catalog.inventory.config.InventoryProperties;
import com.catalog.inventory.model.InventoryLog;
import com.catalog.inventory.repository.InventoryLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class StockLedgerServiceTest {

    @Mock
    private InventoryLogRepository logRepository;

    private StockLedgerService stockLedgerService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        InventoryProperties properties = new InventoryProperties();
        properties.setDefaultChangedBy("admin");
        stockLedgerService = new StockLedgerService(logRepository, properties);
        when(logRepository.save(any(InventoryLog.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void record_defaultsAuthorToAdmin() {
        InventoryLog entry = stockLedgerService.record(3L, 0, 4, null);

        assertEquals("admin", entry.getChangedBy());
        assertEquals(3L, entry.getProductId());
        assertEquals(0, entry.getOldStock());
        assertEquals(4, entry.getNewStock());
    }

    @Test
    void record_blankAuthorFallsBackToDefault() {
        assertEquals("admin", stockLedgerService.record(3L, 4, 1, "  ").getChangedBy());
    }

    @Test
    void record_keepsNamedAuthor() {
        assertEquals("warehouse-bot", stockLedgerService.record(3L, 4, 1, "warehouse-bot").getChangedBy());
    }
}
