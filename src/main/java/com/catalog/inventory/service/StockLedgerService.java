package com.catalog.inventory.service;

import com.catalog.inventory.config.InventoryProperties;
import com.catalog.inventory.model.InventoryLog;
import com.catalog.inventory.repository.InventoryLogRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Audit trail of stock changes. Writes only happen as part of a product
 * mutation, so they require an active transaction started by the caller.
 */
@Service
public class StockLedgerService {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(StockLedgerService.class);

    private final InventoryLogRepository logRepository;
    private final InventoryProperties properties;

    public StockLedgerService(InventoryLogRepository logRepository, InventoryProperties properties) {
        this.logRepository = logRepository;
        this.properties = properties;
    }

    /**
     * Newest entries first. An unknown product id gives an empty list.
     */
    @Transactional(readOnly = true)
    public List<InventoryLog> history(Long productId) {
        return logRepository.findByProductIdOrderByTimestampDescIdDesc(productId);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public InventoryLog record(Long productId, int oldStock, int newStock, String changedBy) {
        String author = StringUtils.hasText(changedBy) ? changedBy : properties.getDefaultChangedBy();
        InventoryLog entry = logRepository.save(new InventoryLog(productId, oldStock, newStock, author));
        logger.debug("Stock of product {} changed {} -> {} by {}", productId, oldStock, newStock, author);
        return entry;
    }

    /**
     * Removes the whole history of a product. Only valid as part of deleting that product.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int purge(Long productId) {
        return logRepository.deleteByProductId(productId);
    }
}
