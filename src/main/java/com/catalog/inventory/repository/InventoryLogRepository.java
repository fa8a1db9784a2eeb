package com.catalog.inventory.repository;

import com.catalog.inventory.model.InventoryLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface InventoryLogRepository extends JpaRepository<InventoryLog, Long> {

    List<InventoryLog> findByProductIdOrderByTimestampDescIdDesc(Long productId);

    long countByProductId(Long productId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM InventoryLog l WHERE l.productId = :productId")
    int deleteByProductId(@Param("productId") Long productId);
}
