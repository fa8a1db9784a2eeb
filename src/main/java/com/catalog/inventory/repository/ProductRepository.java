package com.catalog.inventory.repository;

import com.catalog.inventory.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {

    List<Product> findAllByOrderByIdDesc();

    List<Product> findAllByOrderByIdAsc();

    List<Product> findByNameContainingIgnoreCaseOrderByIdDesc(String name);

    Optional<Product> findFirstByNameIgnoreCaseOrderByIdAsc(String name);

    boolean existsByNameIgnoreCaseAndIdNot(String name, Long id);
}
