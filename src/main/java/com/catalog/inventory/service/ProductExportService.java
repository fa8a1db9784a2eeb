package com.catalog.inventory.service;

import com.catalog.inventory.csv.ProductCsvCodec;
import com.catalog.inventory.dto.ProductCsvRow;
import com.catalog.inventory.repository.ProductRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class ProductExportService {

    public static final String EXPORT_FILE_NAME = "products_export.csv";

    private final ProductRepository productRepository;
    private final ProductCsvCodec csvCodec;

    public ProductExportService(ProductRepository productRepository, ProductCsvCodec csvCodec) {
        this.productRepository = productRepository;
        this.csvCodec = csvCodec;
    }

    /**
     * The whole catalog, oldest product first.
     */
    @Transactional(readOnly = true)
    public List<ProductCsvRow> exportRows() {
        return productRepository.findAllByOrderByIdAsc().stream()
                .map(ProductCsvRow::of)
                .toList();
    }

    public String exportCsv() throws JsonProcessingException {
        return csvCodec.write(exportRows());
    }
}
