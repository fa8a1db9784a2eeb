package com.catalog.inventory.service;

import com.catalog.inventory.csv.ProductCsvCodec;
import com.catalog.inventory.dto.ImportReport;
import com.catalog.inventory.exception.ImportException;
import com.catalog.inventory.model.Product;
import com.catalog.inventory.repository.ProductRepository;
import com.catalog.inventory.util.StockValues;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Bulk load of products. Every inserted row commits on its own, so a failure
 * part way leaves the earlier rows in place. Imported stock is not written to
 * the stock ledger.
 */
@Service
public class ProductImportService {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ProductImportService.class);

    private final ProductRepository productRepository;
    private final ProductCsvCodec csvCodec;

    public ProductImportService(ProductRepository productRepository, ProductCsvCodec csvCodec) {
        this.productRepository = productRepository;
        this.csvCodec = csvCodec;
    }

    public ImportReport importCsv(InputStream in) {
        ImportReport report = new ImportReport();
        try (MappingIterator<Map<String, String>> rows = csvCodec.readRows(in)) {
            importInto(rows, report);
        } catch (IOException | RuntimeJsonMappingException e) {
            throw unreadable(report, e);
        } catch (RuntimeException e) {
            // MappingIterator wraps parser failures in a bare RuntimeException
            if (e.getCause() instanceof IOException) {
                throw unreadable(report, e);
            }
            throw e;
        }
        return report;
    }

    private static ImportException unreadable(ImportReport report, Exception e) {
        logger.error("Import aborted, CSV input unreadable after {} rows added: {}", report.getAdded(),
                e.getMessage());
        return new ImportException("Unreadable CSV input: " + e.getMessage(), report, e);
    }

    public ImportReport importRows(Iterator<Map<String, String>> rows) {
        ImportReport report = new ImportReport();
        importInto(rows, report);
        return report;
    }

    private void importInto(Iterator<Map<String, String>> rows, ImportReport report) {
        try {
            while (rows.hasNext()) {
                importRow(rows.next(), report);
            }
        } catch (DataAccessException e) {
            logger.error("Import aborted by store failure after {} added, {} skipped", report.getAdded(),
                    report.getSkipped(), e);
            throw new ImportException("Import failed: " + e.getMostSpecificCause().getMessage(), report, e);
        }
        logger.info("Import finished: {} added, {} skipped, {} duplicates", report.getAdded(), report.getSkipped(),
                report.getDuplicates().size());
    }

    private void importRow(Map<String, String> row, ImportReport report) {
        String name = cell(row, "name").trim();
        if (name.isEmpty()) {
            report.countSkipped();
            return;
        }
        if (name.length() > Product.NAME_MAX_LENGTH) {
            logger.warn("Skipping import row, name longer than {} characters", Product.NAME_MAX_LENGTH);
            report.countSkipped();
            return;
        }

        // Bad, negative or oversized stock is read as zero, the row is still imported
        int stock = StockValues.parseOrZero(cell(row, "stock"));

        Optional<Product> existing = productRepository.findFirstByNameIgnoreCaseOrderByIdAsc(name);
        if (existing.isPresent()) {
            report.addDuplicate(name, existing.get().getId());
            return;
        }

        String status = cell(row, "status");

        Product product = new Product();
        product.setName(name);
        product.setUnit(cell(row, "unit"));
        product.setCategory(cell(row, "category"));
        product.setBrand(cell(row, "brand"));
        product.setStock(stock);
        product.setStatus(StringUtils.hasText(status) ? status : Product.defaultStatusFor(stock));
        product.setImage(cell(row, "image"));

        try {
            productRepository.save(product);
            report.countAdded();
        } catch (DataIntegrityViolationException e) {
            logger.warn("Skipping import row '{}': {}", name, e.getMostSpecificCause().getMessage());
            report.countSkipped();
        }
    }

    private static String cell(Map<String, String> row, String column) {
        String value = row.get(column);
        return value != null ? value : "";
    }
}
