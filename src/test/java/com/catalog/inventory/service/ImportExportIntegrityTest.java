package com.catalog.inventory.service;

import com.catalog.inventory.dto.ImportReport;
import com.catalog.inventory.dto.ProductCsvRow;
import com.catalog.inventory.dto.ProductForm;
import com.catalog.inventory.model.Product;
import com.catalog.inventory.repository.InventoryLogRepository;
import com.catalog.inventory.repository.ProductRepository;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

@SpringBootTest
@Transactional
public class ImportExportIntegrityTest {

    @Autowired
    private ProductImportService importService;

    @Autowired
    private ProductExportService exportService;

    @Autowired
    private ProductService productService;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private InventoryLogRepository logRepository;

    private ImportReport importCsv(String csv) {
        return importService.importCsv(new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testDuplicateWithinBatchIsSkipped() {
        ImportReport report = importService.importRows(List.of(
                Map.of("name", "X", "stock", "5"),
                Map.of("name", "X", "stock", "3")).iterator());

        Assertions.assertEquals(1, report.getAdded());
        Assertions.assertEquals(1, report.getSkipped());
        Assertions.assertEquals(1, report.getDuplicates().size());

        List<Product> xs = productService.search("X");
        Assertions.assertEquals(1, xs.size());
        Assertions.assertEquals(5, xs.get(0).getStock());
        Assertions.assertEquals("X", report.getDuplicates().get(0).name());
        Assertions.assertEquals(xs.get(0).getId(), report.getDuplicates().get(0).existingId());
    }

    @Test
    public void testBlankNameIsSkippedWithoutDuplicate() {
        ImportReport report = importService.importRows(List.of(Map.of("name", "", "stock", "5")).iterator());

        Assertions.assertEquals(0, report.getAdded());
        Assertions.assertEquals(1, report.getSkipped());
        Assertions.assertTrue(report.getDuplicates().isEmpty());
        Assertions.assertEquals(0, productRepository.count());
    }

    @Test
    public void testImportDoesNotWriteStockLog() {
        ImportReport report = importCsv("name,unit,stock\nFlour,kg,20\n");

        Assertions.assertEquals(1, report.getAdded());
        Product flour = productService.search("flour").get(0);
        Assertions.assertEquals(20, flour.getStock());
        Assertions.assertEquals("kg", flour.getUnit());
        Assertions.assertEquals(Product.STATUS_IN_STOCK, flour.getStatus());
        Assertions.assertEquals(0, logRepository.countByProductId(flour.getId()));
    }

    @Test
    public void testCsvRowsConflictWithExistingCatalogIgnoringCase() {
        Product sugar = productService.create(new ProductForm("Sugar", "2"));

        ImportReport report = importCsv("name,stock,status\n\"SUGAR \",9,\nSalt,abc,\n,4,In Stock\n");

        Assertions.assertEquals(1, report.getAdded());
        Assertions.assertEquals(2, report.getSkipped());
        Assertions.assertEquals(sugar.getId(), report.getDuplicates().get(0).existingId());
        Assertions.assertEquals(2, productRepository.findById(sugar.getId()).get().getStock());

        Product salt = productService.search("salt").get(0);
        Assertions.assertEquals(0, salt.getStock());
        Assertions.assertEquals(Product.STATUS_OUT_OF_STOCK, salt.getStatus());
    }

    @Test
    public void testExportIsOldestFirstWithHeader() throws Exception {
        productService.create(new ProductForm("Widget, large", "3"));
        productService.create(new ProductForm("Gadget", null));

        List<ProductCsvRow> rows = exportService.exportRows();
        Assertions.assertEquals("Widget, large", rows.get(0).name());
        Assertions.assertEquals("Gadget", rows.get(1).name());

        String[] lines = exportService.exportCsv().split("\n");
        Assertions.assertEquals("name,unit,category,brand,stock,status,image", lines[0].trim());
        Assertions.assertEquals(3, lines.length);
        Assertions.assertTrue(lines[1].startsWith("\"Widget, large\""));
    }

    @Test
    public void testExportThenImportAddsNothing() throws Exception {
        productService.create(new ProductForm("Apple iPhone 15", "10"));
        productService.create(new ProductForm("Bananas", "0"));
        productService.create(new ProductForm("Nike Shoes", "5"));

        ImportReport report = importCsv(exportService.exportCsv());

        Assertions.assertEquals(0, report.getAdded());
        Assertions.assertEquals(3, report.getSkipped());
        Assertions.assertEquals(3, report.getDuplicates().size());
        Assertions.assertEquals(3, productRepository.count());
    }
}
