package com.catalog.inventory.controller;

import com.catalog.inventory.dto.DeleteResult;
import com.catalog.inventory.dto.ImportReport;
import com.catalog.inventory.dto.ProductForm;
import com.catalog.inventory.exception.ValidationException;
import com.catalog.inventory.model.InventoryLog;
import com.catalog.inventory.model.Product;
import com.catalog.inventory.service.ProductExportService;
import com.catalog.inventory.service.ProductImportService;
import com.catalog.inventory.service.ProductService;
import com.catalog.inventory.service.StockLedgerService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/products")
public class ProductController {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ProductController.class);

    private final ProductService productService;
    private final StockLedgerService stockLedgerService;
    private final ProductImportService importService;
    private final ProductExportService exportService;

    public ProductController(ProductService productService, StockLedgerService stockLedgerService,
            ProductImportService importService, ProductExportService exportService) {
        this.productService = productService;
        this.stockLedgerService = stockLedgerService;
        this.importService = importService;
        this.exportService = exportService;
    }

    @GetMapping
    public List<Product> list() {
        return productService.list();
    }

    @GetMapping("/search")
    public List<Product> search(@RequestParam(name = "name", required = false, defaultValue = "") String name) {
        return productService.search(name);
    }

    @GetMapping("/{id}/history")
    public List<InventoryLog> history(@PathVariable Long id) {
        return stockLedgerService.history(id);
    }

    @PostMapping
    public ResponseEntity<Product> create(@RequestBody ProductForm form) {
        return ResponseEntity.status(HttpStatus.CREATED).body(productService.create(form));
    }

    @PutMapping("/{id}")
    public Product update(@PathVariable Long id, @RequestBody ProductForm form) {
        return productService.update(id, form);
    }

    @DeleteMapping("/{id}")
    public DeleteResult delete(@PathVariable Long id) {
        return productService.delete(id);
    }

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ImportReport importProducts(@RequestParam(name = "file", required = false) MultipartFile file)
            throws IOException {
        if (file == null) {
            throw new ValidationException("No file uploaded");
        }
        logger.info("Importing products from '{}' ({} bytes)", file.getOriginalFilename(), file.getSize());
        try (InputStream in = file.getInputStream()) {
            return importService.importCsv(in);
        }
    }

    @GetMapping("/export")
    public ResponseEntity<byte[]> export() throws IOException {
        byte[] body = exportService.exportCsv().getBytes(StandardCharsets.UTF_8);
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(ProductExportService.EXPORT_FILE_NAME)
                        .build()
                        .toString())
                .body(body);
    }
}
