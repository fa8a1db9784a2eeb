package com.catalog.inventory.service;

import com.catalog.inventory.dto.DeleteResult;
import com.catalog.inventory.dto.ProductForm;
import com.catalog.inventory.exception.ConflictException;
import com.catalog.inventory.exception.NotFoundException;
import com.catalog.inventory.exception.ValidationException;
import com.catalog.inventory.model.Product;
import com.catalog.inventory.repository.ProductRepository;
import com.catalog.inventory.util.StockValues;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
public class ProductService {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ProductService.class);

    static final String NAME_REQUIRED = "Name is required";
    static final String NAME_TAKEN = "Product name already exists";
    static final String STOCK_NEGATIVE = "Stock must be >= 0";
    static final String STOCK_INVALID = "Stock must be a number >= 0";
    static final String STOCK_TOO_LARGE = "Stock must be <= " + Integer.MAX_VALUE;
    static final String NAME_TOO_LONG = "Name must be at most " + Product.NAME_MAX_LENGTH + " characters";
    static final String NOT_FOUND = "Product not found";

    private final ProductRepository productRepository;
    private final StockLedgerService stockLedgerService;

    public ProductService(ProductRepository productRepository, StockLedgerService stockLedgerService) {
        this.productRepository = productRepository;
        this.stockLedgerService = stockLedgerService;
    }

    @Transactional(readOnly = true)
    public List<Product> list() {
        return productRepository.findAllByOrderByIdDesc();
    }

    @Transactional(readOnly = true)
    public List<Product> search(String name) {
        if (!StringUtils.hasLength(name)) {
            return list();
        }
        return productRepository.findByNameContainingIgnoreCaseOrderByIdDesc(name);
    }

    @Transactional
    public Product create(ProductForm form) {
        String name = requireName(form.getName());

        // Missing or unparseable stock means zero here, unlike update
        int stock = 0;
        Optional<BigDecimal> number = StockValues.parse(form.getStock());
        if (number.isPresent()) {
            if (number.get().signum() < 0) {
                throw new ValidationException(STOCK_NEGATIVE);
            }
            stock = StockValues.toStock(number.get())
                    .orElseThrow(() -> new ValidationException(STOCK_TOO_LARGE));
        }

        if (productRepository.findFirstByNameIgnoreCaseOrderByIdAsc(name).isPresent()) {
            throw new ConflictException(NAME_TAKEN);
        }

        Product product = new Product();
        product.setName(name);
        product.setUnit(orEmpty(form.getUnit()));
        product.setCategory(orEmpty(form.getCategory()));
        product.setBrand(orEmpty(form.getBrand()));
        product.setStock(stock);
        product.setStatus(StringUtils.hasText(form.getStatus()) ? form.getStatus() : Product.defaultStatusFor(stock));
        product.setImage(orEmpty(form.getImage()));

        Product saved = productRepository.save(product);

        if (stock > 0) {
            stockLedgerService.record(saved.getId(), 0, stock, form.getChangedBy());
        }

        logger.info("Created product {} '{}' with stock {}", saved.getId(), saved.getName(), stock);
        return saved;
    }

    /**
     * Replaces the product's fields. Name and stock are mandatory; the other
     * fields keep their stored value when the form leaves them out.
     */
    @Transactional
    public Product update(Long id, ProductForm form) {
        String name = requireName(form.getName());

        BigDecimal number = StockValues.parse(form.getStock())
                .orElseThrow(() -> new ValidationException(STOCK_INVALID));
        if (number.signum() < 0) {
            throw new ValidationException(STOCK_INVALID);
        }
        int stock = StockValues.toStock(number)
                .orElseThrow(() -> new ValidationException(STOCK_TOO_LARGE));

        if (productRepository.existsByNameIgnoreCaseAndIdNot(name, id)) {
            throw new ConflictException(NAME_TAKEN);
        }

        Product product = productRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(NOT_FOUND));

        int oldStock = product.getStock();

        product.setName(name);
        product.setStock(stock);
        if (form.getUnit() != null)
            product.setUnit(form.getUnit());
        if (form.getCategory() != null)
            product.setCategory(form.getCategory());
        if (form.getBrand() != null)
            product.setBrand(form.getBrand());
        if (form.getStatus() != null)
            product.setStatus(form.getStatus());
        if (form.getImage() != null)
            product.setImage(form.getImage());
        product.setUpdatedAt(LocalDateTime.now());

        Product saved = productRepository.saveAndFlush(product);

        if (oldStock != stock) {
            stockLedgerService.record(id, oldStock, stock, form.getChangedBy());
        }

        logger.info("Updated product {} (stock {} -> {})", id, oldStock, stock);
        return saved;
    }

    /**
     * Deletes the product together with its stock history. Deleting an id that
     * does not exist is not an error.
     */
    @Transactional
    public DeleteResult delete(Long id) {
        int purged = stockLedgerService.purge(id);
        productRepository.findById(id).ifPresentOrElse(
                product -> {
                    productRepository.delete(product);
                    logger.info("Deleted product {} '{}' and {} stock log entries", id, product.getName(), purged);
                },
                () -> logger.debug("Delete of product {} ignored, no such product", id));
        return new DeleteResult(id);
    }

    private static String requireName(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new ValidationException(NAME_REQUIRED);
        }
        String name = raw.trim();
        if (name.length() > Product.NAME_MAX_LENGTH) {
            throw new ValidationException(NAME_TOO_LONG);
        }
        return name;
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
