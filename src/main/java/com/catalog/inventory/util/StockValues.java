package com.catalog.inventory.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Parsing of stock quantities as they arrive from JSON bodies and CSV cells.
 * Parsing and conversion are separate steps so callers can tell a value that
 * is not a number from a negative number or one that does not fit a stock count.
 */
public final class StockValues {

    private static final BigDecimal MAX_STOCK = BigDecimal.valueOf(Integer.MAX_VALUE);

    private StockValues() {
    }

    /**
     * Parses a decimal number. Blank and non-numeric input yield an empty result.
     */
    public static Optional<BigDecimal> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(raw.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Converts a non-negative number to a stock count, dropping any fraction
     * ("7.9" is 7). Empty when the number is larger than an int can hold.
     */
    public static OptionalInt toStock(BigDecimal number) {
        if (number.signum() < 0) {
            throw new IllegalArgumentException("Negative stock: " + number);
        }
        // compare before scaling, "1e999999999" must not be expanded
        if (number.compareTo(MAX_STOCK) > 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(number.setScale(0, RoundingMode.DOWN).intValueExact());
    }

    /**
     * Lenient form used by bulk import: anything that is not a usable
     * non-negative stock count becomes 0.
     */
    public static int parseOrZero(String raw) {
        return parse(raw)
                .filter(number -> number.signum() >= 0)
                .map(number -> toStock(number).orElse(0))
                .orElse(0);
    }
}
