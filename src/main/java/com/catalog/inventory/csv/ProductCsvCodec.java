package com.catalog.inventory.csv;

import com.catalog.inventory.dto.ProductCsvRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes product CSV files. The first line of an input file is the
 * header and names the columns of every following row.
 */
@Component
public class ProductCsvCodec {

    private final CsvMapper csvMapper;
    private final CsvSchema exportSchema;

    public ProductCsvCodec() {
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.ALLOW_TRAILING_COMMA)
                .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .build();
        this.exportSchema = csvMapper.schemaFor(ProductCsvRow.class).withHeader();
    }

    /**
     * Rows are parsed lazily as the iterator advances. The caller closes it.
     */
    public MappingIterator<Map<String, String>> readRows(InputStream in) throws IOException {
        return csvMapper.readerForMapOf(String.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(in);
    }

    public String write(List<ProductCsvRow> rows) throws JsonProcessingException {
        return csvMapper.writer(exportSchema).writeValueAsString(rows);
    }
}
