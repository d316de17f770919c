package com.machining.kg.service;

import com.machining.kg.config.LoaderProperties;
import com.machining.kg.exception.SchemaViolationException;
import com.machining.kg.schema.SourceColumn;
import com.machining.kg.schema.SourceRow;
import com.machining.kg.schema.SourceTable;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Streams the rows of a delimited source table.
 * Rows are handed to the visitor one at a time so a table never has to fit in memory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CsvSourceReader {

    private final LoaderProperties loaderProperties;

    /**
     * Callback for {@link #read}. Exceptions thrown by the visitor stop the read and propagate.
     */
    public interface RowVisitor {

        void row(SourceRow row);

        void malformed(SchemaViolationException violation);
    }

    /**
     * Read a table, resolving its header against the documented columns.
     *
     * @throws SchemaViolationException if the header lacks a required column
     * @throws IOException if the resource cannot be read
     */
    public void read(SourceTable table, Resource resource, RowVisitor visitor) throws IOException {
        log.info("Reading {} table from {}", table.tableName(), resource.getDescription());

        try (CSVReader reader = new CSVReaderBuilder(
                new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)))
                .withCSVParser(new CSVParserBuilder().withSeparator(loaderProperties.getDelimiter()).build())
                .build()) {

            String[] header = readNext(reader, table, 1);
            if (header == null) {
                throw new SchemaViolationException(table.tableName(), 1, null,
                        "Table '" + table.tableName() + "' has no header line");
            }
            Map<SourceColumn, Integer> columns = table.resolveHeader(header);

            long rowNumber = 1;
            while (true) {
                rowNumber++;
                String[] cells;
                try {
                    cells = readNext(reader, table, rowNumber);
                } catch (SchemaViolationException e) {
                    visitor.malformed(e);
                    continue;
                }
                if (cells == null) {
                    break;
                }
                if (isBlank(cells)) {
                    log.debug("Skipping blank line {} of {}", rowNumber, table.tableName());
                    continue;
                }
                if (cells.length != header.length) {
                    visitor.malformed(new SchemaViolationException(table.tableName(), rowNumber, null,
                            String.format("%s row %d: expected %d cells but found %d",
                                    table.tableName(), rowNumber, header.length, cells.length)));
                    continue;
                }

                Map<SourceColumn, String> values = new LinkedHashMap<>();
                columns.forEach((column, position) -> values.put(column, cells[position]));
                visitor.row(new SourceRow(table, rowNumber, values));
            }
        }
    }

    private String[] readNext(CSVReader reader, SourceTable table, long rowNumber) throws IOException {
        try {
            return reader.readNext();
        } catch (CsvValidationException e) {
            throw new SchemaViolationException(table.tableName(), rowNumber, null,
                    String.format("%s row %d: unparseable line (%s)", table.tableName(), rowNumber, e.getMessage()));
        }
    }

    private boolean isBlank(String[] cells) {
        return Arrays.stream(cells).allMatch(cell -> cell == null || cell.isBlank());
    }
}
