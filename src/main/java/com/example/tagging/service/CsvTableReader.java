package com.example.tagging.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a headed CSV file into one map per row.
 * The separator is {@code ;} when the header line contains one, {@code ,} otherwise.
 * <p>
 * A row with more non-empty fields than the header is skipped with a warning; the rest of
 * the file is still read. Short rows simply lack the trailing columns.
 */
public final class CsvTableReader {

    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private CsvTableReader() {
    }

    public static List<Map<String, String>> read(Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        int eol = text.indexOf('\n');
        String headerLine = eol >= 0 ? text.substring(0, eol) : text;
        char separator = headerLine.contains(";") ? ';' : ',';
        log.debug("Reading {} with separator '{}'", file, separator);

        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(separator);
        List<Map<String, String>> rows = new ArrayList<>();
        try (MappingIterator<String[]> it = CSV_MAPPER.readerFor(String[].class)
                .with(schema)
                .readValues(text)) {
            if (!it.hasNextValue()) {
                return rows;
            }
            String[] header = it.nextValue();
            int rowNumber = 0;
            while (it.hasNextValue()) {
                String[] fields = it.nextValue();
                rowNumber++;
                if (hasExtraValues(fields, header.length)) {
                    log.warn("{}: skipping row {}, {} fields for {} columns",
                            file.getFileName(), rowNumber, fields.length, header.length);
                    continue;
                }
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < header.length && i < fields.length; i++) {
                    row.put(header[i].strip(), fields[i]);
                }
                rows.add(row);
            }
        }
        return rows;
    }

    /** First non-blank value among the given columns, stripped, or empty string. */
    public static String value(Map<String, String> row, String... columns) {
        for (String column : columns) {
            String v = row.get(column);
            if (v != null && !v.isBlank()) {
                return v.strip();
            }
        }
        return "";
    }

    private static boolean hasExtraValues(String[] fields, int columns) {
        for (int i = columns; i < fields.length; i++) {
            if (fields[i] != null && !fields[i].isBlank()) {
                return true;
            }
        }
        return false;
    }
}
