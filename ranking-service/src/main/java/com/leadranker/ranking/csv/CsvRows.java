package com.leadranker.ranking.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Reads CSV text as raw rows of trimmed cells, quoting handled. */
final class CsvRows {

    private static final CsvMapper MAPPER = CsvMapper.builder()
        .enable(CsvParser.Feature.WRAP_AS_ARRAY)
        .enable(CsvParser.Feature.TRIM_SPACES)
        .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
        .build();

    private CsvRows() {}

    /** All rows including the header; blank lines dropped. */
    static List<List<String>> read(String content) {
        if (content == null || content.isBlank()) return List.of();
        try (MappingIterator<String[]> rows = MAPPER.readerFor(String[].class)
                .with(CsvSchema.emptySchema())
                .readValues(content.strip())) {
            List<List<String>> result = new ArrayList<>();
            while (rows.hasNextValue()) {
                result.add(Arrays.asList(rows.nextValue()));
            }
            return result;
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed CSV: " + e.getMessage(), e);
        }
    }

    static String cell(List<String> row, int index) {
        return index < row.size() && row.get(index) != null ? row.get(index).trim() : "";
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
