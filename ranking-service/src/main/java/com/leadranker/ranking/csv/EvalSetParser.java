package com.leadranker.ranking.csv;

import com.leadranker.common.model.EvalLead;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses labelled evaluation CSV. The header row is skipped; columns are read
 * by position: Full Name, Title, Company, LI, Employee Range, Rank. Extra
 * columns are ignored and rows with fewer than six columns are dropped. A rank
 * of {@code -}, blank or non-numeric means irrelevant.
 */
public final class EvalSetParser {

    static final int REQUIRED_COLUMNS = 6;

    private EvalSetParser() {}

    public static List<EvalLead> parse(String content) {
        List<List<String>> rows = CsvRows.read(content);
        List<EvalLead> leads = new ArrayList<>();
        for (List<String> row : rows.subList(Math.min(1, rows.size()), rows.size())) {
            if (row.size() < REQUIRED_COLUMNS) continue;
            leads.add(new EvalLead(
                CsvRows.cell(row, 0),
                CsvRows.cell(row, 1),
                CsvRows.cell(row, 2),
                CsvRows.cell(row, 3),
                CsvRows.cell(row, 4),
                parseRank(CsvRows.cell(row, 5))));
        }
        return leads;
    }

    static Integer parseRank(String value) {
        if (value.isEmpty() || "-".equals(value)) return null;
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
