package com.leadranker.ranking.csv;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the lead import CSV. Columns are matched by header name:
 * {@code account_name, lead_first_name, lead_last_name, lead_job_title,
 * account_domain, account_employee_range, account_industry}.
 */
public final class LeadCsvParser {

    static final String ACCOUNT_NAME   = "account_name";
    static final String FIRST_NAME     = "lead_first_name";
    static final String LAST_NAME      = "lead_last_name";
    static final String JOB_TITLE      = "lead_job_title";
    static final String ACCOUNT_DOMAIN = "account_domain";
    static final String EMPLOYEE_RANGE = "account_employee_range";
    static final String INDUSTRY       = "account_industry";

    private LeadCsvParser() {}

    /** @throws IllegalArgumentException when the header lacks {@code account_name} */
    public static List<LeadRow> parse(String content) {
        List<List<String>> rows = CsvRows.read(content);
        if (rows.isEmpty()) return List.of();

        Map<String, Integer> columns = new HashMap<>();
        List<String> header = rows.get(0);
        for (int i = 0; i < header.size(); i++) {
            columns.putIfAbsent(header.get(i).trim(), i);
        }
        if (!columns.containsKey(ACCOUNT_NAME)) {
            throw new IllegalArgumentException("CSV header must contain " + ACCOUNT_NAME);
        }

        List<LeadRow> leads = new ArrayList<>();
        for (List<String> row : rows.subList(1, rows.size())) {
            String accountName = value(row, columns, ACCOUNT_NAME);
            if (accountName.isEmpty()) continue;
            leads.add(new LeadRow(
                accountName,
                value(row, columns, FIRST_NAME),
                value(row, columns, LAST_NAME),
                value(row, columns, JOB_TITLE),
                CsvRows.blankToNull(value(row, columns, ACCOUNT_DOMAIN)),
                CsvRows.blankToNull(value(row, columns, EMPLOYEE_RANGE)),
                CsvRows.blankToNull(value(row, columns, INDUSTRY))));
        }
        return leads;
    }

    private static String value(List<String> row, Map<String, Integer> columns, String column) {
        Integer index = columns.get(column);
        return index == null ? "" : CsvRows.cell(row, index);
    }
}
