package com.leadranker.ranking.csv;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LeadCsvParserTest {

    @Test
    @DisplayName("columns are matched by header name, in any order")
    void headerOrder() {
        List<LeadRow> rows = LeadCsvParser.parse("""
            lead_job_title,account_name,lead_first_name,lead_last_name,account_domain,account_employee_range,account_industry
            VP Sales,Acme,Ann,Lee,acme.com,51-200,Software
            """);

        assertEquals(List.of(new LeadRow("Acme", "Ann", "Lee", "VP Sales", "acme.com", "51-200", "Software")), rows);
    }

    @Test
    @DisplayName("blank optional columns become null; missing columns read as empty")
    void optionalColumns() {
        List<LeadRow> rows = LeadCsvParser.parse("""
            account_name,lead_first_name,lead_last_name,account_domain
            Acme,Ann,Lee,
            """);

        LeadRow row = rows.get(0);
        assertEquals("", row.jobTitle());
        assertNull(row.accountDomain());
        assertNull(row.employeeRange());
        assertNull(row.industry());
    }

    @Test
    @DisplayName("rows without an account name are skipped")
    void skipsNamelessRows() {
        List<LeadRow> rows = LeadCsvParser.parse("""
            account_name,lead_first_name,lead_last_name,lead_job_title
            ,Ann,Lee,CEO
            Globex,Bo,Ray,CRO
            """);

        assertEquals(1, rows.size());
        assertEquals("Globex", rows.get(0).accountName());
    }

    @Test
    @DisplayName("header without account_name is rejected")
    void missingAccountName() {
        assertThrows(IllegalArgumentException.class,
            () -> LeadCsvParser.parse("first,last\nAnn,Lee\n"));
    }
}
