package com.leadranker.ranking.dto;

import java.util.Locale;

/**
 * Paging, sorting and filtering of the lead list. Rank sorting always puts
 * unranked leads last; name sorting uses the last name.
 */
public record LeadListQuery(int page, int pageSize, SortBy sortBy, boolean descending, boolean showIrrelevant) {

    public enum SortBy { RANK, NAME, COMPANY }

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE     = 100;

    /** @throws IllegalArgumentException for out-of-range paging or unknown sort values */
    public static LeadListQuery of(Integer page, Integer pageSize, String sortBy, String sortOrder,
                                   Boolean showIrrelevant) {
        int p  = page != null ? page : 1;
        int ps = pageSize != null ? pageSize : DEFAULT_PAGE_SIZE;
        if (p < 1) throw new IllegalArgumentException("page must be at least 1");
        if (ps < 1 || ps > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        SortBy sort = sortBy == null ? SortBy.RANK : SortBy.valueOf(sortBy.trim().toUpperCase(Locale.ROOT));
        String order = sortOrder == null ? "asc" : sortOrder.trim().toLowerCase(Locale.ROOT);
        if (!order.equals("asc") && !order.equals("desc")) {
            throw new IllegalArgumentException("sortOrder must be asc or desc");
        }
        return new LeadListQuery(p, ps, sort, order.equals("desc"), showIrrelevant == null || showIrrelevant);
    }

    public long offset() {
        return (long) (page - 1) * pageSize;
    }

    /** ORDER BY clause built from enum values only. */
    public String orderByClause() {
        String primary = switch (sortBy) {
            case RANK    -> descending ? "COALESCE(r.rank, -1) DESC" : "COALESCE(r.rank, 999) ASC";
            case NAME    -> "l.last_name " + (descending ? "DESC" : "ASC");
            case COMPANY -> "l.account_name " + (descending ? "DESC" : "ASC");
        };
        return primary + ", l.id ASC";
    }
}
