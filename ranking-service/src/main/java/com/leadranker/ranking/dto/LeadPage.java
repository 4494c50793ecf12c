package com.leadranker.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LeadPage(
    @JsonProperty("leads")      List<LeadView> leads,
    @JsonProperty("pagination") Pagination     pagination
) {
    public record Pagination(
        @JsonProperty("page")       int  page,
        @JsonProperty("pageSize")   int  pageSize,
        @JsonProperty("totalCount") long totalCount,
        @JsonProperty("totalPages") long totalPages
    ) {
        public static Pagination of(int page, int pageSize, long totalCount) {
            return new Pagination(page, pageSize, totalCount, (totalCount + pageSize - 1) / pageSize);
        }
    }
}
