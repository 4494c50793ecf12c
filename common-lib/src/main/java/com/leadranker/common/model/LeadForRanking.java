package com.leadranker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only snapshot of a stored lead, taken once per ranking run.
 * {@code employeeRange} and {@code industry} are nullable.
 */
public record LeadForRanking(
    @JsonProperty("id")            String id,
    @JsonProperty("firstName")     String firstName,
    @JsonProperty("lastName")      String lastName,
    @JsonProperty("jobTitle")      String jobTitle,
    @JsonProperty("companyName")   String companyName,
    @JsonProperty("employeeRange") String employeeRange,
    @JsonProperty("industry")      String industry
) {
    public String fullName() {
        return (firstName + " " + lastName).trim();
    }
}
