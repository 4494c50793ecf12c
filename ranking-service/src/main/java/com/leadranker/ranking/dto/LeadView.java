package com.leadranker.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A lead joined with its current ranking; ranking fields are null when unranked. */
public record LeadView(
    @JsonProperty("id")             String  id,
    @JsonProperty("firstName")      String  firstName,
    @JsonProperty("lastName")       String  lastName,
    @JsonProperty("jobTitle")       String  jobTitle,
    @JsonProperty("accountName")    String  accountName,
    @JsonProperty("accountDomain")  String  accountDomain,
    @JsonProperty("employeeRange")  String  employeeRange,
    @JsonProperty("industry")       String  industry,
    @JsonProperty("rank")           Integer rank,
    @JsonProperty("reasoning")      String  reasoning,
    @JsonProperty("relevanceScore") Double  relevanceScore
) {}
