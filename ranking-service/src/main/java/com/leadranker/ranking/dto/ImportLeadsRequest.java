package com.leadranker.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ImportLeadsRequest(@JsonProperty("csv") String csv) {}
