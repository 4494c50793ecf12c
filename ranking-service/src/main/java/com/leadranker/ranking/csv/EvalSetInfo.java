package com.leadranker.ranking.csv;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.leadranker.common.model.EvalLead;

import java.util.List;

public record EvalSetInfo(
    @JsonProperty("totalLeads")      int totalLeads,
    @JsonProperty("relevantLeads")   int relevantLeads,
    @JsonProperty("irrelevantLeads") int irrelevantLeads,
    @JsonProperty("uniqueCompanies") int uniqueCompanies
) {
    public static EvalSetInfo of(List<EvalLead> leads) {
        int relevant = (int) leads.stream().filter(EvalLead::isRelevant).count();
        int companies = (int) leads.stream().map(EvalLead::company).distinct().count();
        return new EvalSetInfo(leads.size(), relevant, leads.size() - relevant, companies);
    }
}
