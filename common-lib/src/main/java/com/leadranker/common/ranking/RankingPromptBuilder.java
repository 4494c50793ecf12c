package com.leadranker.common.ranking;

import com.leadranker.common.model.LeadForRanking;

import java.util.List;

/**
 * Assembles the per-company ranking request sent to the LLM.
 *
 * <p>The base prompt is embedded verbatim and is opaque to this class. The
 * trailing instruction block fixes the response contract that
 * {@link RankingResponseParser} relies on.
 */
public final class RankingPromptBuilder {

    static final String UNKNOWN_SIZE     = "Unknown size";
    static final String UNKNOWN_INDUSTRY = "Unknown";

    static final String RESPONSE_CONTRACT = """
        Respond with a JSON object in this exact format:
        {
          "rankings": [
            {
              "leadId": "<lead id>",
              "rank": <number 1-10 or null if irrelevant>,
              "reasoning": "<brief explanation>"
            }
          ]
        }

        Important:
        - Use null for rank if the lead is in a hard exclusion category (HR, Finance, Engineering, etc.)
        - Lower numbers = better fit (1 is the best)
        - Consider company size when ranking - a CEO at a startup ranks differently than at an enterprise
        - Be concise in your reasoning (1-2 sentences max)""";

    private RankingPromptBuilder() {}

    /**
     * Builds the request for one company group. Company metadata is taken from
     * the first lead of the group.
     *
     * @param basePrompt   the ranking instructions (active prompt or a candidate)
     * @param companyLeads leads of a single company, never empty
     * @throws IllegalArgumentException when {@code companyLeads} is null or empty
     */
    public static String build(String basePrompt, List<LeadForRanking> companyLeads) {
        if (companyLeads == null || companyLeads.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a ranking prompt for an empty lead group");
        }
        LeadForRanking company = companyLeads.get(0);

        StringBuilder leadsInfo = new StringBuilder();
        for (int i = 0; i < companyLeads.size(); i++) {
            LeadForRanking lead = companyLeads.get(i);
            if (i > 0) leadsInfo.append("\n\n");
            leadsInfo.append(i + 1).append(". ID: ").append(lead.id()).append('\n')
                .append("   Name: ").append(lead.fullName()).append('\n')
                .append("   Title: ").append(lead.jobTitle());
        }

        return """
            %s

            ---

            Now rank the following leads from %s (%s employees, Industry: %s):

            %s

            %s""".formatted(
                basePrompt,
                company.companyName(),
                orDefault(company.employeeRange(), UNKNOWN_SIZE),
                orDefault(company.industry(), UNKNOWN_INDUSTRY),
                leadsInfo,
                RESPONSE_CONTRACT);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
