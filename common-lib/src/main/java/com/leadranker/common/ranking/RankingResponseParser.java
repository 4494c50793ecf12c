package com.leadranker.common.ranking;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadranker.common.model.RankingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts {@link RankingResult}s from raw LLM output.
 *
 * <p>Contract: the returned list always has exactly one entry per requested
 * lead id. Entries matched in the response come first, in response order,
 * followed by placeholders for the ids the model skipped, in request order.
 * A lead id repeated by the model is kept only on its first occurrence.
 * Requested ids are lead primary keys and therefore unique.
 */
public final class RankingResponseParser {

    private static final Logger log = LoggerFactory.getLogger(RankingResponseParser.class);

    static final String NO_PAYLOAD_REASONING = "Parse error: no structured payload found in AI response";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RankingResponseParser() {}

    public static List<RankingResult> parse(String response, List<String> leadIds) {
        JsonNode rankings = extractRankings(response);
        if (rankings == null) {
            log.debug("[ResponseParser] No usable payload. requested={}", leadIds.size());
            return leadIds.stream()
                .map(id -> new RankingResult(id, null, NO_PAYLOAD_REASONING))
                .toList();
        }

        Set<String> requested = new LinkedHashSet<>(leadIds);
        Set<String> kept      = new LinkedHashSet<>();
        List<RankingResult> results = new ArrayList<>(leadIds.size());

        for (JsonNode item : rankings) {
            JsonNode idNode = item.path("leadId");
            if (idNode.isMissingNode() || idNode.isNull()) continue;
            String leadId = idNode.asText();
            if (!requested.contains(leadId) || !kept.add(leadId)) continue;

            results.add(new RankingResult(leadId, toRank(item.path("rank")), item.path("reasoning").asText("")));
        }

        for (String id : requested) {
            if (!kept.contains(id)) {
                results.add(RankingResult.failed(id));
            }
        }
        return results;
    }

    /** Greedy first-'{' to last-'}' span, decoded; {@code null} unless it holds a {@code rankings} array. */
    private static JsonNode extractRankings(String response) {
        if (response == null) return null;
        int start = response.indexOf('{');
        int end   = response.lastIndexOf('}');
        if (start < 0 || end <= start) return null;

        try {
            JsonNode root = MAPPER.readTree(response.substring(start, end + 1));
            JsonNode rankings = root.path("rankings");
            return rankings.isArray() ? rankings : null;
        } catch (Exception e) {
            log.debug("[ResponseParser] Payload not decodable. reason={}", e.getMessage());
            return null;
        }
    }

    private static Integer toRank(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) return null;
        if (node.isNumber()) return roundToInt(node.asDouble());
        if (node.isTextual()) {
            try {
                return roundToInt(Double.parseDouble(node.asText().trim()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** {@code null} for non-finite values and anything that does not fit an int once rounded. */
    private static Integer roundToInt(double value) {
        if (!Double.isFinite(value)) return null;
        try {
            return Math.toIntExact(Math.round(value));
        } catch (ArithmeticException e) {
            return null;
        }
    }
}
