package com.leadranker.common.ranking;

import com.leadranker.common.model.RankingResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RankingResponseParserTest {

    private static final List<String> IDS = List.of("lead-1", "lead-2", "lead-3");

    @Nested
    @DisplayName("well-formed payloads")
    class WellFormed {

        @Test
        @DisplayName("plain JSON → one result per id with parsed ranks")
        void parsesRanks() {
            String response = """
                {"rankings":[
                  {"leadId":"lead-1","rank":1,"reasoning":"VP Sales"},
                  {"leadId":"lead-2","rank":null,"reasoning":"HR"},
                  {"leadId":"lead-3","rank":4,"reasoning":"Director"}
                ]}""";

            List<RankingResult> results = RankingResponseParser.parse(response, IDS);

            assertEquals(3, results.size());
            assertEquals(new RankingResult("lead-1", 1, "VP Sales"), results.get(0));
            assertNull(results.get(1).rank());
            assertEquals("HR", results.get(1).reasoning());
            assertEquals(4, results.get(2).rank());
        }

        @Test
        @DisplayName("markdown fences and chatter around the object are ignored")
        void toleratesSurroundingText() {
            String response = "Sure! Here you go:\n```json\n"
                + "{\"rankings\":[{\"leadId\":\"lead-2\",\"rank\":\"3\",\"reasoning\":\"ok\"}]}\n```";

            List<RankingResult> results = RankingResponseParser.parse(response, List.of("lead-2"));

            assertEquals(1, results.size());
            assertEquals(3, results.get(0).rank());
        }

        @Test
        @DisplayName("duplicate lead id → first occurrence wins")
        void dedupesDuplicates() {
            String response = """
                {"rankings":[
                  {"leadId":"lead-1","rank":1,"reasoning":"first"},
                  {"leadId":"lead-1","rank":2,"reasoning":"duplicate"},
                  {"leadId":"lead-2","rank":3,"reasoning":"second"}
                ]}""";

            List<RankingResult> results = RankingResponseParser.parse(response, List.of("lead-1", "lead-2"));

            assertEquals(2, results.size());
            List<RankingResult> lead1 = results.stream().filter(r -> r.leadId().equals("lead-1")).toList();
            assertEquals(1, lead1.size());
            assertEquals("first", lead1.get(0).reasoning());
        }

        @Test
        @DisplayName("unknown ids are dropped, missing ids appended after matched ones")
        void fillsMissingIds() {
            String response = """
                {"rankings":[
                  {"leadId":"stranger","rank":1,"reasoning":"not requested"},
                  {"leadId":"lead-3","rank":2,"reasoning":"matched"}
                ]}""";

            List<RankingResult> results = RankingResponseParser.parse(response, IDS);

            assertEquals(List.of("lead-3", "lead-1", "lead-2"),
                results.stream().map(RankingResult::leadId).toList());
            assertEquals(RankingResult.PARSE_FAILURE_REASONING, results.get(1).reasoning());
            assertNull(results.get(2).rank());
        }
    }

    @Nested
    @DisplayName("malformed payloads")
    class Malformed {

        @Test
        @DisplayName("no brace, unbalanced braces, non-JSON body, wrong rankings type → all null ranks")
        void everyResultIsNullRank() {
            List<String> responses = List.of(
                "I cannot rank these leads.",
                "{\"rankings\": [ {\"leadId\": \"lead-1\", \"rank\": 1",
                "} rankings {",
                "{ this is not json }",
                "{\"rankings\": \"lead-1 is great\"}",
                "");

            for (String response : responses) {
                List<RankingResult> results = RankingResponseParser.parse(response, IDS);
                assertEquals(IDS.size(), results.size(), response);
                assertTrue(results.stream().allMatch(r -> r.rank() == null), response);
            }
        }

        @Test
        @DisplayName("ranks beyond the int range or non-finite → null, small out-of-range ranks kept")
        void oversizedRanks() {
            String response = """
                {"rankings":[
                  {"leadId":"lead-1","rank":4294967297,"reasoning":"wraps to 1 if narrowed"},
                  {"leadId":"lead-2","rank":1e20,"reasoning":"huge"},
                  {"leadId":"lead-3","rank":"NaN","reasoning":"not a number"},
                  {"leadId":"lead-4","rank":15,"reasoning":"out of scale"}
                ]}""";

            List<RankingResult> results = RankingResponseParser.parse(response,
                List.of("lead-1", "lead-2", "lead-3", "lead-4"));

            assertNull(results.get(0).rank());
            assertEquals(0.0, results.get(0).relevanceScore());
            assertNull(results.get(1).rank());
            assertNull(results.get(2).rank());
            assertEquals(15, results.get(3).rank());
        }

        @Test
        @DisplayName("null response → all failed")
        void nullResponse() {
            List<RankingResult> results = RankingResponseParser.parse(null, IDS);
            assertEquals(3, results.size());
            assertEquals(RankingResponseParser.NO_PAYLOAD_REASONING, results.get(0).reasoning());
        }
    }

    @Test
    @DisplayName("size contract: exactly one result per requested id, no duplicates")
    void sizeContract() {
        String response = """
            {"rankings":[
              {"leadId":"lead-2","rank":5,"reasoning":"a"},
              {"leadId":"lead-2","rank":6,"reasoning":"b"},
              {"leadId":"lead-9","rank":1,"reasoning":"c"},
              {"rank":2,"reasoning":"no id"}
            ]}""";

        for (int n = 0; n <= 5; n++) {
            List<String> ids = new java.util.ArrayList<>();
            for (int i = 1; i <= n; i++) ids.add("lead-" + i);

            List<RankingResult> results = RankingResponseParser.parse(response, ids);

            assertEquals(ids.size(), results.size());
            Set<String> returned = results.stream().map(RankingResult::leadId).collect(Collectors.toSet());
            assertEquals(new HashSet<>(ids), returned);
        }
    }
}
