package com.leadranker.ranking.service;

import com.leadranker.ranking.store.PromptVersion;
import com.leadranker.ranking.support.InMemoryPromptStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptServiceTest {

    private InMemoryPromptStore store;
    private PromptService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryPromptStore();
        service = new PromptService(store);
    }

    @Nested
    @DisplayName("getActivePromptWithVersion()")
    class ActivePrompt {

        @Test
        @DisplayName("empty table → default prompt created once as active version 1")
        void createsDefaultOnce() {
            PromptVersion first = service.getActivePromptWithVersion().block();
            PromptVersion second = service.getActivePromptWithVersion().block();

            assertNotNull(first);
            assertEquals(1, first.version());
            assertTrue(first.active());
            assertEquals(PromptService.DEFAULT_PROMPT, first.content());
            assertEquals(first.version(), second.version());
            assertEquals(1, store.rows.size());
        }

        @Test
        @DisplayName("only inactive rows → default created at the next free version")
        void defaultAfterInactiveRows() {
            store.insert(PromptVersion.draft(4, "old candidate", 0.7, false, 2, 3)).block();

            PromptVersion created = service.getActivePromptWithVersion().block();

            assertEquals(5, created.version());
            assertTrue(created.active());
        }

        @Test
        @DisplayName("existing active prompt is returned untouched")
        void returnsExisting() {
            store.seedActive(3, "custom");

            PromptVersion active = service.getActivePromptWithVersion().block();

            assertEquals(3, active.version());
            assertEquals("custom", active.content());
            assertEquals(1, store.rows.size());
        }
    }

    @Nested
    @DisplayName("selectPromptForRanking()")
    class Selection {

        private final PromptVersion base = PromptVersion.draft(2, "base", null, true, 0, null);

        @Test
        @DisplayName("override replaces content and keeps the canonical version")
        void overrideKeepsVersion() {
            PromptVersion selected = PromptService.selectPromptForRanking(base, "alt");
            assertEquals("alt", selected.content());
            assertEquals(2, selected.version());
        }

        @Test
        @DisplayName("no override → base unchanged")
        void noOverride() {
            assertSame(base, PromptService.selectPromptForRanking(base, null));
            assertSame(base, PromptService.selectPromptForRanking(base, "  "));
        }
    }

    @Nested
    @DisplayName("activatePrompt()")
    class Activation {

        @Test
        @DisplayName("flips the active flag to the requested version only")
        void activates() {
            store.seedActive(1, "one");
            store.insert(PromptVersion.draft(2, "two", 0.9, false, 1, 1)).block();

            PromptVersion activated = service.activatePrompt(2).block();

            assertEquals(2, activated.version());
            List<PromptVersion> active = store.rows.stream().filter(PromptVersion::active).toList();
            assertEquals(1, active.size());
            assertEquals(2, active.get(0).version());
        }

        @Test
        @DisplayName("unknown version → IllegalArgumentException, nothing changes")
        void unknownVersion() {
            store.seedActive(1, "one");

            assertThrows(IllegalArgumentException.class, () -> service.activatePrompt(9).block());
            assertTrue(store.rows.get(0).active());
        }
    }

    @Test
    @DisplayName("history is ordered by version descending")
    void historyOrder() {
        store.seedActive(1, "one");
        store.insert(PromptVersion.draft(3, "three", 0.8, false, 2, 1)).block();
        store.insert(PromptVersion.draft(2, "two", 0.7, false, 1, 1)).block();

        List<Integer> versions = service.getOptimizationHistory().map(PromptVersion::version).collectList().block();

        assertEquals(List.of(3, 2, 1), versions);
    }
}
