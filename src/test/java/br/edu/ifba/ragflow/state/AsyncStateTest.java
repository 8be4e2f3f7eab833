package br.edu.ifba.ragflow.state;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AsyncStateTest {

    private AsyncState state;

    @BeforeEach
    void setUp() {
        state = new AsyncState();
    }

    @Nested
    @DisplayName("publish and read")
    class PublishAndRead {

        @Test
        @DisplayName("should merge fields published by the same stage")
        void shouldMergeFields() {
            state.publish("search", Map.of("results", List.of("a")));
            state.publish("search", Map.of("count", 1));

            assertEquals(List.of("a"), state.read("search", "results"));
            assertEquals(1, state.read("search", "count"));
        }

        @Test
        @DisplayName("should replace a field published twice")
        void shouldReplaceField() {
            state.publish("search", Map.of("count", 1));
            state.publish("search", Map.of("count", 2));

            assertEquals(2, state.read("search", "count"));
        }

        @Test
        @DisplayName("should return the default for a missing field of a known stage")
        void shouldReturnDefaultForMissingField() {
            state.publish("search", Map.of("count", 1));

            assertEquals("fallback", state.read("search", "missing", "fallback"));
            assertNull(state.read("search", "missing"));
        }

        @Test
        @DisplayName("should fail when reading a stage that never published")
        void shouldFailForUnknownStage() {
            StageNotFoundException e = assertThrows(StageNotFoundException.class,
                    () -> state.read("never", "field", "default"));
            assertEquals("never", e.getStageName());
        }

        @Test
        @DisplayName("should keep stores of different runs isolated")
        void shouldIsolateStores() {
            AsyncState other = new AsyncState();
            state.publish("search", Map.of("count", 1));

            assertFalse(other.contains("search"));
            assertThrows(StageNotFoundException.class, () -> other.read("search", "count"));
        }

        @Test
        @DisplayName("should list stages in publish order")
        void shouldListStages() {
            state.publish("first", Map.of("a", 1));
            state.publish("second", Map.of("b", 2));

            assertEquals(List.of("first", "second"), new ArrayList<>(state.stages()));
        }

        @Test
        @DisplayName("should keep publish order for many stages regardless of their names")
        void shouldKeepPublishOrderForManyStages() {
            List<String> names = new ArrayList<>();
            for (int i = 40; i > 0; i--) {
                names.add("stage_" + (char) ('a' + i % 26) + i);
            }
            names.forEach(name -> state.publish(name, Map.of("value", name)));
            state.publish(names.get(0), Map.of("again", true));

            assertEquals(names, new ArrayList<>(state.stages()));
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("should remove a single field")
        void shouldRemoveField() {
            state.publish("search", Map.of("a", 1, "b", 2));

            state.delete("search", "a");

            assertNull(state.read("search", "a"));
            assertEquals(2, state.read("search", "b"));
        }

        @Test
        @DisplayName("should remove the whole stage")
        void shouldRemoveStage() {
            state.publish("search", Map.of("a", 1));

            state.delete("search");

            assertEquals(Set.of(), state.stages());
        }

        @Test
        @DisplayName("should fail for unknown stage or field")
        void shouldFailForUnknownTargets() {
            state.publish("search", Map.of("a", 1));

            assertThrows(StageNotFoundException.class, () -> state.delete("other"));
            FieldNotFoundException e = assertThrows(FieldNotFoundException.class,
                    () -> state.delete("search", "missing"));
            assertEquals("search", e.getStageName());
            assertEquals("missing", e.getFieldName());
        }
    }

    @Test
    @DisplayName("should not lose concurrent writes")
    void shouldNotLoseConcurrentWrites() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 200; i++) {
                int index = i;
                futures.add(executor.submit(() -> {
                    start.await();
                    state.publish("stage", Map.of("field-" + index, index));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        for (int i = 0; i < 200; i++) {
            assertEquals(i, state.read("stage", "field-" + i));
        }
    }
}
