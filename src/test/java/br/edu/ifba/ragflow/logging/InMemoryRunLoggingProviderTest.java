package br.edu.ifba.ragflow.logging;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRunLoggingProviderTest {

    private InMemoryRunLoggingProvider provider;

    @BeforeEach
    void setUp() {
        provider = new InMemoryRunLoggingProvider();
    }

    @Test
    @DisplayName("should return the most recent entries per run, oldest first")
    void shouldLimitEntriesPerRun() throws Exception {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        for (int i = 0; i < 5; i++) {
            provider.log(first, "key", "v" + i).get();
        }
        provider.log(second, "other", "x").get();

        List<RunLogEntry> entries = provider.getLogs(List.of(first, second), 2).get();

        assertEquals(List.of("v3", "v4", "x"), entries.stream().map(RunLogEntry::value).toList());
    }

    @Test
    @DisplayName("should filter info logs by run type")
    void shouldFilterInfoLogs() throws Exception {
        provider.infoLog(UUID.randomUUID(), RunType.RETRIEVAL, "a").get();
        provider.infoLog(UUID.randomUUID(), RunType.INGESTION, "b").get();
        provider.infoLog(UUID.randomUUID(), RunType.RETRIEVAL, "c").get();

        List<RunInfoLog> retrieval = provider.getInfoLogs(10, RunType.RETRIEVAL).get();
        List<RunInfoLog> limited = provider.getInfoLogs(1, null).get();

        assertEquals(2, retrieval.size());
        assertTrue(retrieval.stream().allMatch(info -> info.runType() == RunType.RETRIEVAL));
        assertEquals(1, limited.size());
    }

    @Test
    @DisplayName("should return nothing for unknown runs")
    void shouldIgnoreUnknownRuns() throws Exception {
        assertTrue(provider.getLogs(List.of(UUID.randomUUID()), 10).get().isEmpty());
    }
}
