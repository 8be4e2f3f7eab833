package br.edu.ifba.ragflow.config;

import br.edu.ifba.ragflow.rag.RagPrompts;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RagFlowConfigTest {

    private static RagFlowConfig load(Map<String, String> properties) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(properties, "test", 100))
                .withMapping(RagFlowConfig.class)
                .build();
        return config.getConfigMapping(RagFlowConfig.class);
    }

    @Test
    @DisplayName("should apply defaults when nothing is configured")
    void shouldApplyDefaults() {
        RagFlowConfig config = load(Map.of());

        assertEquals(100, config.pipe().maxLogQueueSize());
        assertEquals(100, config.search().branchQueueSize());
        assertEquals("ragflow-pipeline", config.executor().namePrefix());
        assertEquals(4000, config.rag().maxContextTokens());
        assertEquals(RagPrompts.defaults(), config.toRagPrompts());
        assertDoesNotThrow(config::validate);
    }

    @Test
    @DisplayName("should read configured values and prompts")
    void shouldReadConfiguredValues() {
        RagFlowConfig config = load(Map.of(
                "ragflow.pipe.max-log-queue-size", "8",
                "ragflow.search.branch-queue-size", "16",
                "ragflow.rag.system-prompt", "Be brief.",
                "ragflow.rag.task-prompt", "{query} -> {context}",
                "ragflow.rag.max-context-tokens", "512"));

        assertEquals(8, config.pipe().maxLogQueueSize());
        assertEquals(16, config.search().branchQueueSize());
        assertEquals(new RagPrompts("Be brief.", "{query} -> {context}", 512), config.toRagPrompts());
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("should reject a non-positive log queue size")
        void shouldRejectLogQueueSize() {
            RagFlowConfig config = load(Map.of("ragflow.pipe.max-log-queue-size", "0"));

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, config::validate);
            assertTrue(e.getMessage().contains("log queue"));
        }

        @Test
        @DisplayName("should reject a non-positive branch queue size")
        void shouldRejectBranchQueueSize() {
            RagFlowConfig config = load(Map.of("ragflow.search.branch-queue-size", "-1"));

            assertThrows(IllegalArgumentException.class, config::validate);
        }

        @Test
        @DisplayName("should reject a blank executor name prefix")
        void shouldRejectBlankPrefix() {
            RagFlowConfig config = load(Map.of("ragflow.executor.name-prefix", " "));

            assertThrows(IllegalArgumentException.class, config::validate);
        }
    }
}
