package com.example.kbassist.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Binds properties under {@code kb-assist.*}:
 *
 * kb-assist.model.provider=openai
 * kb-assist.model.base-url=http://localhost:11434/v1
 * kb-assist.index.type=langchain4j
 * kb-assist.index.dimension=384
 * kb-assist.retrieval.top-k=5
 */
@Data
@Validated
@ConfigurationProperties(prefix = "kb-assist")
public class KbAssistProperties {

    @Valid
    private final Model model = new Model();

    @Valid
    private final Index index = new Index();

    @Valid
    private final Retrieval retrieval = new Retrieval();

    @Valid
    private final Chunking chunking = new Chunking();

    @Valid
    private final InteractionLog interactionLog = new InteractionLog();

    public enum ModelProvider {
        OPENAI,
        STUB
    }

    public enum IndexType {
        EXHAUSTIVE,
        LANGCHAIN4J
    }

    public enum InteractionLogType {
        JPA,
        MEMORY
    }

    @Data
    public static class Model {

        /**
         * Which embedding/chat backend to wire. {@code openai} also covers any
         * OpenAI compatible server (Ollama, vLLM) through {@link #baseUrl}.
         */
        @NotNull
        private ModelProvider provider = ModelProvider.STUB;

        private String apiKey;

        /**
         * Base URL of the OpenAI compatible endpoint. Optional, defaults to OpenAI.
         */
        private String baseUrl;

        private String chatModelName = "gpt-4o-mini";

        private String embeddingModelName = "text-embedding-3-small";

        private double temperature = 0.2;

        /**
         * Retries performed by the model client itself. The query pipeline never retries.
         */
        @Min(0)
        private int maxRetries = 2;

        /**
         * Upper bound for a single embed or generate call.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Index {

        @NotNull
        private IndexType type = IndexType.LANGCHAIN4J;

        /**
         * Embedding dimensionality, fixed for the lifetime of the index.
         */
        @Min(1)
        private int dimension = 384;
    }

    @Data
    public static class Retrieval {

        @Min(1)
        @Max(100)
        private int topK = 5;
    }

    @Data
    public static class Chunking {

        @Min(1)
        private int maxWords = 512;

        @Min(0)
        private int overlapWords = 50;
    }

    @Data
    public static class InteractionLog {

        @NotNull
        private InteractionLogType type = InteractionLogType.JPA;
    }
}
