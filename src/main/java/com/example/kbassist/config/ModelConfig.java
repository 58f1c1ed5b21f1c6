package com.example.kbassist.config;

import com.example.kbassist.llm.LangChain4jModelGateway;
import com.example.kbassist.llm.ModelGateway;
import com.example.kbassist.llm.StubModelGateway;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ModelConfig {

    @Bean
    @ConditionalOnProperty(prefix = "kb-assist.model", name = "provider", havingValue = "openai")
    public ChatModel chatModel(KbAssistProperties properties) {
        KbAssistProperties.Model props = properties.getModel();
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getChatModelName())
                .temperature(props.getTemperature())
                .timeout(props.getTimeout())
                .maxRetries(props.getMaxRetries());
        if (props.getBaseUrl() != null && !props.getBaseUrl().isBlank()) {
            builder.baseUrl(props.getBaseUrl());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "kb-assist.model", name = "provider", havingValue = "openai")
    public EmbeddingModel embeddingModel(KbAssistProperties properties) {
        KbAssistProperties.Model props = properties.getModel();
        OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder = OpenAiEmbeddingModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getEmbeddingModelName())
                .dimensions(properties.getIndex().getDimension())
                .timeout(props.getTimeout())
                .maxRetries(props.getMaxRetries());
        if (props.getBaseUrl() != null && !props.getBaseUrl().isBlank()) {
            builder.baseUrl(props.getBaseUrl());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "kb-assist.model", name = "provider", havingValue = "openai")
    public ModelGateway langChain4jModelGateway(EmbeddingModel embeddingModel, ChatModel chatModel) {
        log.info("Using OpenAI compatible model gateway");
        return new LangChain4jModelGateway(embeddingModel, chatModel);
    }

    @Bean
    @ConditionalOnProperty(prefix = "kb-assist.model", name = "provider", havingValue = "stub", matchIfMissing = true)
    public ModelGateway stubModelGateway(KbAssistProperties properties) {
        log.warn("Using stub model gateway; answers are placeholders. Set kb-assist.model.provider=openai for real answers");
        return new StubModelGateway(properties.getIndex().getDimension());
    }
}
