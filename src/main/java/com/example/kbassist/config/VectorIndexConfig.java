package com.example.kbassist.config;

import com.example.kbassist.index.ExhaustiveVectorIndex;
import com.example.kbassist.index.LangChain4jVectorIndex;
import com.example.kbassist.index.VectorIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class VectorIndexConfig {

    @Bean
    public VectorIndex vectorIndex(KbAssistProperties properties) {
        KbAssistProperties.Index index = properties.getIndex();
        log.info("Vector index: type={} dimension={}", index.getType(), index.getDimension());
        return switch (index.getType()) {
            case EXHAUSTIVE -> new ExhaustiveVectorIndex(index.getDimension());
            case LANGCHAIN4J -> new LangChain4jVectorIndex(index.getDimension());
        };
    }
}
