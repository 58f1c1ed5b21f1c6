package com.example.kbassist.config;

import com.example.kbassist.dao.InteractionRepository;
import com.example.kbassist.service.InMemoryInteractionLog;
import com.example.kbassist.service.InteractionLog;
import com.example.kbassist.service.JpaInteractionLog;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class InteractionLogConfig {

    @Bean
    @ConditionalOnProperty(prefix = "kb-assist.interaction-log", name = "type", havingValue = "jpa", matchIfMissing = true)
    public InteractionLog jpaInteractionLog(InteractionRepository repository) {
        return new JpaInteractionLog(repository);
    }

    @Bean
    @ConditionalOnProperty(prefix = "kb-assist.interaction-log", name = "type", havingValue = "memory")
    public InteractionLog inMemoryInteractionLog() {
        return new InMemoryInteractionLog();
    }
}
