package com.example.kbassist;

import com.example.kbassist.config.KbAssistProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(KbAssistProperties.class)
public class KbAssistApplication {

    public static void main(String[] args) {
        SpringApplication.run(KbAssistApplication.class, args);
    }

}
