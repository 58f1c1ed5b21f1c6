package com.example.kbassist.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record QueryRequest(
        @NotBlank(message = "knowledgeBaseId is required") String knowledgeBaseId,
        @NotBlank(message = "question is required") @Size(max = 4000, message = "question must be at most 4000 characters") String question
) {
}
