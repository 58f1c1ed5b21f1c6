package com.example.kbassist.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** Already extracted text of one document, or of one page of it. */
public record IndexTextRequest(
        @NotBlank(message = "sourceDocument is required") String sourceDocument,
        @Min(value = 1, message = "page starts at 1") Integer page,
        @NotNull(message = "text is required") String text
) {
}
