package com.example.kbassist.response;

import java.util.List;

public record InteractionPageResponse(
        List<InteractionResponse> items,
        int limit,
        int offset
) {
}
