package com.example.kbassist.model;

import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class GroundingDecision {

    boolean grounded;

    /** Share of meaningful answer words found in the retrieved text, in [0,1]. */
    double confidence;

    String reasoning;

    @Singular
    Set<String> supportingFragmentIds;

    public static GroundingDecision rejected(String reasoning) {
        return GroundingDecision.builder()
                .grounded(false)
                .confidence(0.0)
                .reasoning(reasoning)
                .build();
    }
}
