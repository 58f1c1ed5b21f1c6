package com.example.kbassist.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Chunker output: text and source metadata, before an id or embedding is assigned. */
public record FragmentCandidate(String text, Map<String, Object> metadata) {

    public FragmentCandidate {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public int startOffset() {
        Object value = metadata.get(FragmentMetadata.START_OFFSET);
        return value instanceof Number number ? number.intValue() : 0;
    }
}
