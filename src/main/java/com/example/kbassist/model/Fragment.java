package com.example.kbassist.model;

import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A bounded slice of document text plus the metadata needed to cite it.
 * The knowledge base id is copied onto every fragment when it is indexed so that
 * retrieval can be scoped without asking the document store.
 */
@Value
@Builder(toBuilder = true)
public class Fragment {

    String id;
    String documentId;
    String knowledgeBaseId;
    String text;

    /** Insertion ordered; values are strings or integers. */
    @Singular("meta")
    Map<String, Object> metadata;

    /** Optional until the fragment is indexed. */
    float[] embedding;

    public boolean hasEmbedding() {
        return embedding != null;
    }

    public String getSourceDocument() {
        Object value = metadata.get(FragmentMetadata.SOURCE_DOCUMENT);
        return value == null ? "" : value.toString();
    }

    public Integer getPage() {
        Object value = metadata.get(FragmentMetadata.PAGE);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.valueOf(text.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }
}
