package com.example.kbassist.ingest;

import com.example.kbassist.model.FragmentCandidate;
import com.example.kbassist.model.FragmentMetadata;
import com.example.kbassist.util.Words;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Splits extracted text into overlapping windows of whitespace separated words.
 *
 * <p>Each window holds at most {@code maxWords} words and starts {@code maxWords - overlapWords}
 * words after the previous one. The last window may be shorter. Window text is its words joined
 * by single spaces, so the original line breaks and runs of whitespace are not kept.
 */
@Component
public class TextChunker {

    public List<FragmentCandidate> chunk(String text, int maxWords, int overlapWords, String sourceDocument, Integer page) {
        if (maxWords <= 0) {
            throw new IllegalArgumentException("maxWords must be positive, got " + maxWords);
        }
        if (overlapWords < 0) {
            throw new IllegalArgumentException("overlapWords must not be negative, got " + overlapWords);
        }
        if (overlapWords >= maxWords) {
            throw new IllegalArgumentException(
                    "overlapWords (%d) must be smaller than maxWords (%d)".formatted(overlapWords, maxWords));
        }
        List<String> words = Words.split(text);
        int step = maxWords - overlapWords;
        List<FragmentCandidate> candidates = new ArrayList<>();
        for (int start = 0; start < words.size(); start += step) {
            int end = Math.min(start + maxWords, words.size());
            String window = String.join(" ", words.subList(start, end));
            candidates.add(new FragmentCandidate(window, metadata(sourceDocument, page, start)));
            if (end == words.size()) {
                break;
            }
        }
        return candidates;
    }

    private static Map<String, Object> metadata(String sourceDocument, Integer page, int startOffset) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(FragmentMetadata.SOURCE_DOCUMENT, sourceDocument == null ? "" : sourceDocument);
        if (page != null) {
            metadata.put(FragmentMetadata.PAGE, page);
        }
        metadata.put(FragmentMetadata.START_OFFSET, startOffset);
        return metadata;
    }
}
