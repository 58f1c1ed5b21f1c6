package com.example.kbassist.grounding;

import com.example.kbassist.model.Fragment;
import com.example.kbassist.model.GroundingDecision;
import com.example.kbassist.util.Words;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Decides whether a generated answer is lexically supported by the fragments it was generated from.
 *
 * <p>Meaningful answer words are matched by plain substring containment against the lower-cased
 * fragment text, so a short word also matches inside a longer one ("an" in "bananas"). The
 * {@link #THRESHOLD} applies to that count as is. Stateless and safe to share.
 */
@Component
public class GroundingEvaluator {

    public static final double THRESHOLD = 0.30;

    static final String NO_FRAGMENTS = "No chunks retrieved";
    static final String NO_MEANINGFUL_WORDS = "No meaningful content in answer";
    static final String OVERLAP_FORMAT = "Overlap: %d/%d meaningful words found in retrieved fragments";

    public GroundingDecision evaluate(String question, String answer, List<Fragment> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return GroundingDecision.rejected(NO_FRAGMENTS);
        }

        Set<String> meaningful = meaningfulWords(answer);
        if (meaningful.isEmpty()) {
            return GroundingDecision.rejected(NO_MEANINGFUL_WORDS);
        }

        String corpus = fragments.stream()
                .map(fragment -> lower(fragment.getText()))
                .collect(Collectors.joining(" "));
        long overlap = meaningful.stream().filter(corpus::contains).count();
        double confidence = (double) overlap / meaningful.size();

        GroundingDecision.GroundingDecisionBuilder decision = GroundingDecision.builder()
                .grounded(confidence >= THRESHOLD)
                .confidence(confidence)
                .reasoning(OVERLAP_FORMAT.formatted(overlap, meaningful.size()));
        for (Fragment fragment : fragments) {
            String text = lower(fragment.getText());
            if (meaningful.stream().anyMatch(text::contains)) {
                decision.supportingFragmentId(fragment.getId());
            }
        }
        return decision.build();
    }

    /** Lower-cased, de-duplicated whitespace tokens of {@code answer} minus stop words. */
    static Set<String> meaningfulWords(String answer) {
        Set<String> words = new LinkedHashSet<>();
        for (String token : Words.split(answer)) {
            String word = lower(token);
            if (!StopWords.ENGLISH.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
