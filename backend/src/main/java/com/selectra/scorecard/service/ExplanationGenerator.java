package com.selectra.scorecard.service;

import com.selectra.scorecard.model.Dimension;
import com.selectra.scorecard.model.Explanation;
import com.selectra.scorecard.model.Signals;
import com.selectra.scorecard.rubric.Scores;
import com.selectra.scorecard.rubric.ThresholdTable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Explains a dimension score by citing the signals behind it.
 */
@Service
public class ExplanationGenerator {

    static final String GIBBERISH_TEXT =
            "Response appears to be nonsensical or gibberish. Please provide a meaningful answer.";

    static final int KEYWORD_PREVIEW = 5;
    static final int FILLER_PREVIEW = 4;
    static final int ASSERTIVE_PREVIEW = 3;

    enum Band { STRONG, ADEQUATE, WEAK }

    static final ThresholdTable<Band> BANDS = ThresholdTable.<Band>builder()
            .atLeast(7, Band.STRONG)
            .atLeast(4, Band.ADEQUATE)
            .otherwise(Band.WEAK);

    public Explanation explain(Dimension dimension, double score, Signals signals) {
        if (signals.isGibberish()) {
            List<String> detected = List.of(
                    "non-meaningful content detected",
                    "only " + Scores.roundToInt(signals.getRealWordRatio() * 100) + "% recognizable words");
            return build(dimension, score, GIBBERISH_TEXT, detected);
        }

        Band band = BANDS.lookup(score);
        List<String> detected = new ArrayList<>();
        String text = switch (dimension) {
            case CLARITY -> clarity(band, signals, detected);
            case ACCURACY -> accuracy(band, signals, detected);
            case COMPLETENESS -> completeness(band, signals, detected);
            case CONFIDENCE -> confidence(band, signals, detected);
        };
        return build(dimension, score, text, List.copyOf(detected));
    }

    private String clarity(Band band, Signals signals, List<String> detected) {
        detected.add(signals.getSentenceCount() + " sentence(s) detected");
        detected.add(signals.getWordCount() + " words total");
        if (signals.isStartsWithCapital()) {
            detected.add("proper capitalization");
        }
        if (signals.getUniqueRatio() < 0.4) {
            detected.add("high word repetition detected");
        } else if (signals.getUniqueRatio() > 0.7) {
            detected.add("diverse vocabulary");
        }

        return switch (band) {
            case STRONG -> "Well-structured response with clear sentence organization.";
            case ADEQUATE -> "Adequate structure. Additional sentences would improve readability.";
            case WEAK -> "Response lacks sentence structure or is too brief for clear communication.";
        };
    }

    private String accuracy(Band band, Signals signals, List<String> detected) {
        List<String> matched = signals.getMatchedKeywords();
        detected.add(matched.size() + " of " + signals.getTotalKeywords() + " keywords matched");
        if (!matched.isEmpty()) {
            detected.add("Found: " + preview(matched, KEYWORD_PREVIEW, true));
        }

        return switch (band) {
            case STRONG -> "Strong keyword presence indicates solid understanding of the topic.";
            case ADEQUATE -> "Some relevant concepts present but key terms are missing.";
            case WEAK -> "Very few domain-relevant terms detected in the response.";
        };
    }

    private String completeness(Band band, Signals signals, List<String> detected) {
        detected.add(signals.getWordCount() + " words total");
        detected.add(signals.getSentenceCount() + " sentence(s)");
        detected.add(signals.isHasExamples() ? "includes concrete examples" : "no specific examples detected");

        return switch (band) {
            case STRONG -> "Thorough response covering multiple facets of the question.";
            case ADEQUATE -> "Covers the basics but could explore the topic further.";
            case WEAK -> "Response is too brief or narrow to be considered complete.";
        };
    }

    private String confidence(Band band, Signals signals, List<String> detected) {
        if (signals.getFillerCount() == 0) {
            detected.add("no filler/hesitation words");
        } else {
            detected.add(signals.getFillerCount() + " filler word(s): "
                    + preview(signals.getFillerWordsFound(), FILLER_PREVIEW, false));
        }
        if (signals.getAssertiveFound().isEmpty()) {
            detected.add("no assertive phrases detected");
        } else {
            detected.add("assertive phrases: " + preview(signals.getAssertiveFound(), ASSERTIVE_PREVIEW, false));
        }

        return switch (band) {
            case STRONG -> "Confident, assertive tone with minimal hesitation.";
            case ADEQUATE -> "Moderate confidence. Some uncertainty phrases dilute the message.";
            case WEAK -> "Response suggests significant uncertainty or excessive hedging.";
        };
    }

    static String preview(List<String> values, int limit, boolean markTruncation) {
        String joined = String.join(", ", values.subList(0, Math.min(limit, values.size())));
        if (markTruncation && values.size() > limit) {
            joined += "...";
        }
        return joined;
    }

    private static Explanation build(Dimension dimension, double score, String text, List<String> detected) {
        return Explanation.builder()
                .dimension(dimension.getLabel())
                .score(score)
                .text(text)
                .signalsDetected(detected)
                .build();
    }
}
