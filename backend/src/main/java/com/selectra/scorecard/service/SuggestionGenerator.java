package com.selectra.scorecard.service;

import com.selectra.scorecard.model.Dimension;
import com.selectra.scorecard.model.Signals;
import com.selectra.scorecard.model.Suggestion;
import com.selectra.scorecard.model.SuggestionLevel;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class SuggestionGenerator {

    public Suggestion suggest(Dimension dimension, double score, Signals signals) {
        SuggestionLevel level = SuggestionLevel.forScore(score);
        String text = switch (level) {
            case LOW -> low(dimension, signals);
            case MEDIUM -> medium(dimension, signals);
            case HIGH -> high(dimension, signals);
        };

        return Suggestion.builder()
                .dimension(dimension.getLabel())
                .score(score)
                .level(level)
                .icon(level.getIcon())
                .text(text)
                .build();
    }

    private String low(Dimension dimension, Signals signals) {
        return switch (dimension) {
            case CLARITY -> {
                if (signals.getWordCount() < 15) {
                    yield "Your response is very brief. Aim for at least 3–4 complete sentences "
                            + "with a clear beginning, middle, and conclusion.";
                }
                if (signals.getUniqueRatio() < 0.4) {
                    yield "There is noticeable word repetition. Vary your vocabulary and structure "
                            + "thoughts into distinct sentences.";
                }
                yield "Improve clarity by organizing your answer into clear sentences. Start with "
                        + "your main point, support with details, then summarize.";
            }
            case ACCURACY -> {
                if (signals.getMatchedKeywords().isEmpty()) {
                    yield "Your answer did not include key technical terms. Review the topic and "
                            + "incorporate specific terminology and concepts.";
                }
                yield "Only " + signals.getMatchedKeywords().size() + " relevant term(s) detected. "
                        + "Use more domain-specific vocabulary and reference concrete concepts.";
            }
            case COMPLETENESS -> {
                if (signals.getWordCount() < 15) {
                    yield "Your response is too brief. Expand with at least 3–5 sentences covering "
                            + "different aspects of the question.";
                }
                yield "Your answer covers limited ground. Address multiple facets and include "
                        + "specific examples to demonstrate depth.";
            }
            case CONFIDENCE -> {
                if (signals.getFillerCount() > 3) {
                    List<String> fillers = signals.getFillerWordsFound();
                    String quoted = String.join("', '", fillers.subList(0, Math.min(3, fillers.size())));
                    yield "Multiple hesitation phrases detected ('" + quoted + "'). Practice delivering "
                            + "answers with direct, assertive language.";
                }
                yield "The response conveys uncertainty. Use definitive statements like "
                        + "'I achieved...' or 'I built...' to project confidence.";
            }
        };
    }

    private String medium(Dimension dimension, Signals signals) {
        return switch (dimension) {
            case CLARITY -> signals.getSentenceCount() < 3
                    ? "Your answer is reasonably clear but could benefit from additional sentences "
                    + "to fully develop your point."
                    : "Good clarity foundation. Ensure each sentence transitions smoothly to the next "
                    + "for a cohesive narrative.";
            case ACCURACY -> "You referenced " + signals.getMatchedKeywords().size() + " of "
                    + signals.getTotalKeywords() + " expected concepts. Mentioning more domain-specific "
                    + "terms would elevate accuracy.";
            case COMPLETENESS -> !signals.isHasExamples()
                    ? "Solid answer overall. Adding a concrete example or use case would make it more "
                    + "complete and convincing."
                    : "Good detail level. Consider expanding on additional angles or trade-offs to "
                    + "demonstrate comprehensive understanding.";
            case CONFIDENCE -> signals.getFillerCount() > 0
                    ? "Your answer is confident overall, but reducing hesitation phrases like '"
                    + signals.getFillerWordsFound().get(0) + "' would strengthen delivery."
                    : "Confident tone detected. Adding a personal achievement statement would further "
                    + "reinforce self-assurance.";
        };
    }

    private String high(Dimension dimension, Signals signals) {
        return switch (dimension) {
            case CLARITY -> "Excellent clarity! Well-structured and easy to follow. To reach the next "
                    + "level, consider using transition phrases between ideas.";
            case ACCURACY -> "Strong technical accuracy with " + signals.getMatchedKeywords().size()
                    + " relevant concepts. For even greater impact, relate concepts to real-world "
                    + "applications.";
            case COMPLETENESS -> signals.isHasExamples()
                    ? "Very thorough response with examples included. Exceptional completeness — "
                    + "maintain this standard across all answers."
                    : "Comprehensive answer. Adding a brief example would make it truly outstanding.";
            case CONFIDENCE -> !signals.getAssertiveFound().isEmpty()
                    ? "Highly confident delivery with assertive language. This projects "
                    + "professionalism — keep this approach."
                    : "Strong confident tone. Consider adding quantified achievements to amplify impact.";
        };
    }
}
