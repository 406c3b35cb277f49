package com.selectra.scorecard.service;

import com.selectra.scorecard.model.Dimension;
import com.selectra.scorecard.model.Signals;
import com.selectra.scorecard.rubric.Scores;
import com.selectra.scorecard.rubric.ThresholdTable;
import org.springframework.stereotype.Component;

@Component
public class CompletenessScorer implements DimensionScorer {

    static final double BASELINE = 3.0;

    static final ThresholdTable<Double> WORD_COUNT_BONUS = ThresholdTable.<Double>builder()
            .atLeast(80, 3.0)
            .atLeast(50, 2.5)
            .atLeast(30, 1.5)
            .atLeast(15, 0.5)
            .otherwise(-1.0);

    static final ThresholdTable<Double> SENTENCE_BONUS = ThresholdTable.<Double>builder()
            .atLeast(5, 2.5)
            .atLeast(3, 1.5)
            .atLeast(2, 0.5)
            .otherwise(0.0);

    @Override
    public Dimension dimension() {
        return Dimension.COMPLETENESS;
    }

    @Override
    public double score(Signals signals) {
        if (signals.isGibberish()) {
            return 0.0;
        }

        double score = BASELINE;
        score += WORD_COUNT_BONUS.lookup(signals.getWordCount());
        score += SENTENCE_BONUS.lookup(signals.getSentenceCount());
        if (signals.isHasExamples()) {
            score += 0.5;
        }
        return Scores.round1(Scores.clamp(score));
    }
}
