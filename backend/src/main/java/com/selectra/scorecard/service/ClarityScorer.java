package com.selectra.scorecard.service;

import com.selectra.scorecard.model.Dimension;
import com.selectra.scorecard.model.Signals;
import com.selectra.scorecard.rubric.Scores;
import com.selectra.scorecard.rubric.ThresholdTable;
import org.springframework.stereotype.Component;

/**
 * Sentence structure, answer length and vocabulary repetition.
 */
@Component
public class ClarityScorer implements DimensionScorer {

    static final double BASELINE = 5.0;

    static final ThresholdTable<Double> SENTENCE_BONUS = ThresholdTable.<Double>builder()
            .atLeast(3, 2.0)
            .atLeast(2, 1.0)
            .otherwise(0.0);

    @Override
    public Dimension dimension() {
        return Dimension.CLARITY;
    }

    @Override
    public double score(Signals signals) {
        if (signals.isGibberish()) {
            return Scores.round1(Math.min(1.0, signals.getRealWordRatio() * 2));
        }

        double score = BASELINE;
        score += SENTENCE_BONUS.lookup(signals.getSentenceCount());
        score += lengthAdjustment(signals.getWordCount());
        if (signals.isStartsWithCapital()) {
            score += 0.5;
        }
        if (signals.getUniqueRatio() < 0.4) {
            score -= 2;
        }
        return Scores.round1(Scores.clamp(score));
    }

    // answers past 200 words fall back to the >= 15 bonus
    static double lengthAdjustment(int wordCount) {
        if (wordCount >= 30 && wordCount <= 200) {
            return 2;
        }
        if (wordCount >= 15) {
            return 1;
        }
        return -2;
    }
}
