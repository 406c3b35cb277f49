package com.selectra.scorecard.service;

import com.selectra.scorecard.model.Dimension;
import com.selectra.scorecard.model.Signals;
import com.selectra.scorecard.rubric.Scores;
import com.selectra.scorecard.rubric.ThresholdTable;
import org.springframework.stereotype.Component;

/**
 * Assertiveness against hedging. Fillers cost 0.8 each, capped at 4;
 * assertive phrases earn 0.5 each, capped at 2.
 */
@Component
public class ConfidenceScorer implements DimensionScorer {

    static final double BASELINE = 5.0;
    static final double FILLER_PENALTY = 0.8;
    static final double MAX_FILLER_PENALTY = 4.0;
    static final double ASSERTIVE_BONUS = 0.5;
    static final double MAX_ASSERTIVE_BONUS = 2.0;

    static final ThresholdTable<Double> WORD_COUNT_BONUS = ThresholdTable.<Double>builder()
            .atLeast(40, 2.0)
            .atLeast(20, 1.5)
            .atLeast(10, 0.5)
            .otherwise(-2.0);

    @Override
    public Dimension dimension() {
        return Dimension.CONFIDENCE;
    }

    @Override
    public double score(Signals signals) {
        if (signals.isGibberish()) {
            return 0.0;
        }

        double score = BASELINE;
        score += WORD_COUNT_BONUS.lookup(signals.getWordCount());
        score -= Math.min(signals.getFillerCount() * FILLER_PENALTY, MAX_FILLER_PENALTY);
        score += Math.min(signals.getAssertiveFound().size() * ASSERTIVE_BONUS, MAX_ASSERTIVE_BONUS);
        if (signals.getRealWordRatio() >= 0.8) {
            score += 0.5;
        }
        return Scores.round1(Scores.clamp(score));
    }
}
