package com.selectra.scorecard.service;

import com.selectra.scorecard.model.Dimension;
import com.selectra.scorecard.model.Signals;
import com.selectra.scorecard.rubric.Scores;
import com.selectra.scorecard.rubric.ThresholdTable;
import org.springframework.stereotype.Component;

@Component
public class AccuracyScorer implements DimensionScorer {

    static final ThresholdTable<Double> KEYWORD_RATIO_BANDS = ThresholdTable.<Double>builder()
            .atLeast(0.5, 9.0)
            .atLeast(0.35, 7.5)
            .atLeast(0.25, 6.0)
            .atLeast(0.15, 4.5)
            .atLeast(0.05, 3.0)
            .otherwise(1.5);

    static final int BONUS_KEYWORD_COUNT = 6;

    @Override
    public Dimension dimension() {
        return Dimension.ACCURACY;
    }

    @Override
    public double score(Signals signals) {
        if (signals.isGibberish()) {
            return 0.0;
        }

        double score = KEYWORD_RATIO_BANDS.lookup(signals.getKeywordMatchRatio());
        if (signals.getMatchedKeywords().size() >= BONUS_KEYWORD_COUNT) {
            score = Math.min(Scores.MAX, score + 1);
        }
        return Scores.round1(Scores.clamp(score));
    }
}
