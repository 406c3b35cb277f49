package com.selectra.scorecard.service;

import com.selectra.scorecard.model.Dimension;
import com.selectra.scorecard.model.DimensionScores;
import com.selectra.scorecard.model.Signals;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class ScoringService {

    private final Map<Dimension, DimensionScorer> scorers = new EnumMap<>(Dimension.class);

    public ScoringService(List<DimensionScorer> scorers) {
        for (DimensionScorer scorer : scorers) {
            if (this.scorers.put(scorer.dimension(), scorer) != null) {
                throw new IllegalStateException("Duplicate scorer for " + scorer.dimension());
            }
        }
        for (Dimension dimension : Dimension.values()) {
            if (!this.scorers.containsKey(dimension)) {
                throw new IllegalStateException("No scorer registered for " + dimension);
            }
        }
    }

    public DimensionScores score(Signals signals) {
        return DimensionScores.builder()
                .clarity(scorers.get(Dimension.CLARITY).score(signals))
                .accuracy(scorers.get(Dimension.ACCURACY).score(signals))
                .completeness(scorers.get(Dimension.COMPLETENESS).score(signals))
                .confidence(scorers.get(Dimension.CONFIDENCE).score(signals))
                .build();
    }
}
