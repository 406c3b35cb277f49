package com.selectra.scorecard.service;

import com.selectra.scorecard.model.Dimension;
import com.selectra.scorecard.model.Signals;

/**
 * Maps signals to a score in {@code [0, 10]} with one decimal place.
 * Implementations must be pure.
 */
public interface DimensionScorer {

    Dimension dimension();

    double score(Signals signals);
}
