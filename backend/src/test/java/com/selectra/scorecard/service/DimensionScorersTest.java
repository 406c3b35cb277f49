package com.selectra.scorecard.service;

import com.selectra.scorecard.TestRubrics;
import com.selectra.scorecard.model.Dimension;
import com.selectra.scorecard.model.DimensionScores;
import com.selectra.scorecard.model.Signals;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DimensionScorersTest {

    private final ClarityScorer clarity = new ClarityScorer();
    private final AccuracyScorer accuracy = new AccuracyScorer();
    private final CompletenessScorer completeness = new CompletenessScorer();
    private final ConfidenceScorer confidence = new ConfidenceScorer();
    private final ScoringService scoring = TestRubrics.scoringService();

    private static Signals.SignalsBuilder signals() {
        return Signals.builder()
                .wordCount(20)
                .sentenceCount(1)
                .uniqueRatio(0.8)
                .matchedKeywords(List.of())
                .totalKeywords(18)
                .keywordMatchRatio(0.0)
                .fillerWordsFound(List.of())
                .fillerCount(0)
                .assertiveFound(List.of())
                .hasExamples(false)
                .startsWithCapital(true)
                .avgSentenceLen(20)
                .realWordRatio(0.7)
                .gibberish(false);
    }

    @Test
    void scoresHesitantAnswer() {
        DimensionScores scores = scoring.score(
                TestRubrics.signalExtractor().extract(Answers.HESITANT,
                        TestRubrics.questionBank().findById(TestRubrics.TEAMWORK)));

        assertEquals(3.5, scores.getClarity());
        assertEquals(1.5, scores.getAccuracy());
        assertEquals(2.0, scores.getCompleteness());
        assertEquals(2.3, scores.getConfidence());
    }

    @Test
    void scoresStrongAnswer() {
        DimensionScores scores = scoring.score(
                TestRubrics.signalExtractor().extract(Answers.STRONG_PROBLEM_SOLVING,
                        TestRubrics.questionBank().findById(TestRubrics.PROBLEM_SOLVING)));

        assertEquals(9.5, scores.getClarity());
        assertEquals(10.0, scores.getAccuracy());
        assertEquals(9.0, scores.getCompleteness());
        assertEquals(8.0, scores.getConfidence());
    }

    @Test
    void gibberishZeroesEveryDimensionButClarity() {
        Signals gibberish = signals().gibberish(true).realWordRatio(0.4).build();

        assertEquals(0.8, clarity.score(gibberish));
        assertEquals(0.0, accuracy.score(gibberish));
        assertEquals(0.0, completeness.score(gibberish));
        assertEquals(0.0, confidence.score(gibberish));
    }

    @Test
    void gibberishClarityIsCappedAtOne() {
        assertEquals(1.0, clarity.score(signals().gibberish(true).realWordRatio(0.55).build()));
        assertEquals(0.0, clarity.score(signals().gibberish(true).realWordRatio(0.0).build()));
    }

    @Test
    void clarityRewardsStructureAndPenalisesRepetition() {
        Signals structured = signals().sentenceCount(4).wordCount(60).build();
        Signals repetitive = signals().sentenceCount(4).wordCount(60).uniqueRatio(0.3).build();

        assertEquals(9.5, clarity.score(structured));
        assertEquals(7.5, clarity.score(repetitive));
    }

    @Test
    void clarityLengthBonusDropsBackPastTwoHundredWords() {
        assertEquals(2, ClarityScorer.lengthAdjustment(200));
        assertEquals(1, ClarityScorer.lengthAdjustment(201));
        assertEquals(1, ClarityScorer.lengthAdjustment(15));
        assertEquals(-2, ClarityScorer.lengthAdjustment(14));
    }

    @Test
    void accuracyStepsAtEachKeywordRatioBreakpoint() {
        assertEquals(1.5, accuracy.score(signals().keywordMatchRatio(0.04).build()));
        assertEquals(3.0, accuracy.score(signals().keywordMatchRatio(0.05).build()));
        assertEquals(4.5, accuracy.score(signals().keywordMatchRatio(0.15).build()));
        assertEquals(6.0, accuracy.score(signals().keywordMatchRatio(0.25).build()));
        assertEquals(7.5, accuracy.score(signals().keywordMatchRatio(0.35).build()));
        assertEquals(9.0, accuracy.score(signals().keywordMatchRatio(0.5).build()));
    }

    @Test
    void accuracyAddsBonusForSixMatchedKeywords() {
        List<String> six = Collections.nCopies(6, "code");
        List<String> five = Collections.nCopies(5, "code");

        assertEquals(7.0, accuracy.score(signals().keywordMatchRatio(0.33).matchedKeywords(six).build()));
        assertEquals(6.0, accuracy.score(signals().keywordMatchRatio(0.28).matchedKeywords(five).build()));
        assertEquals(10.0, accuracy.score(signals().keywordMatchRatio(0.9).matchedKeywords(six).build()));
    }

    @Test
    void completenessCombinesLengthSentencesAndExamples() {
        assertEquals(2.0, completeness.score(signals().wordCount(5).build()));
        assertEquals(9.0, completeness.score(signals().wordCount(80).sentenceCount(5).hasExamples(true).build()));
        assertEquals(7.0, completeness.score(signals().wordCount(50).sentenceCount(3).build()));
    }

    @Test
    void confidenceCapsFillerPenaltyAndAssertiveBonus() {
        Signals hedging = signals().wordCount(45).fillerCount(9).build();
        Signals assertive = signals().wordCount(45).realWordRatio(0.9)
                .assertiveFound(List.of("i led", "i built", "i will", "i created", "i designed"))
                .build();

        assertEquals(3.0, confidence.score(hedging));
        assertEquals(9.5, confidence.score(assertive));
    }

    @Test
    void everyScoreStaysWithinRange() {
        for (int words : new int[]{0, 9, 10, 30, 90, 250}) {
            for (int sentences : new int[]{0, 1, 3, 6}) {
                for (int fillers : new int[]{0, 2, 8}) {
                    Signals s = signals()
                            .wordCount(words)
                            .sentenceCount(sentences)
                            .fillerCount(fillers)
                            .hasExamples(words > 50)
                            .keywordMatchRatio(words / 250.0)
                            .build();
                    DimensionScores scores = scoring.score(s);
                    for (Dimension dimension : Dimension.values()) {
                        double value = scores.get(dimension);
                        assertTrue(value >= 0.0 && value <= 10.0, dimension + " out of range: " + value);
                    }
                }
            }
        }
    }

    @Test
    void scoringServiceRequiresEveryDimension() {
        assertThrows(IllegalStateException.class,
                () -> new ScoringService(List.of(new ClarityScorer(), new AccuracyScorer())));
        assertThrows(IllegalStateException.class, () -> new ScoringService(List.of(
                new ClarityScorer(), new ClarityScorer(), new AccuracyScorer(),
                new CompletenessScorer(), new ConfidenceScorer())));
    }
}
