package com.selectra.scorecard.service;

import com.selectra.scorecard.exception.EmptyInputException;
import com.selectra.scorecard.model.AnswerResult;
import com.selectra.scorecard.model.Dimension;
import com.selectra.scorecard.model.DimensionAverages;
import com.selectra.scorecard.model.DimensionInsight;
import com.selectra.scorecard.model.DimensionScores;
import com.selectra.scorecard.model.InterviewInsights;
import com.selectra.scorecard.model.ReadinessTier;
import com.selectra.scorecard.rubric.Scores;
import com.selectra.scorecard.rubric.ThresholdTable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a session's answers into averages, a readiness tier, strengths,
 * improvement areas and next steps.
 * <p>
 * Ties between dimensions with equal averages resolve in {@link Dimension}
 * declaration order: the earlier dimension ranks first among equals and is
 * picked as both weakest and strongest.
 */
@Service
public class InsightAggregator {

    static final double STRENGTH_MIN = 5.0;
    static final double IMPROVEMENT_MAX = 8.0;
    static final int SHORT_ANSWER_WORDS = 40;

    static final ThresholdTable<ReadinessTier> READINESS = ThresholdTable.<ReadinessTier>builder()
            .atLeast(7.5, ReadinessTier.STRONG_CANDIDATE)
            .atLeast(5.0, ReadinessTier.INTERVIEW_READY)
            .otherwise(ReadinessTier.NEEDS_PREPARATION);

    private static final Map<Dimension, String[]> STRENGTH_NOTES = new EnumMap<>(Map.of(
            Dimension.CLARITY, new String[]{
                    "Responses are well-structured and easy to follow.",
                    "Answers show reasonable clarity in communication."},
            Dimension.ACCURACY, new String[]{
                    "Demonstrates strong domain knowledge with relevant terminology.",
                    "Shows adequate understanding of technical concepts."},
            Dimension.COMPLETENESS, new String[]{
                    "Provides thorough, multi-faceted responses with supporting detail.",
                    "Covers the essential points in each answer."},
            Dimension.CONFIDENCE, new String[]{
                    "Communicates with conviction and assertive, professional language.",
                    "Maintains a generally confident tone throughout."}
    ));

    private static final Map<Dimension, String[]> IMPROVEMENT_NOTES = new EnumMap<>(Map.of(
            Dimension.CLARITY, new String[]{
                    "Needs significantly more structure — practice organizing thoughts before responding.",
                    "Could benefit from more polished sentence transitions and flow."},
            Dimension.ACCURACY, new String[]{
                    "Technical vocabulary is lacking — review core concepts for the target role.",
                    "Incorporating more specific terms and concepts would strengthen responses."},
            Dimension.COMPLETENESS, new String[]{
                    "Answers are too brief — practice expanding with examples and multiple perspectives.",
                    "Adding concrete examples and covering more angles would improve depth."},
            Dimension.CONFIDENCE, new String[]{
                    "Excessive use of hedging language — practice direct, assertive phrasing.",
                    "Minor hesitation phrases can be eliminated for a more polished delivery."}
    ));

    private static final Map<Dimension, String> REMEDIATION_STEPS = new EnumMap<>(Map.of(
            Dimension.CLARITY,
            "Practice the STAR method (Situation, Task, Action, Result) to structure answers more clearly.",
            Dimension.ACCURACY,
            "Review key technical concepts for your target role and practice using specific terminology.",
            Dimension.COMPLETENESS,
            "Before answering, mentally outline 2–3 points to cover, then expand each with detail.",
            Dimension.CONFIDENCE,
            "Record yourself answering practice questions and identify filler words to eliminate."
    ));

    private static final Map<Dimension, String> REINFORCEMENT_STEPS = new EnumMap<>(Map.of(
            Dimension.CLARITY,
            "Your communication clarity is a strength — leverage it in presentations and demos.",
            Dimension.ACCURACY,
            "Your technical knowledge is solid — consider deepening into specialized areas.",
            Dimension.COMPLETENESS,
            "Your thoroughness stands out — channel this skill into technical documentation.",
            Dimension.CONFIDENCE,
            "Your confident delivery is impressive — consider mentoring peers on interview prep."
    ));

    public DimensionAverages averages(List<AnswerResult> answers) {
        if (answers == null || answers.isEmpty()) {
            throw new EmptyInputException();
        }

        double clarity = 0;
        double accuracy = 0;
        double completeness = 0;
        double confidence = 0;
        for (AnswerResult answer : answers) {
            DimensionScores scores = answer.getScores();
            clarity += scores.getClarity();
            accuracy += scores.getAccuracy();
            completeness += scores.getCompleteness();
            confidence += scores.getConfidence();
        }

        int count = answers.size();
        double avgClarity = Scores.round1(clarity / count);
        double avgAccuracy = Scores.round1(accuracy / count);
        double avgCompleteness = Scores.round1(completeness / count);
        double avgConfidence = Scores.round1(confidence / count);
        double overall = Scores.round1((avgClarity + avgAccuracy + avgCompleteness + avgConfidence) / 4);

        return DimensionAverages.builder()
                .clarity(avgClarity)
                .accuracy(avgAccuracy)
                .completeness(avgCompleteness)
                .confidence(avgConfidence)
                .overall(overall)
                .build();
    }

    public ReadinessTier readiness(double overall) {
        return READINESS.lookup(overall);
    }

    public InterviewInsights aggregate(List<AnswerResult> answers) {
        DimensionAverages averages = averages(answers);
        List<Dimension> ranked = rank(averages);

        List<DimensionInsight> strengths = new ArrayList<>();
        for (Dimension dimension : ranked.subList(0, 2)) {
            double score = averages.get(dimension);
            if (score >= STRENGTH_MIN) {
                strengths.add(insight(dimension, score, STRENGTH_NOTES.get(dimension)[score >= 7 ? 0 : 1]));
            }
        }

        List<DimensionInsight> improvements = new ArrayList<>();
        for (Dimension dimension : ranked.subList(ranked.size() - 2, ranked.size())) {
            double score = averages.get(dimension);
            if (score < IMPROVEMENT_MAX) {
                improvements.add(insight(dimension, score, IMPROVEMENT_NOTES.get(dimension)[score < 4 ? 0 : 1]));
            }
        }

        return InterviewInsights.builder()
                .overall(averages.getOverall())
                .averages(averages)
                .readiness(readiness(averages.getOverall()))
                .strengths(List.copyOf(strengths))
                .improvements(List.copyOf(improvements))
                .nextSteps(nextSteps(averages, answers))
                .build();
    }

    /**
     * Dimensions by average, highest first. The sort is stable, so equal
     * averages keep declaration order.
     */
    static List<Dimension> rank(DimensionAverages averages) {
        List<Dimension> ranked = new ArrayList<>(Arrays.asList(Dimension.values()));
        ranked.sort(Comparator.comparingDouble(averages::get).reversed());
        return ranked;
    }

    static Dimension weakest(DimensionAverages averages) {
        Dimension weakest = Dimension.CLARITY;
        for (Dimension dimension : Dimension.values()) {
            if (averages.get(dimension) < averages.get(weakest)) {
                weakest = dimension;
            }
        }
        return weakest;
    }

    static Dimension strongest(DimensionAverages averages) {
        Dimension strongest = Dimension.CLARITY;
        for (Dimension dimension : Dimension.values()) {
            if (averages.get(dimension) > averages.get(strongest)) {
                strongest = dimension;
            }
        }
        return strongest;
    }

    private List<String> nextSteps(DimensionAverages averages, List<AnswerResult> answers) {
        List<String> steps = new ArrayList<>(3);
        steps.add(REMEDIATION_STEPS.get(weakest(averages)));

        int totalWords = answers.stream().mapToInt(a -> a.getSignals().getWordCount()).sum();
        int avgWords = Scores.roundToInt((double) totalWords / answers.size());
        boolean anyExamples = answers.stream().anyMatch(a -> a.getSignals().isHasExamples());

        if (avgWords < SHORT_ANSWER_WORDS) {
            steps.add("Your average response length is " + avgWords + " words. "
                    + "Aim for 50–100 words per answer for more thorough coverage.");
        } else if (!anyExamples) {
            steps.add("None of your answers included specific examples. "
                    + "Practice incorporating real experiences to make responses more compelling.");
        } else {
            steps.add("Continue preparing with mock interviews to build consistency across all dimensions.");
        }

        steps.add(REINFORCEMENT_STEPS.get(strongest(averages)));
        return List.copyOf(steps);
    }

    private static DimensionInsight insight(Dimension dimension, double score, String note) {
        return DimensionInsight.builder()
                .name(dimension.getLabel())
                .score(score)
                .note(note)
                .build();
    }
}
