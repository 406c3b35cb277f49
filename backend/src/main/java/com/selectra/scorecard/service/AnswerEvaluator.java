package com.selectra.scorecard.service;

import com.selectra.scorecard.exception.EmptyAnswerException;
import com.selectra.scorecard.model.AnswerResult;
import com.selectra.scorecard.model.Dimension;
import com.selectra.scorecard.model.DimensionScores;
import com.selectra.scorecard.model.Explanation;
import com.selectra.scorecard.model.QuestionSpec;
import com.selectra.scorecard.model.Signals;
import com.selectra.scorecard.model.Suggestion;
import com.selectra.scorecard.rubric.QuestionBank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a single answer: extract signals, score each dimension, then
 * explain and suggest per dimension.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnswerEvaluator {

    private final QuestionBank questionBank;
    private final SignalExtractor signalExtractor;
    private final ScoringService scoringService;
    private final ExplanationGenerator explanationGenerator;
    private final SuggestionGenerator suggestionGenerator;

    public AnswerResult evaluate(int questionId, String rawAnswer) {
        String answer = SignalExtractor.trim(rawAnswer);
        if (answer.isEmpty()) {
            throw new EmptyAnswerException();
        }

        QuestionSpec question = questionBank.findById(questionId);

        Signals signals = signalExtractor.extract(answer, question);
        DimensionScores scores = scoringService.score(signals);

        List<Explanation> explanations = new ArrayList<>();
        Map<String, Suggestion> suggestions = new LinkedHashMap<>();
        for (Dimension dimension : Dimension.values()) {
            double score = scores.get(dimension);
            explanations.add(explanationGenerator.explain(dimension, score, signals));
            suggestions.put(dimension.getKey(), suggestionGenerator.suggest(dimension, score, signals));
        }

        log.debug("Evaluated question {}: words={}, gibberish={}, scores={}",
                questionId, signals.getWordCount(), signals.isGibberish(), scores);

        return AnswerResult.builder()
                .questionId(questionId)
                .question(question)
                .answer(answer)
                .signals(signals)
                .scores(scores)
                .explanations(List.copyOf(explanations))
                .suggestions(Collections.unmodifiableMap(suggestions))
                .build();
    }
}
