package com.selectra.scorecard.service;

import com.selectra.scorecard.model.AnswerResult;
import com.selectra.scorecard.model.DimensionAverages;
import com.selectra.scorecard.model.InterviewInsights;
import com.selectra.scorecard.model.InterviewReport;
import com.selectra.scorecard.model.QuestionSpec;
import com.selectra.scorecard.model.SessionEvaluation;
import com.selectra.scorecard.rubric.QuestionBank;
import com.selectra.scorecard.session.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Session-level flow on top of the stateless evaluation engine. This is the
 * only place that touches the {@link SessionStore}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InterviewService {

    public static final String DEFAULT_SESSION = "default";

    private final QuestionBank questionBank;
    private final AnswerEvaluator answerEvaluator;
    private final InsightAggregator insightAggregator;
    private final SessionStore sessionStore;

    public List<QuestionSpec> getQuestions() {
        return questionBank.getQuestions();
    }

    public SessionEvaluation evaluate(String sessionId, int questionId, String answer) {
        String session = normalise(sessionId);
        AnswerResult result = answerEvaluator.evaluate(questionId, answer);
        sessionStore.append(session, result);

        List<AnswerResult> answers = sessionStore.get(session);
        DimensionAverages running = insightAggregator.averages(answers);
        log.info("Session {} answered question {} ({} answers, running overall {})",
                session, questionId, answers.size(), running.getOverall());

        return SessionEvaluation.builder()
                .result(result)
                .runningAverages(running)
                .readiness(insightAggregator.readiness(running.getOverall()))
                .build();
    }

    public List<AnswerResult> getAnswers(String sessionId) {
        return sessionStore.get(normalise(sessionId));
    }

    /**
     * Answers and insights taken from the same snapshot of the session.
     *
     * @throws com.selectra.scorecard.exception.EmptyInputException if the
     *         session has no answers
     */
    public InterviewReport getReport(String sessionId) {
        List<AnswerResult> answers = getAnswers(sessionId);
        InterviewInsights insights = insightAggregator.aggregate(answers);
        return InterviewReport.builder()
                .answers(answers)
                .insights(insights)
                .build();
    }

    public void reset(String sessionId) {
        sessionStore.reset(normalise(sessionId));
    }

    static String normalise(String sessionId) {
        return sessionId == null || sessionId.isBlank() ? DEFAULT_SESSION : sessionId;
    }
}
