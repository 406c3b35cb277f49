package com.selectra.scorecard.controller;

import com.selectra.scorecard.dto.*;
import com.selectra.scorecard.model.AnswerResult;
import com.selectra.scorecard.model.Dimension;
import com.selectra.scorecard.model.InterviewInsights;
import com.selectra.scorecard.model.InterviewReport;
import com.selectra.scorecard.model.SessionEvaluation;
import com.selectra.scorecard.model.Signals;
import com.selectra.scorecard.service.InterviewService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class InterviewController {

    private final InterviewService interviewService;

    @Value("${selectra.app-name:Selectra}")
    private String appName;

    @Value("${selectra.tagline:Where interviews meet insight.}")
    private String tagline;

    // ─── Questions ──────────────────────────────────────────────────────

    @GetMapping("/questions")
    public QuestionListDto getQuestions() {
        List<QuestionResponseDto> questions = interviewService.getQuestions().stream()
                .map(q -> QuestionResponseDto.builder()
                        .id(q.getId())
                        .text(q.getText())
                        .category(q.getCategory())
                        .build())
                .collect(Collectors.toList());
        return new QuestionListDto(questions, questions.size());
    }

    // ─── Answers ────────────────────────────────────────────────────────

    @PostMapping("/evaluate")
    public AnswerFeedbackDto evaluateAnswer(@RequestBody EvaluateRequestDto request) {
        if (request.getQuestionId() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "questionId is required");
        }

        SessionEvaluation evaluation = interviewService.evaluate(
                request.getSessionId(), request.getQuestionId(), request.getAnswer());
        AnswerResult result = evaluation.getResult();

        return AnswerFeedbackDto.builder()
                .questionId(result.getQuestionId())
                .scores(result.getScores())
                .explanations(result.getExplanations())
                .suggestions(result.getSuggestions())
                .signals(toSignalSummary(result.getSignals()))
                .runningAverages(evaluation.getRunningAverages())
                .readiness(evaluation.getReadiness())
                .build();
    }

    // ─── Report ─────────────────────────────────────────────────────────

    @PostMapping("/final-report")
    public FinalReportDto finalReport(@RequestBody(required = false) FinalReportRequestDto request) {
        FinalReportRequestDto body = request != null ? request : new FinalReportRequestDto();
        InterviewReport report = interviewService.getReport(body.getSessionId());
        InterviewInsights insights = report.getInsights();
        log.info("Final report generated: {} answers, overall {} ({})",
                report.getAnswers().size(), insights.getOverall(), insights.getReadiness().getLabel());

        Map<String, Double> averages = new LinkedHashMap<>();
        for (Dimension dimension : Dimension.values()) {
            averages.put(dimension.getKey(), insights.getAverages().get(dimension));
        }

        List<ResponseEntryDto> responses = report.getAnswers().stream()
                .map(this::toResponseEntry)
                .collect(Collectors.toList());

        return FinalReportDto.builder()
                .appName(appName)
                .tagline(tagline)
                .generatedAt(LocalDateTime.now())
                .interviewer(body.getInterviewer() != null ? body.getInterviewer() : new InterviewerDto())
                .overallScore(insights.getOverall())
                .dimensionAverages(averages)
                .readinessIndicator(insights.getReadiness())
                .interviewInsights(InterviewInsightsDto.builder()
                        .strengths(insights.getStrengths())
                        .improvementAreas(insights.getImprovements())
                        .actionableNextSteps(insights.getNextSteps())
                        .build())
                .responses(responses)
                .build();
    }

    // ─── Sessions ───────────────────────────────────────────────────────

    @PostMapping("/reset")
    public Map<String, String> resetSession(@RequestBody(required = false) SessionRequestDto request) {
        interviewService.reset(request != null ? request.getSessionId() : null);
        return Map.of("message", "Session reset successfully");
    }

    // ─── Helpers ────────────────────────────────────────────────────────

    private SignalSummaryDto toSignalSummary(Signals signals) {
        return SignalSummaryDto.builder()
                .wordCount(signals.getWordCount())
                .sentenceCount(signals.getSentenceCount())
                .matchedKeywords(signals.getMatchedKeywords())
                .fillerWordsFound(signals.getFillerWordsFound())
                .hasExamples(signals.isHasExamples())
                .isGibberish(signals.isGibberish())
                .realWordRatio(signals.getRealWordRatio())
                .build();
    }

    private ResponseEntryDto toResponseEntry(AnswerResult answer) {
        return ResponseEntryDto.builder()
                .questionId(answer.getQuestionId())
                .category(answer.getQuestion().getCategory())
                .question(answer.getQuestion().getText())
                .answer(answer.getAnswer())
                .scores(answer.getScores())
                .explanations(answer.getExplanations())
                .suggestions(answer.getSuggestions())
                .build();
    }
}
