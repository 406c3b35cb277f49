package com.selectra.scorecard.controller;

import com.selectra.scorecard.rubric.QuestionBank;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final QuestionBank questionBank;

    @GetMapping({"", "/"})
    public Map<String, String> healthCheck() {
        return Map.of(
                "status", "healthy",
                "service", "Selectra Scorecard API",
                "version", "1.0.0"
        );
    }

    @GetMapping("/ready")
    public Map<String, Object> readinessCheck() {
        return Map.of(
                "status", "ready",
                "rubric", Map.of("questions", questionBank.getQuestions().size())
        );
    }
}
