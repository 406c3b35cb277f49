package com.selectra.scorecard.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class InterviewControllerTest {

    @Autowired
    private MockMvc mockMvc;

    private ResultActions evaluate(String sessionId, int questionId, String answer) throws Exception {
        String body = """
                {
                    "sessionId": "%s",
                    "questionId": %d,
                    "answer": "%s"
                }
                """.formatted(sessionId, questionId, answer);
        return mockMvc.perform(post("/api/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    @Test
    void testGetQuestions() throws Exception {
        mockMvc.perform(get("/api/questions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(5))
                .andExpect(jsonPath("$.questions[0].id").value(1))
                .andExpect(jsonPath("$.questions[1].category").value("Problem Solving"))
                .andExpect(jsonPath("$.questions[0].keywords").doesNotExist());
    }

    @Test
    void testEvaluateAnswer() throws Exception {
        evaluate("http-evaluate", 4, "I think maybe I kind of built something, I guess.")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.questionId").value(4))
                .andExpect(jsonPath("$.scores.clarity").value(3.5))
                .andExpect(jsonPath("$.scores.confidence").value(2.3))
                .andExpect(jsonPath("$.explanations", hasSize(4)))
                .andExpect(jsonPath("$.explanations[1].dimension").value("Technical Accuracy"))
                .andExpect(jsonPath("$.suggestions.confidence.level").value("low"))
                .andExpect(jsonPath("$.suggestions.confidence.icon").value("warning"))
                .andExpect(jsonPath("$.suggestions.clarity.level").value("medium"))
                .andExpect(jsonPath("$.signals.wordCount").value(10))
                .andExpect(jsonPath("$.signals.fillerWordsFound", hasSize(4)))
                .andExpect(jsonPath("$.signals.isGibberish").value(false))
                .andExpect(jsonPath("$.runningAverages.overall").value(2.3))
                .andExpect(jsonPath("$.readiness.label").value("Needs Preparation"))
                .andExpect(jsonPath("$.readiness.className").value("readiness-low"));
    }

    @Test
    void testEvaluateEmptyAnswer() throws Exception {
        evaluate("http-empty", 1, "   ")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Answer cannot be empty"));
    }

    @Test
    void testEvaluateUnknownQuestion() throws Exception {
        evaluate("http-unknown", 99, "A perfectly reasonable answer.")
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Question 99 not found"));
    }

    @Test
    void testEvaluateWithoutBody() throws Exception {
        mockMvc.perform(post("/api/evaluate").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No JSON body provided"));
    }

    @Test
    void testEvaluateWithoutQuestionId() throws Exception {
        mockMvc.perform(post("/api/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\": \"Hello there.\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("questionId is required"));
    }

    @Test
    void testFinalReport() throws Exception {
        evaluate("http-report", 4, "I think maybe I kind of built something, I guess.")
                .andExpect(status().isOk());

        String body = """
                {
                    "sessionId": "http-report",
                    "interviewer": {"name": "Alex Doe", "email": "alex@example.com"}
                }
                """;

        mockMvc.perform(post("/api/final-report")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.appName").value("Selectra"))
                .andExpect(jsonPath("$.tagline").value("Where interviews meet insight."))
                .andExpect(jsonPath("$.generatedAt").exists())
                .andExpect(jsonPath("$.interviewer.name").value("Alex Doe"))
                .andExpect(jsonPath("$.overallScore").value(2.3))
                .andExpect(jsonPath("$.dimensionAverages.accuracy").value(1.5))
                .andExpect(jsonPath("$.readinessIndicator.level").value("low"))
                .andExpect(jsonPath("$.interviewInsights.strengths", hasSize(0)))
                .andExpect(jsonPath("$.interviewInsights.improvementAreas[0].name").value("Completeness"))
                .andExpect(jsonPath("$.interviewInsights.actionableNextSteps", hasSize(3)))
                .andExpect(jsonPath("$.responses", hasSize(1)))
                .andExpect(jsonPath("$.responses[0].category").value("Teamwork"))
                .andExpect(jsonPath("$.responses[0].answer").value(startsWith("I think maybe")));
    }

    @Test
    void testFinalReportEchoesOnlyProvidedInterviewerFields() throws Exception {
        evaluate("http-interviewer", 1, "I am a software engineer with five years of experience.")
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/final-report")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"http-interviewer\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.interviewer").isMap())
                .andExpect(jsonPath("$.interviewer", anEmptyMap()));

        mockMvc.perform(post("/api/final-report")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"http-interviewer\", \"interviewer\": {\"name\": \"Sam\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.interviewer.name").value("Sam"))
                .andExpect(jsonPath("$.interviewer.email").doesNotExist());
    }

    @Test
    void testFinalReportForEmptySession() throws Exception {
        mockMvc.perform(post("/api/final-report")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"http-never-used\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("No interview data found for this session"));
    }

    @Test
    void testResetSession() throws Exception {
        evaluate("http-reset", 1, "I am a software engineer with five years of experience.")
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"http-reset\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Session reset successfully"));

        mockMvc.perform(post("/api/final-report")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"http-reset\"}"))
                .andExpect(status().isNotFound());
    }
}
