package com.selectra.scorecard.rubric;

import com.selectra.scorecard.TestRubrics;
import com.selectra.scorecard.exception.QuestionNotFoundException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuestionBankTest {

    private final QuestionBank bank = TestRubrics.questionBank();

    @Test
    void keepsRubricOrder() {
        assertEquals(1, bank.getQuestions().get(0).getId());
        assertEquals(5, bank.getQuestions().get(4).getId());
    }

    @Test
    void findsQuestionById() {
        assertEquals("Problem Solving", bank.findById(TestRubrics.PROBLEM_SOLVING).getCategory());
    }

    @Test
    void unknownQuestionIsRejected() {
        QuestionNotFoundException ex = assertThrows(QuestionNotFoundException.class, () -> bank.findById(42));
        assertEquals(42, ex.getQuestionId());
        assertEquals("Question 42 not found", ex.getMessage());
    }
}
