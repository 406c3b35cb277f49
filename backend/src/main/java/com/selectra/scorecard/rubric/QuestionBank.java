package com.selectra.scorecard.rubric;

import com.selectra.scorecard.exception.QuestionNotFoundException;
import com.selectra.scorecard.model.QuestionSpec;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class QuestionBank {

    private final List<QuestionSpec> questions;
    private final Map<Integer, QuestionSpec> byId = new LinkedHashMap<>();

    public QuestionBank(Rubric rubric) {
        this.questions = rubric.getQuestions();
        for (QuestionSpec question : questions) {
            byId.put(question.getId(), question);
        }
    }

    public List<QuestionSpec> getQuestions() {
        return questions;
    }

    public QuestionSpec findById(int questionId) {
        QuestionSpec question = byId.get(questionId);
        if (question == null) {
            throw new QuestionNotFoundException(questionId);
        }
        return question;
    }
}
