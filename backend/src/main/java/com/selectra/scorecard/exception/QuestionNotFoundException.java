package com.selectra.scorecard.exception;

import lombok.Getter;

@Getter
public class QuestionNotFoundException extends InterviewEvaluationException {

    private final int questionId;

    public QuestionNotFoundException(int questionId) {
        super("Question " + questionId + " not found");
        this.questionId = questionId;
    }
}
