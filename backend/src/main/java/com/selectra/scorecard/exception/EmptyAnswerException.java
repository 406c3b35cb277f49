package com.selectra.scorecard.exception;

public class EmptyAnswerException extends InterviewEvaluationException {

    public EmptyAnswerException() {
        super("Answer cannot be empty");
    }
}
