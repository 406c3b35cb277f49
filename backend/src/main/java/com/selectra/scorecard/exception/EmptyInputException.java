package com.selectra.scorecard.exception;

/**
 * Raised when averages or insights are requested over zero answers.
 */
public class EmptyInputException extends InterviewEvaluationException {

    public EmptyInputException() {
        super("No interview data found for this session");
    }
}
