package com.selectra.scorecard.exception;

/**
 * Base type for caller-input errors raised by the evaluation engine.
 */
public abstract class InterviewEvaluationException extends RuntimeException {

    protected InterviewEvaluationException(String message) {
        super(message);
    }
}
