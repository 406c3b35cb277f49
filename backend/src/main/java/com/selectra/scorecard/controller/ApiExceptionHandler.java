package com.selectra.scorecard.controller;

import com.selectra.scorecard.exception.EmptyAnswerException;
import com.selectra.scorecard.exception.EmptyInputException;
import com.selectra.scorecard.exception.QuestionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Renders caller errors as {@code {"error": "..."}} bodies.
 */
@ControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(EmptyAnswerException.class)
    public ResponseEntity<Map<String, Object>> handleEmptyAnswer(EmptyAnswerException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(QuestionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleQuestionNotFound(QuestionNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(EmptyInputException.class)
    public ResponseEntity<Map<String, Object>> handleEmptyInput(EmptyInputException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "No JSON body provided");
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex) {
        return error(HttpStatus.valueOf(ex.getStatusCode().value()), ex.getReason());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        log.warn("Request rejected with {}: {}", status.value(), message);
        return new ResponseEntity<>(Map.of("error", message != null ? message : status.getReasonPhrase()), status);
    }
}
