package com.nevis.corpus.controller;

import com.nevis.corpus.exception.EntityNotFoundException;
import com.nevis.corpus.exception.InvalidPreprocessStepException;
import com.nevis.corpus.exception.PreprocessPreconditionException;
import com.nevis.corpus.exception.PreprocessValidationException;
import com.nevis.corpus.exception.SentencesUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex) {
        return error(ex.getMessage(), "RESOURCE_NOT_FOUND", HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return error("No such endpoint", "RESOURCE_NOT_FOUND", HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateKey(DuplicateKeyException ex) {
        return error("Duplicate entity", "DUPLICATE_ENTITY", HttpStatus.CONFLICT);
    }

    @ExceptionHandler(InvalidPreprocessStepException.class)
    public ResponseEntity<ErrorResponse> handleInvalidStep(InvalidPreprocessStepException ex) {
        return error(ex.getMessage(), "INVALID_PREPROCESS_STEP", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(PreprocessValidationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidResult(PreprocessValidationException ex) {
        return error(ex.getMessage(), "INVALID_PREPROCESS_RESULT", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(PreprocessPreconditionException.class)
    public ResponseEntity<ErrorResponse> handlePrecondition(PreprocessPreconditionException ex) {
        return error(ex.getMessage(), "PREPROCESS_STEP_MISSING", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SentencesUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleSentencesUnavailable(SentencesUnavailableException ex) {
        return error(ex.getMessage(), "DOCUMENT_NOT_SEGMENTED", HttpStatus.CONFLICT);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
            .findFirst()
            .orElse("Invalid request");
        return error(message, "INVALID_REQUEST", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
        IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return error(ex.getMessage(), "INVALID_REQUEST", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex) {
        String message = String.format("Parameter '%s' is missing", ex.getParameterName());
        return error(message, "INVALID_REQUEST", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled error", ex);
        return error("An unexpected error occurred", "INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ErrorResponse> error(String message, String errorCode, HttpStatus status) {
        ErrorResponse error = new ErrorResponse(
            message,
            errorCode,
            status.value(),
            Instant.now().toEpochMilli()
        );
        return new ResponseEntity<>(error, status);
    }
}
