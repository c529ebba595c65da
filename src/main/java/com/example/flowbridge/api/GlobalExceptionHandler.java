package com.example.flowbridge.api;

import com.example.flowbridge.errors.FlowConversionException;
import com.example.flowbridge.errors.RulePackNotFoundException;
import com.example.flowbridge.validation.IrFlowValidationException;
import com.example.flowbridge.validation.ValidationError;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Central exception handling for the REST API.
 * <p>
 * Maps exceptions to HTTP status and {@link ErrorResponse} body: unknown example or rule pack → 404,
 * conversion errors and bean validation → 400 with code, details and optional {@code errors} list,
 * anything else → 500. No stack traces in responses.
 * </p>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ExampleFlowNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleExampleNotFound(ExampleFlowNotFoundException ex) {
        log.warn("Example flow not found: {}", ex.getExampleName());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("Example flow not found: " + ex.getExampleName()));
    }

    @ExceptionHandler(RulePackNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleRulePackNotFound(RulePackNotFoundException ex) {
        log.warn("Rule pack not found: code={} details={}", ex.getCode(), ex.getDetails());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of(ex));
    }

    @ExceptionHandler(IrFlowValidationException.class)
    public ResponseEntity<ErrorResponse> handleGraphValidation(IrFlowValidationException ex) {
        log.warn("IR graph validation failed: {} errors={}", ex.getMessage(), ex.getErrors().size());
        ErrorResponse body = ErrorResponse.of(ex);
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(body.message(), body.code(), body.details(), ex.getErrors()));
    }

    @ExceptionHandler(FlowConversionException.class)
    public ResponseEntity<ErrorResponse> handleConversion(FlowConversionException ex) {
        log.warn("Flow conversion failed: code={} message={} details={}", ex.getCode(), ex.getMessage(), ex.getDetails());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ex));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException ex) {
        List<ValidationError> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> ValidationError.ofField(fe.getField(), fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"))
                .collect(Collectors.toList());
        log.warn("Bean validation failed: {} field errors", errors.size());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.withErrors("Validation failed", errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("Malformed request body"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ex.getMessage() != null ? ex.getMessage() : "Invalid request"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException ex) {
        log.debug("Static resource not found: {}", ex.getResourcePath());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("Not found: " + ex.getResourcePath()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("An error occurred while converting the flow"));
    }
}
