package com.devflow.orchestrator.api;

import com.devflow.orchestrator.api.dto.ErrorResponse;
import com.devflow.orchestrator.service.ExecutionStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine exceptions to HTTP statuses. Not-found cases are raised as
 * {@code ResponseStatusException} by the controllers themselves.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ExecutionStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ErrorResponse handleState(ExecutionStateException ex) {
        log.info("Rejected request on execution {}: {}", ex.getExecutionId(), ex.getMessage());
        return new ErrorResponse(ex.getKind().name(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleBadArgument(IllegalArgumentException ex) {
        return new ErrorResponse("BAD_REQUEST", ex.getMessage());
    }
}
