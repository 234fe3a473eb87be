package com.actiongate.api;

import com.actiongate.error.ActionGateException;
import com.actiongate.error.ApprovalRequiredException;
import com.actiongate.error.InternalInvariantException;
import com.actiongate.error.NotFoundOrExpiredException;
import com.actiongate.error.PolicyBlockException;
import com.actiongate.error.RunNotFoundException;
import com.actiongate.error.UpstreamPermanentException;
import com.actiongate.error.UpstreamTransientException;
import com.actiongate.error.ValidationException;
import com.actiongate.plan.PlanCycleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error response handler.
 *
 * All errors follow the machine-readable format:
 * {
 *   "error_code": "POLICY_BLOCK",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 * with extra fields for policy blocks, approvals and cycles.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PlanCycleException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handlePlanCycle(PlanCycleException ex) {
        log.warn("Plan rejected: {}", ex.getMessage());
        Map<String, Object> body = errorResponse(ex.getErrorCode(), ex.getMessage());
        body.put("cycle", ex.getCycleNodes());
        return body;
    }

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ValidationException ex) {
        log.warn("Validation error {}: {}", ex.getErrorCode(), ex.getMessage());
        return errorResponse(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(PolicyBlockException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handlePolicyBlock(PolicyBlockException ex) {
        Map<String, Object> body = errorResponse(ex.getErrorCode(), ex.getMessage());
        body.put("policyReport", ex.getPolicyReport());
        return body;
    }

    @ExceptionHandler(ApprovalRequiredException.class)
    @ResponseStatus(HttpStatus.PRECONDITION_REQUIRED)
    public Map<String, Object> handleApprovalRequired(ApprovalRequiredException ex) {
        Map<String, Object> body = errorResponse(ex.getErrorCode(), ex.getMessage());
        body.put("preparedId", ex.getPreparedId());
        body.put("policyReport", ex.getPolicyReport());
        return body;
    }

    @ExceptionHandler({NotFoundOrExpiredException.class, RunNotFoundException.class})
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(ActionGateException ex) {
        return errorResponse(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(UpstreamTransientException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleUpstreamTransient(UpstreamTransientException ex) {
        log.warn("Upstream unavailable: {}", ex.getMessage());
        return errorResponse(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(UpstreamPermanentException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleUpstreamPermanent(UpstreamPermanentException ex) {
        log.warn("Upstream rejected request {}: {}", ex.getErrorCode(), ex.getMessage());
        return errorResponse(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(InternalInvariantException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleInvariant(InternalInvariantException ex) {
        log.error("Internal invariant violated", ex);
        return errorResponse(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
