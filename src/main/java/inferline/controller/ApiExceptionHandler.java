package inferline.controller;

import inferline.registry.ProviderNotFoundException;
import inferline.service.ModelNotAvailableException;
import inferline.store.InvalidStateException;
import inferline.store.RequestNotFoundException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 브로커 오류를 RFC7807 Problem Details 로 바꾼다.
 * - title 은 기계가 읽는 코드 (request_not_found, invalid_state, ...)
 * - requestId 를 항상 포함
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleValidation(MethodArgumentNotValidException e) {
    Map<String, String> fields = new LinkedHashMap<>();
    for (FieldError fe : e.getBindingResult().getFieldErrors()) {
      fields.put(fe.getField(), fe.getDefaultMessage());
    }
    ProblemDetail pd = problem(HttpStatus.BAD_REQUEST, "validation_failed", "Request validation failed");
    pd.setProperty("fields", fields);

    log.info("event=api.bad_request type=validation_failed fields={}", fields.keySet());
    return pd;
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ProblemDetail handleBadJson(HttpMessageNotReadableException e) {
    log.info("event=api.bad_request type=malformed_json");
    return problem(HttpStatus.BAD_REQUEST, "malformed_json", "Malformed JSON request body");
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ProblemDetail handleMissingParameter(MissingServletRequestParameterException e) {
    return parameterProblem(e.getParameterName(), "is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ProblemDetail handleParameterType(MethodArgumentTypeMismatchException e) {
    String expected = e.getRequiredType() == null ? "a valid value" : e.getRequiredType().getSimpleName();
    return parameterProblem(e.getName(), "must be " + expected);
  }

  @ExceptionHandler(RequestNotFoundException.class)
  public ProblemDetail handleRequestNotFound(RequestNotFoundException e) {
    log.info("event=api.client_error status=404 title=request_not_found requestId={}", e.getRequestId());
    ProblemDetail pd = problem(HttpStatus.NOT_FOUND, "request_not_found", e.getMessage());
    pd.setProperty("requestId", e.getRequestId());
    return pd;
  }

  @ExceptionHandler(ProviderNotFoundException.class)
  public ProblemDetail handleProviderNotFound(ProviderNotFoundException e) {
    log.info("event=api.client_error status=404 title=provider_not_found providerId={}", e.getProviderId());
    ProblemDetail pd = problem(HttpStatus.NOT_FOUND, "provider_not_found", e.getMessage());
    pd.setProperty("providerId", e.getProviderId());
    return pd;
  }

  @ExceptionHandler(ModelNotAvailableException.class)
  public ProblemDetail handleModelNotAvailable(ModelNotAvailableException e) {
    log.info("event=api.client_error status=404 title=model_not_found model={}", e.getModel());
    ProblemDetail pd = problem(HttpStatus.NOT_FOUND, "model_not_found", e.getMessage());
    pd.setProperty("model", e.getModel());
    return pd;
  }

  @ExceptionHandler(InvalidStateException.class)
  public ProblemDetail handleInvalidState(InvalidStateException e) {
    log.info("event=api.client_error status=409 title=invalid_state requestId={} current={} attempted={}",
        e.getRequestId(), e.getCurrent(), e.getAttempted());
    ProblemDetail pd = problem(HttpStatus.CONFLICT, "invalid_state", e.getMessage());
    pd.setProperty("requestId", e.getRequestId());
    pd.setProperty("currentStatus", e.getCurrent());
    pd.setProperty("attemptedStatus", e.getAttempted());
    return pd;
  }

  @ExceptionHandler(ErrorResponseException.class)
  public ProblemDetail handleSpringErrorResponse(ErrorResponseException e) {
    ProblemDetail pd = e.getBody();
    if (pd.getProperties() == null || !pd.getProperties().containsKey("requestId")) {
      pd.setProperty("requestId", MDC.get("requestId"));
    }

    int code = pd.getStatus();
    if (code >= 500) {
      log.error("event=api.error status={} title={}", code, pd.getTitle(), e);
    } else {
      log.info("event=api.client_error status={} title={}", code, pd.getTitle());
    }
    return pd;
  }

  @ExceptionHandler(Exception.class)
  public ProblemDetail handleUnexpected(Exception e) {
    log.error("event=api.error status=500 title=internal_error", e);
    return problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected server error");
  }

  private static ProblemDetail parameterProblem(String name, String message) {
    ProblemDetail pd = problem(HttpStatus.BAD_REQUEST, "validation_failed", "Request validation failed");
    pd.setProperty("fields", Map.of(name, message));

    log.info("event=api.bad_request type=validation_failed fields=[{}]", name);
    return pd;
  }

  static ProblemDetail problem(HttpStatus status, String title, String detail) {
    ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
    pd.setTitle(title);
    pd.setProperty("requestId", MDC.get("requestId"));
    return pd;
  }
}
