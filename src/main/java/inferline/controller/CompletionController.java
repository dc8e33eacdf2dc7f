package inferline.controller;

import inferline.service.BrokerService;
import inferline.service.WaitHandle;
import inferline.service.WaitOutcome;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

/**
 * OpenAI 호환 동기 엔드포인트. 요청을 큐에 넣고 프로바이더 결과가 올 때까지 기다린다.
 *
 * <p>본문은 해석하지 않고 그대로 프로바이더에게 넘긴다. model 만 꺼내 매칭에 쓴다.</p>
 */
@RestController
@RequestMapping("/v1")
public class CompletionController {
  private static final Logger log = LoggerFactory.getLogger(CompletionController.class);

  static final String COMPLETION = "completion";
  static final String CHAT_COMPLETION = "chat_completion";

  // 대기 타임아웃 뒤 TIMEOUT 응답을 쓸 여유
  private static final Duration ASYNC_GRACE = Duration.ofSeconds(5);

  private final BrokerService broker;

  public CompletionController(BrokerService broker) {
    this.broker = broker;
  }

  @PostMapping("/completions")
  public DeferredResult<ResponseEntity<Object>> completions(
      @RequestBody Map<String, Object> body,
      @RequestParam(value = "timeoutMs", required = false) Long timeoutMs
  ) {
    return submitAndWait(COMPLETION, body, timeoutMs);
  }

  @PostMapping("/chat/completions")
  public DeferredResult<ResponseEntity<Object>> chatCompletions(
      @RequestBody Map<String, Object> body,
      @RequestParam(value = "timeoutMs", required = false) Long timeoutMs
  ) {
    return submitAndWait(CHAT_COMPLETION, body, timeoutMs);
  }

  /**
   * 서블릿 스레드는 바로 반환된다. 결과는 종료 신호가 오면 채워진다.
   * 비동기 요청이 결과 없이 끝나면(연결 끊김, 컨테이너 타임아웃) 대기를 포기하고 PENDING 요청을 회수한다.
   */
  private DeferredResult<ResponseEntity<Object>> submitAndWait(
      String requestType,
      Map<String, Object> body,
      Long timeoutMs
  ) {
    String model = requireModel(body);
    WaitHandle handle = broker.submitAndWait(requestType, model, body, timeoutMs);
    String requestId = handle.getRequestId();
    CompletableFuture<WaitOutcome> outcome = handle.getOutcome();

    DeferredResult<ResponseEntity<Object>> deferred =
        new DeferredResult<>(handle.getTimeout().plus(ASYNC_GRACE).toMillis());
    deferred.onTimeout(() -> {
      deferred.setErrorResult(new ErrorResponseException(HttpStatus.SERVICE_UNAVAILABLE,
          titled(HttpStatus.SERVICE_UNAVAILABLE, "cancelled", "Request was cancelled while waiting"), null));
      abandon(outcome, requestId, "async_timeout");
    });
    deferred.onError(t -> abandon(outcome, requestId, "client_error"));
    deferred.onCompletion(() -> abandon(outcome, requestId, "abandoned"));

    outcome.whenComplete((done, failure) -> {
      if (failure == null) {
        deferred.setResult(toResponse(done, model));
        return;
      }
      Throwable cause = failure instanceof CompletionException && failure.getCause() != null
          ? failure.getCause()
          : failure;
      if (!(cause instanceof CancellationException)) {
        deferred.setErrorResult(cause);
      }
    });
    return deferred;
  }

  /**
   * 결과가 아직이면 future 를 취소하고 요청을 회수한다. 여러 콜백에서 불려도 한 번만 처리된다.
   */
  private void abandon(CompletableFuture<WaitOutcome> outcome, String requestId, String reason) {
    if (outcome.cancel(false)) {
      log.warn("event=completion.cancelled requestId={} reason={}", requestId, reason);
      broker.abandonWait(requestId, reason);
    }
  }

  private static ResponseEntity<Object> toResponse(WaitOutcome outcome, String model) {
    try (var ignored = MDC.putCloseable("requestId", outcome.getRequestId())) {
      switch (outcome.getKind()) {
        case COMPLETED -> {
          log.info("event=completion.done requestId={} model={} result=SUCCESS", outcome.getRequestId(), model);
          return ResponseEntity.ok()
              .header(RequestController.REQUEST_ID_HEADER, outcome.getRequestId())
              .body(withUsage(outcome));
        }
        case UPSTREAM_FAILURE -> {
          log.warn("event=completion.done requestId={} model={} result=UPSTREAM_FAILURE error={}",
              outcome.getRequestId(), model, outcome.getErrorMessage());
          ProblemDetail pd = titled(HttpStatus.BAD_GATEWAY, "upstream_failure", outcome.getErrorMessage());
          pd.setProperty("requestId", outcome.getRequestId());
          return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
              .header(RequestController.REQUEST_ID_HEADER, outcome.getRequestId())
              .body(pd);
        }
        default -> {
          // 요청은 남아 있다. 클라이언트는 Location 으로 나중에 찾아갈 수 있다
          log.warn("event=completion.done requestId={} model={} result=TIMEOUT", outcome.getRequestId(), model);
          ProblemDetail pd = titled(HttpStatus.GATEWAY_TIMEOUT, "timeout",
              "No provider produced a result in time; poll the status URL later");
          pd.setProperty("requestId", outcome.getRequestId());
          return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
              .header(RequestController.REQUEST_ID_HEADER, outcome.getRequestId())
              .location(URI.create("/v1/requests/" + outcome.getRequestId()))
              .body(pd);
        }
      }
    }
  }

  private static String requireModel(Map<String, Object> body) {
    Object model = body == null ? null : body.get("model");
    if (model instanceof String s && !s.isBlank()) {
      return s;
    }
    ProblemDetail pd = titled(HttpStatus.BAD_REQUEST, "validation_failed", "Request validation failed");
    pd.setProperty("fields", Map.of("model", "must not be blank"));
    throw new ErrorResponseException(HttpStatus.BAD_REQUEST, pd, null);
  }

  /**
   * 프로바이더가 usage 를 본문 밖으로 따로 보냈으면 응답에 합쳐 준다.
   */
  private static Map<String, Object> withUsage(WaitOutcome outcome) {
    Map<String, Object> data = outcome.getResultData();
    Map<String, Object> usage = outcome.getResult().usage();
    if (usage == null || data.containsKey("usage")) {
      return data;
    }
    Map<String, Object> merged = new LinkedHashMap<>(data);
    merged.put("usage", usage);
    return merged;
  }

  private static ProblemDetail titled(HttpStatus status, String title, String detail) {
    ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
    pd.setTitle(title);
    return pd;
  }
}
