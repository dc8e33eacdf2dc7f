package inferline.service;

import inferline.config.BrokerConfig.ApiProperties;
import inferline.config.BrokerConfig.QueueProperties;
import inferline.dispatch.DispatchMatcher;
import inferline.model.InferenceRequest;
import inferline.model.InferenceResponse;
import inferline.model.InferenceResult;
import inferline.model.ProviderCapabilities;
import inferline.model.QueueStats;
import inferline.model.RequestStatus;
import inferline.registry.ProviderRegistry;
import inferline.store.InvalidStateException;
import inferline.store.RequestNotFoundException;
import inferline.store.RequestStore;
import inferline.store.ResultStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 브로커 진입점. 전송 계층은 이 클래스만 호출한다.
 */
@Service
public class BrokerService {
  private static final Logger log = LoggerFactory.getLogger(BrokerService.class);

  public static final String DEFAULT_REQUEST_TYPE = "completion";

  private final Clock clock;
  private final RequestStore store;
  private final ResultStore results;
  private final ProviderRegistry registry;
  private final DispatchMatcher matcher;
  private final CompletionWaiter waiter;
  private final QueueProperties queue;
  private final ApiProperties api;

  public BrokerService(
      Clock clock,
      RequestStore store,
      ResultStore results,
      ProviderRegistry registry,
      DispatchMatcher matcher,
      CompletionWaiter waiter,
      QueueProperties queue,
      ApiProperties api
  ) {
    this.clock = clock;
    this.store = store;
    this.results = results;
    this.registry = registry;
    this.matcher = matcher;
    this.waiter = waiter;
    this.queue = queue;
    this.api = api;
  }

  public InferenceResponse submit(String requestType, String model, Map<String, Object> payload) {
    String type = requestTypeOrDefault(requestType);
    String requestId = store.enqueue(type, model, payload);
    InferenceRequest created = store.get(requestId).orElseThrow(() -> new RequestNotFoundException(requestId));
    log.info("event=request.enqueued requestId={} requestType={} model={} mode=async", requestId, type, model);
    return InferenceResponse.of(created);
  }

  /**
   * 요청을 넣고 종료를 비동기로 기다린다. 호출 스레드는 바로 돌아온다.
   *
   * @param timeoutMs null 이면 설정 기본값, 그 외에는 최대값으로 잘린다
   * @throws ModelNotAvailableException 모델 게이트가 켜져 있고 그 모델을 서빙하는 프로바이더가 없을 때
   */
  public WaitHandle submitAndWait(
      String requestType,
      String model,
      Map<String, Object> payload,
      Long timeoutMs
  ) {
    if (api.rejectUnknownModels() && !isModelAvailable(model)) {
      log.info("event=request.rejected model={} reason=model_not_found", model);
      throw new ModelNotAvailableException(model);
    }
    Duration timeout = Duration.ofMillis(queue.resolveWaitTimeoutMs(timeoutMs));
    return waiter.submitAsync(requestTypeOrDefault(requestType), model, payload, timeout);
  }

  /**
   * 호출자가 연결을 끊었거나 대기를 포기했다.
   */
  public boolean abandonWait(String requestId, String reason) {
    return waiter.abandon(requestId, reason);
  }

  /**
   * 상태 조회. 종료 상태를 처음 관찰한 호출이 결과를 소비하고 요청을 삭제한다.
   */
  public Optional<InferenceResponse> getStatus(String requestId) {
    Optional<InferenceRequest> found = store.get(requestId);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    InferenceRequest request = found.get();
    if (!request.getStatus().isTerminal()) {
      return Optional.of(InferenceResponse.of(request));
    }

    Optional<InferenceResult> taken = results.takeAndDelete(requestId);
    if (taken.isEmpty()) {
      // 대기자가 먼저 가져갔다
      return Optional.empty();
    }
    store.remove(requestId);
    log.info("event=request.consumed requestId={} status={} via=status_lookup", requestId, request.getStatus());
    return Optional.of(InferenceResponse.completed(request, taken.get()));
  }

  public Optional<InferenceRequest> poll(ProviderCapabilities capabilities) {
    return matcher.match(capabilities);
  }

  public Optional<InferenceRequest> pollRegistered(String providerId) {
    return matcher.matchRegistered(providerId);
  }

  /**
   * 프로바이더 결과 제출. errorMessage 가 있으면 실패로 기록한다.
   *
   * @throws RequestNotFoundException 모르는 요청
   * @throws InvalidStateException 이미 종료됐거나(중복 제출) 아직 claim 되지 않은 요청
   */
  public void submitResult(
      String requestId,
      Map<String, Object> resultData,
      Map<String, Object> usage,
      String errorMessage
  ) {
    boolean failure = errorMessage != null && !errorMessage.isBlank();
    try {
      if (failure) {
        store.fail(requestId, errorMessage);
      } else {
        store.complete(requestId, resultData, usage);
      }
    } catch (InvalidStateException e) {
      log.warn("event=request.result_rejected requestId={} status={} attempted={} reason=invalid_state",
          requestId, e.getCurrent(), e.getAttempted());
      throw e;
    } catch (RequestNotFoundException e) {
      log.warn("event=request.result_rejected requestId={} reason=not_found", requestId);
      throw e;
    }

    InferenceRequest updated = store.get(requestId).orElse(null);
    Long latencyMs = updated == null || updated.getCompletedAt() == null
        ? null
        : Duration.between(updated.getCreatedAt(), updated.getCompletedAt()).toMillis();
    if (failure) {
      log.info("event=request.failed requestId={} status={} result={} latencyMs={} error={}",
          requestId, RequestStatus.FAILED, "FAILED", latencyMs, errorMessage);
    } else {
      log.info("event=request.completed requestId={} status={} result={} latencyMs={}",
          requestId, RequestStatus.COMPLETED, "SUCCESS", latencyMs);
    }
  }

  public QueueStats stats() {
    Map<RequestStatus, Long> counts = new EnumMap<>(RequestStatus.class);
    for (RequestStatus s : RequestStatus.values()) {
      counts.put(s, 0L);
    }
    List<InferenceRequest> snapshot = store.snapshot();
    for (InferenceRequest r : snapshot) {
      counts.merge(r.getStatus(), 1L, Long::sum);
    }
    int providers = registry.activeSnapshot(Instant.now(clock)).size();
    return new QueueStats(
        counts.get(RequestStatus.PENDING),
        counts.get(RequestStatus.PROCESSING),
        counts.get(RequestStatus.COMPLETED),
        counts.get(RequestStatus.FAILED),
        snapshot.size(),
        providers
    );
  }

  private boolean isModelAvailable(String model) {
    return registry.activeSnapshot(Instant.now(clock)).stream()
        .anyMatch(p -> p.supportedModels().contains(model));
  }

  static String requestTypeOrDefault(String requestType) {
    return requestType == null || requestType.isBlank() ? DEFAULT_REQUEST_TYPE : requestType;
  }
}
