package inferline.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 상태 조회 응답.
 *
 * <p>
 * - PENDING / PROCESSING: 진행 상태만 담는다.
 * - COMPLETED: result/usage 를 담는다. 이 응답을 만든 조회가 결과를 소비한 것이다.
 * - FAILED: error 에 프로바이더 메시지를 그대로 담는다.
 * </p>
 */
public class InferenceResponse {

  private String requestId;
  private RequestStatus status;
  private String requestType;
  private String model;

  private Instant createdAt;
  private Instant startedAt;
  private Instant completedAt;
  private Long latencyMs;

  private Map<String, Object> result;
  private Map<String, Object> usage;
  private String error;

  public static InferenceResponse of(InferenceRequest request) {
    InferenceResponse r = new InferenceResponse();
    r.requestId = request.getRequestId();
    r.status = request.getStatus();
    r.requestType = request.getRequestType();
    r.model = request.getModel();
    r.createdAt = request.getCreatedAt();
    r.startedAt = request.getStartedAt();
    r.completedAt = request.getCompletedAt();
    r.error = request.getErrorMessage();
    if (request.getCompletedAt() != null && request.getCreatedAt() != null) {
      r.latencyMs = Duration.between(request.getCreatedAt(), request.getCompletedAt()).toMillis();
    }
    return r;
  }

  public static InferenceResponse completed(InferenceRequest request, InferenceResult result) {
    InferenceResponse r = of(request);
    if (result != null && !result.isFailure()) {
      r.result = result.resultData();
      r.usage = result.usage();
    }
    return r;
  }

  public String getRequestId() {
    return requestId;
  }

  public void setRequestId(String requestId) {
    this.requestId = requestId;
  }

  public RequestStatus getStatus() {
    return status;
  }

  public void setStatus(RequestStatus status) {
    this.status = status;
  }

  public String getRequestType() {
    return requestType;
  }

  public void setRequestType(String requestType) {
    this.requestType = requestType;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public void setStartedAt(Instant startedAt) {
    this.startedAt = startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public void setCompletedAt(Instant completedAt) {
    this.completedAt = completedAt;
  }

  public Long getLatencyMs() {
    return latencyMs;
  }

  public void setLatencyMs(Long latencyMs) {
    this.latencyMs = latencyMs;
  }

  public Map<String, Object> getResult() {
    return result;
  }

  public void setResult(Map<String, Object> result) {
    this.result = result;
  }

  public Map<String, Object> getUsage() {
    return usage;
  }

  public void setUsage(Map<String, Object> usage) {
    this.usage = usage;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
