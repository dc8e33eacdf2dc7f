package inferline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 브로커가 보관하는 단일 요청.
 *
 * <p>
 * - 생성부터 삭제까지 {@link inferline.store.RequestStore} 가 소유한다.
 * - 상태 변경은 스토어 내부에서만 일어나며, 외부로는 {@link #copy()} 스냅샷만 나간다.
 * - payload 는 해석하지 않는다. 매칭에 필요한 model 은 전송 계층이 따로 넘겨준다.
 * </p>
 */
public class InferenceRequest {

  private String requestId;
  private String requestType;
  private String model;
  private Map<String, Object> payload;
  private RequestStatus status;

  private Instant createdAt;
  private Instant startedAt;
  private Instant completedAt;
  private String errorMessage;

  public static InferenceRequest pending(
      String requestId,
      String requestType,
      String model,
      Map<String, Object> payload,
      Instant createdAt
  ) {
    InferenceRequest r = new InferenceRequest();
    r.requestId = requestId;
    r.requestType = requestType;
    r.model = model;
    r.payload = payload == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    r.status = RequestStatus.PENDING;
    r.createdAt = createdAt;
    return r;
  }

  /**
   * 스토어 밖으로 내보낼 시점 고정 사본. payload 는 불변이라 공유한다.
   */
  public InferenceRequest copy() {
    InferenceRequest c = new InferenceRequest();
    c.requestId = requestId;
    c.requestType = requestType;
    c.model = model;
    c.payload = payload;
    c.status = status;
    c.createdAt = createdAt;
    c.startedAt = startedAt;
    c.completedAt = completedAt;
    c.errorMessage = errorMessage;
    return c;
  }

  public String getRequestId() {
    return requestId;
  }

  public void setRequestId(String requestId) {
    this.requestId = requestId;
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

  public Map<String, Object> getPayload() {
    return payload;
  }

  public void setPayload(Map<String, Object> payload) {
    this.payload = payload;
  }

  public RequestStatus getStatus() {
    return status;
  }

  public void setStatus(RequestStatus status) {
    this.status = status;
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

  public String getErrorMessage() {
    return errorMessage;
  }

  public void setErrorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
  }
}
