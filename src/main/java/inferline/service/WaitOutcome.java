package inferline.service;

import inferline.model.InferenceResult;
import java.util.Map;

/**
 * 동기 대기(submit-and-wait)의 결과.
 *
 * <p>
 * - COMPLETED: 결과를 받았다. 요청과 결과는 이미 삭제됐다.
 * - UPSTREAM_FAILURE: 프로바이더가 실패를 보고했다. 메시지는 그대로 전달한다.
 * - TIMEOUT: 제한 시간 안에 끝나지 않았다. 요청은 남아 있으니 나중에 상태 조회로 찾아갈 수 있다.
 * </p>
 */
public final class WaitOutcome {

  public enum Kind {
    COMPLETED,
    UPSTREAM_FAILURE,
    TIMEOUT
  }

  private final Kind kind;
  private final String requestId;
  private final InferenceResult result;
  private final String errorMessage;

  private WaitOutcome(Kind kind, String requestId, InferenceResult result, String errorMessage) {
    this.kind = kind;
    this.requestId = requestId;
    this.result = result;
    this.errorMessage = errorMessage;
  }

  public static WaitOutcome completed(String requestId, InferenceResult result) {
    if (result == null) {
      throw new IllegalArgumentException("result cannot be null for completed outcome");
    }
    return new WaitOutcome(Kind.COMPLETED, requestId, result, null);
  }

  public static WaitOutcome upstreamFailure(String requestId, String errorMessage) {
    return new WaitOutcome(Kind.UPSTREAM_FAILURE, requestId, null, errorMessage);
  }

  public static WaitOutcome timeout(String requestId) {
    return new WaitOutcome(Kind.TIMEOUT, requestId, null, null);
  }

  public Kind getKind() {
    return kind;
  }

  public String getRequestId() {
    return requestId;
  }

  /**
   * COMPLETED 일 때만 non-null.
   */
  public InferenceResult getResult() {
    return result;
  }

  public Map<String, Object> getResultData() {
    return result == null ? null : result.resultData();
  }

  /**
   * UPSTREAM_FAILURE 일 때만 non-null.
   */
  public String getErrorMessage() {
    return errorMessage;
  }

  @Override
  public String toString() {
    return "WaitOutcome{kind=" + kind + ", requestId=" + requestId
        + (errorMessage == null ? "" : ", error=" + errorMessage) + "}";
  }
}
