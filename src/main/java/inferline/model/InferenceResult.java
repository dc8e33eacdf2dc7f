package inferline.model;

import java.util.Map;

/**
 * 프로바이더가 제출한 결과. 요청당 최대 하나이며 한 번 읽히면 삭제된다.
 *
 * @param requestId 대상 요청 id
 * @param resultData 결과 payload (해석하지 않음)
 * @param usage 토큰 사용량 등 부가 정보 (선택)
 * @param errorMessage 실패 결과일 때의 메시지 (선택)
 */
public record InferenceResult(
    String requestId,
    Map<String, Object> resultData,
    Map<String, Object> usage,
    String errorMessage
) {

  public static InferenceResult success(String requestId, Map<String, Object> resultData, Map<String, Object> usage) {
    return new InferenceResult(requestId, resultData == null ? Map.of() : resultData, usage, null);
  }

  public static InferenceResult failure(String requestId, String errorMessage) {
    return new InferenceResult(requestId, Map.of(), null, errorMessage);
  }

  public boolean isFailure() {
    return errorMessage != null;
  }
}
