package inferline.model;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * 프로바이더의 결과 제출 본문. errorMessage 가 있으면 실패로 처리한다.
 */
public class ResultSubmission {

  @NotBlank
  private String requestId;

  private Map<String, Object> resultData;
  private Map<String, Object> usage;
  private String errorMessage;

  public boolean isFailure() {
    return errorMessage != null && !errorMessage.isBlank();
  }

  public String getRequestId() {
    return requestId;
  }

  public void setRequestId(String requestId) {
    this.requestId = requestId;
  }

  public Map<String, Object> getResultData() {
    return resultData;
  }

  public void setResultData(Map<String, Object> resultData) {
    this.resultData = resultData;
  }

  public Map<String, Object> getUsage() {
    return usage;
  }

  public void setUsage(Map<String, Object> usage) {
    this.usage = usage;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public void setErrorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
  }
}
