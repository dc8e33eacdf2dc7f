package inferline.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;

/**
 * 비동기 제출 본문.
 */
public class SubmitRequest {

  /**
   * 요청 종류. 비어 있으면 completion 으로 본다.
   */
  @Size(max = 64)
  private String requestType;

  @NotBlank
  @Size(max = 256)
  private String model;

  /**
   * 프로바이더에게 그대로 전달되는 본문(선택).
   */
  private Map<String, Object> payload;

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
}
