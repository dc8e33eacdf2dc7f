package inferline.store;

/**
 * 알 수 없는 requestId (만료/소비/재시작 등).
 */
public class RequestNotFoundException extends RuntimeException {

  private final String requestId;

  public RequestNotFoundException(String requestId) {
    super("request not found: " + requestId);
    this.requestId = requestId;
  }

  public String getRequestId() {
    return requestId;
  }
}
