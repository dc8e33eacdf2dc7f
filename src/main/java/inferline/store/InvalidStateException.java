package inferline.store;

import inferline.model.RequestStatus;

/**
 * 상태 전이 전제 조건 위반. 이 예외가 나가면 저장된 상태는 바뀌지 않은 것이다.
 */
public class InvalidStateException extends RuntimeException {

  private final String requestId;
  private final RequestStatus current;
  private final RequestStatus attempted;

  public InvalidStateException(String requestId, RequestStatus current, RequestStatus attempted) {
    super(String.format("Invalid state transition for %s: %s → %s", requestId, current, attempted));
    this.requestId = requestId;
    this.current = current;
    this.attempted = attempted;
  }

  public String getRequestId() {
    return requestId;
  }

  public RequestStatus getCurrent() {
    return current;
  }

  public RequestStatus getAttempted() {
    return attempted;
  }
}
