package inferline.service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 비동기 대기 중인 요청. 큐에 들어간 requestId 와 결과 future 를 함께 들고 있다.
 */
public final class WaitHandle {

  private final String requestId;
  private final Duration timeout;
  private final CompletableFuture<WaitOutcome> outcome;

  WaitHandle(String requestId, Duration timeout, CompletableFuture<WaitOutcome> outcome) {
    this.requestId = requestId;
    this.timeout = timeout;
    this.outcome = outcome;
  }

  public String getRequestId() {
    return requestId;
  }

  public Duration getTimeout() {
    return timeout;
  }

  /**
   * {@link WaitOutcome} 으로 정상 완료되거나, 요청이 사라졌으면 RequestNotFoundException 으로 예외 완료된다.
   */
  public CompletableFuture<WaitOutcome> getOutcome() {
    return outcome;
  }
}
