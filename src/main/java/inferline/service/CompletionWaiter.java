package inferline.service;

import inferline.model.InferenceResult;
import inferline.model.RequestStatus;
import inferline.store.RequestNotFoundException;
import inferline.store.RequestStore;
import inferline.store.ResultStore;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 요청을 넣고 종료 상태까지 호출 스레드를 붙잡아 두는 동기 호출 패턴.
 *
 * <p>
 * - 주기적 폴링 대신 스토어의 종료 신호를 기다린다. 대기 중에는 어떤 락도 잡지 않는다.
 * - 타임아웃: 요청을 지우지 않는다. 늦게라도 프로바이더가 가져갈 수 있고, 오래 남으면 {@link RequestReaper} 가 치운다.
 * - 인터럽트(호출 취소): 아직 PENDING 이면 회수한다. PROCESSING 이면 프로바이더 몫이라 그대로 둔다.
 * - 비동기 대기({@link #awaitAsync})는 스레드를 붙잡지 않는다. 호출자가 떠나면 {@link #abandon} 으로 같은 회수를 한다.
 * </p>
 */
@Component
public class CompletionWaiter {
  private static final Logger log = LoggerFactory.getLogger(CompletionWaiter.class);

  private final RequestStore store;
  private final ResultStore results;

  public CompletionWaiter(RequestStore store, ResultStore results) {
    this.store = store;
    this.results = results;
  }

  public WaitOutcome submitAndWait(
      String requestType,
      String model,
      Map<String, Object> payload,
      Duration timeout
  ) throws InterruptedException {
    String requestId = store.enqueue(requestType, model, payload);
    log.info("event=request.enqueued requestId={} requestType={} model={} mode=wait timeoutMs={}",
        requestId, requestType, model, timeout.toMillis());
    return await(requestId, timeout);
  }

  public WaitHandle submitAsync(
      String requestType,
      String model,
      Map<String, Object> payload,
      Duration timeout
  ) {
    String requestId = store.enqueue(requestType, model, payload);
    log.info("event=request.enqueued requestId={} requestType={} model={} mode=wait_async timeoutMs={}",
        requestId, requestType, model, timeout.toMillis());
    return new WaitHandle(requestId, timeout, awaitAsync(requestId, timeout));
  }

  /**
   * 종료 신호에 이어 붙인 future 를 돌려준다. 대기하는 스레드는 없다.
   *
   * <p>타임아웃이면 TIMEOUT 으로 끝나고, 요청이 사라졌거나 결과를 다른 쪽이 가져갔으면
   * {@link RequestNotFoundException} 으로 예외 완료된다.</p>
   */
  public CompletableFuture<WaitOutcome> awaitAsync(String requestId, Duration timeout) {
    CompletableFuture<RequestStatus> signal = store.terminalSignal(requestId)
        .orElseThrow(() -> new RequestNotFoundException(requestId));

    // signal 은 스토어가 준 사본이라 여기서 null 로 완료시켜도 된다
    return signal
        .completeOnTimeout(null, Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS)
        .handle((terminal, failure) -> {
          if (failure != null) {
            log.info("event=request.wait_aborted requestId={} reason=removed", requestId);
            throw new RequestNotFoundException(requestId);
          }
          if (terminal == null) {
            RequestStatus current = store.get(requestId).map(r -> r.getStatus()).orElse(null);
            log.warn("event=request.wait_timeout requestId={} status={} timeoutMs={} result=TIMEOUT",
                requestId, current, timeout.toMillis());
            return WaitOutcome.timeout(requestId);
          }
          return consume(requestId, terminal);
        });
  }

  /**
   * 호출자가 결과를 더 기다리지 않는다. 아직 PENDING 이면 회수한다.
   *
   * @return 회수했으면 true
   */
  public boolean abandon(String requestId, String reason) {
    boolean withdrawn = store.withdraw(requestId);
    log.info("event=request.wait_cancelled requestId={} withdrawn={} reason={}", requestId, withdrawn, reason);
    return withdrawn;
  }

  /**
   * 이미 큐에 있는 요청의 종료를 기다린다.
   *
   * @throws RequestNotFoundException 요청이 없거나, 기다리는 사이 삭제/소비된 경우
   * @throws InterruptedException 대기 중 인터럽트. PENDING 이었다면 요청은 회수된다.
   */
  public WaitOutcome await(String requestId, Duration timeout) throws InterruptedException {
    CompletableFuture<RequestStatus> signal = store.terminalSignal(requestId)
        .orElseThrow(() -> new RequestNotFoundException(requestId));

    RequestStatus terminal;
    try {
      terminal = signal.get(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
    } catch (TimeoutException te) {
      RequestStatus current = store.get(requestId).map(r -> r.getStatus()).orElse(null);
      log.warn("event=request.wait_timeout requestId={} status={} timeoutMs={} result=TIMEOUT",
          requestId, current, timeout.toMillis());
      return WaitOutcome.timeout(requestId);
    } catch (InterruptedException ie) {
      abandon(requestId, "interrupted");
      throw ie;
    } catch (CancellationException | ExecutionException removed) {
      // 종료 전에 누군가 요청을 지웠다 (회수 또는 reaper)
      log.info("event=request.wait_aborted requestId={} reason=removed", requestId);
      throw new RequestNotFoundException(requestId);
    }

    return consume(requestId, terminal);
  }

  private WaitOutcome consume(String requestId, RequestStatus terminal) {
    Optional<InferenceResult> taken = results.takeAndDelete(requestId);
    if (taken.isEmpty()) {
      // 상태 조회가 먼저 결과를 가져갔다
      log.info("event=request.wait_lost requestId={} status={} reason=already_consumed", requestId, terminal);
      throw new RequestNotFoundException(requestId);
    }
    store.remove(requestId);

    InferenceResult result = taken.get();
    if (terminal == RequestStatus.FAILED || result.isFailure()) {
      log.info("event=request.consumed requestId={} status={} result=UPSTREAM_FAILURE", requestId, RequestStatus.FAILED);
      return WaitOutcome.upstreamFailure(requestId, result.errorMessage());
    }
    log.info("event=request.consumed requestId={} status={} result=SUCCESS", requestId, RequestStatus.COMPLETED);
    return WaitOutcome.completed(requestId, result);
  }
}
