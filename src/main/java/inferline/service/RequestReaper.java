package inferline.service;

import inferline.config.BrokerConfig.QueueProperties;
import inferline.model.InferenceRequest;
import inferline.store.RequestStore;
import inferline.store.ResultStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 아무도 찾아가지 않는 요청을 치운다.
 *
 * <p>
 * 동기 대기가 타임아웃된 요청은 일부러 남겨 두므로, 생성 후 orphanTtlMs 가 지난 항목은
 * 상태와 무관하게 요청과 미소비 결과를 함께 삭제한다.
 * </p>
 */
@Component
public class RequestReaper {
  private static final Logger log = LoggerFactory.getLogger(RequestReaper.class);

  private final Clock clock;
  private final RequestStore store;
  private final ResultStore results;
  private final Duration orphanTtl;

  public RequestReaper(Clock clock, RequestStore store, ResultStore results, QueueProperties props) {
    this.clock = clock;
    this.store = store;
    this.results = results;
    this.orphanTtl = Duration.ofMillis(props.orphanTtlMs());
  }

  @Scheduled(
      fixedDelayString = "${inferline.queue.reaperIntervalMs:30000}",
      initialDelayString = "${inferline.queue.reaperIntervalMs:30000}")
  public void sweep() {
    reap(Instant.now(clock));
  }

  /**
   * @return 삭제한 요청 수
   */
  public int reap(Instant now) {
    Instant cutoff = now.minus(orphanTtl);
    int reaped = 0;
    for (InferenceRequest r : store.snapshot()) {
      if (!r.getCreatedAt().isBefore(cutoff)) {
        continue;
      }
      store.remove(r.getRequestId());
      boolean hadResult = results.takeAndDelete(r.getRequestId()).isPresent();
      reaped++;
      log.info("event=request.reaped requestId={} status={} ageMs={} hadResult={}",
          r.getRequestId(), r.getStatus(), Duration.between(r.getCreatedAt(), now).toMillis(), hadResult);
    }
    if (reaped > 0) {
      log.info("event=reaper.sweep reaped={} orphanTtlMs={}", reaped, orphanTtl.toMillis());
    }
    return reaped;
  }
}
