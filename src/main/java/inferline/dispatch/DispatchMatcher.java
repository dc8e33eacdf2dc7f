package inferline.dispatch;

import inferline.model.InferenceRequest;
import inferline.model.ProviderCapabilities;
import inferline.model.RequestStatus;
import inferline.registry.ProviderRegistry;
import inferline.store.RequestStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 폴링한 프로바이더에게 줄 요청 하나를 골라 claim 한다.
 *
 * <p>
 * - 대상: PENDING 이고 model/requestType 이 프로바이더 선언 범위에 드는 요청.
 * - 순서: 생성 시각이 가장 이른 것, 같으면 requestId 사전순.
 * - claim 경쟁에서 지면 비우지 않고 다음 후보로 넘어간다.
 * - 빈 결과(Optional.empty)는 "지금 줄 일이 없음" 이지 오류가 아니다.
 * </p>
 */
@Component
public class DispatchMatcher {
  private static final Logger log = LoggerFactory.getLogger(DispatchMatcher.class);

  static final Comparator<InferenceRequest> DISPATCH_ORDER =
      Comparator.comparing(InferenceRequest::getCreatedAt)
          .thenComparing(InferenceRequest::getRequestId);

  private final Clock clock;
  private final RequestStore store;
  private final ProviderRegistry registry;

  public DispatchMatcher(Clock clock, RequestStore store, ProviderRegistry registry) {
    this.clock = clock;
    this.store = store;
    this.registry = registry;
  }

  public Optional<InferenceRequest> match(ProviderCapabilities capabilities) {
    return match(capabilities, Instant.now(clock));
  }

  /**
   * 폴링 본문에 실린 범위로 등록을 갱신한 뒤 매칭한다.
   */
  public Optional<InferenceRequest> match(ProviderCapabilities capabilities, Instant now) {
    ProviderCapabilities record = registry.upsert(capabilities, now);
    return claimNext(record, now);
  }

  /**
   * 이미 등록된 범위로 매칭한다. 등록이 없거나 TTL 이 지났으면 빈 결과.
   */
  public Optional<InferenceRequest> matchRegistered(String providerId, Instant now) {
    Optional<ProviderCapabilities> active = registry.findActive(providerId, now);
    if (active.isEmpty()) {
      log.debug("event=dispatch.skipped providerId={} reason=provider_inactive", providerId);
      return Optional.empty();
    }
    return match(active.get(), now);
  }

  public Optional<InferenceRequest> matchRegistered(String providerId) {
    return matchRegistered(providerId, Instant.now(clock));
  }

  private Optional<InferenceRequest> claimNext(ProviderCapabilities provider, Instant now) {
    List<InferenceRequest> candidates = eligible(store.snapshot(), provider);
    int lost = 0;
    for (InferenceRequest candidate : candidates) {
      if (!store.claim(candidate.getRequestId())) {
        // 다른 폴러가 먼저 가져갔다
        lost++;
        continue;
      }
      Optional<InferenceRequest> claimed = store.get(candidate.getRequestId());
      if (claimed.isEmpty()) {
        // claim 직후 reaper 가 치운 경우
        continue;
      }
      InferenceRequest r = claimed.get();
      log.info("event=dispatch.claimed requestId={} providerId={} model={} requestType={} queuedMs={} lostRaces={}",
          r.getRequestId(), provider.providerId(), r.getModel(), r.getRequestType(),
          Duration.between(r.getCreatedAt(), r.getStartedAt() == null ? now : r.getStartedAt()).toMillis(),
          lost);
      return claimed;
    }
    log.debug("event=dispatch.no_pending_work providerId={} candidates={} lostRaces={}",
        provider.providerId(), candidates.size(), lost);
    return Optional.empty();
  }

  static List<InferenceRequest> eligible(List<InferenceRequest> snapshot, ProviderCapabilities provider) {
    return snapshot.stream()
        .filter(r -> r.getStatus() == RequestStatus.PENDING)
        .filter(r -> provider.canServe(r.getModel(), r.getRequestType()))
        .sorted(DISPATCH_ORDER)
        .collect(Collectors.toList());
  }
}
