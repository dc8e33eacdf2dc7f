package inferline.registry;

import inferline.model.ProviderCapabilities;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 활성 프로바이더와 그 처리 범위를 추적한다.
 *
 * <p>
 * - 폴링이 곧 생존 신호이다. 별도 heartbeat 는 없다.
 * - TTL 이 지난 기록은 조회 결과에서 빠지고, 조회 시점에 지연 삭제된다 (백그라운드 sweep 없음).
 * </p>
 */
public interface ProviderRegistry {

  /**
   * 기존 기록을 통째로 교체한다 (last-write-wins).
   */
  ProviderCapabilities upsert(ProviderCapabilities capabilities, Instant now);

  /**
   * {@code now - lastSeen <= ttl} 인 기록만 돌려준다.
   */
  List<ProviderCapabilities> activeSnapshot(Instant now);

  Optional<ProviderCapabilities> findActive(String providerId, Instant now);
}
