package inferline.model;

import java.time.Instant;
import java.util.Set;

/**
 * 프로바이더가 선언한 처리 가능 범위(모델 x 요청 종류)와 마지막 접촉 시각.
 * 같은 providerId 로 다시 등록하면 병합 없이 통째로 교체된다.
 */
public record ProviderCapabilities(
    String providerId,
    Set<String> supportedModels,
    Set<String> supportedRequestTypes,
    Instant lastSeen
) {

  public ProviderCapabilities {
    if (providerId == null || providerId.isBlank()) {
      throw new IllegalArgumentException("providerId must not be blank");
    }
    supportedModels = supportedModels == null ? Set.of() : Set.copyOf(supportedModels);
    supportedRequestTypes = supportedRequestTypes == null ? Set.of() : Set.copyOf(supportedRequestTypes);
  }

  public ProviderCapabilities seenAt(Instant now) {
    return new ProviderCapabilities(providerId, supportedModels, supportedRequestTypes, now);
  }

  public boolean canServe(String model, String requestType) {
    return model != null
        && requestType != null
        && supportedModels.contains(model)
        && supportedRequestTypes.contains(requestType);
  }
}
