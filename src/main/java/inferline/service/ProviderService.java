package inferline.service;

import inferline.model.ModelCatalog;
import inferline.model.ProviderCapabilities;
import inferline.registry.ProviderNotFoundException;
import inferline.registry.ProviderRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Service;

/**
 * 프로바이더 등록과, 등록 정보에서 파생되는 모델 카탈로그.
 */
@Service
public class ProviderService {

  private final Clock clock;
  private final ProviderRegistry registry;

  public ProviderService(Clock clock, ProviderRegistry registry) {
    this.clock = clock;
    this.registry = registry;
  }

  public ProviderCapabilities register(ProviderCapabilities capabilities) {
    return registry.upsert(capabilities, Instant.now(clock));
  }

  public List<ProviderCapabilities> activeProviders() {
    return registry.activeSnapshot(Instant.now(clock));
  }

  public ProviderCapabilities provider(String providerId) {
    return registry.findActive(providerId, Instant.now(clock))
        .orElseThrow(() -> new ProviderNotFoundException(providerId));
  }

  /**
   * 모델 id 순으로, 각 모델을 처리하는 프로바이더 id 를 모은다.
   */
  public ModelCatalog models() {
    Map<String, List<String>> byModel = new TreeMap<>();
    for (ProviderCapabilities p : activeProviders()) {
      for (String model : p.supportedModels()) {
        byModel.computeIfAbsent(model, k -> new ArrayList<>()).add(p.providerId());
      }
    }
    List<ModelCatalog.Entry> entries = new ArrayList<>(byModel.size());
    byModel.forEach((model, providers) -> entries.add(ModelCatalog.Entry.of(model, providers)));
    return ModelCatalog.of(entries);
  }
}
