package inferline.controller;

import inferline.model.ModelCatalog;
import inferline.model.ProviderCapabilities;
import inferline.model.ProviderRegistration;
import inferline.service.ProviderService;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProviderController {
  private static final Logger log = LoggerFactory.getLogger(ProviderController.class);

  private final ProviderService providers;

  public ProviderController(ProviderService providers) {
    this.providers = providers;
  }

  /**
   * 명시적 등록. 같은 providerId 의 이전 기록은 통째로 교체된다.
   */
  @PostMapping("/v1/providers")
  public ProviderCapabilities register(@Valid @RequestBody ProviderRegistration registration) {
    ProviderCapabilities record = providers.register(registration.toCapabilities());
    log.info("event=provider.register providerId={} models={}", record.providerId(), record.supportedModels().size());
    return record;
  }

  @GetMapping("/v1/providers")
  public List<ProviderCapabilities> active() {
    return providers.activeProviders();
  }

  @GetMapping("/v1/providers/{providerId}")
  public ProviderCapabilities get(@PathVariable String providerId) {
    return providers.provider(providerId);
  }

  /**
   * 지금 연결된 프로바이더들이 처리하는 모델 목록.
   */
  @GetMapping("/v1/models")
  public ModelCatalog models() {
    return providers.models();
  }
}
