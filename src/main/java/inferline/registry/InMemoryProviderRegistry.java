package inferline.registry;

import inferline.config.BrokerConfig.ProviderProperties;
import inferline.model.ProviderCapabilities;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class InMemoryProviderRegistry implements ProviderRegistry {
  private static final Logger log = LoggerFactory.getLogger(InMemoryProviderRegistry.class);

  private final ConcurrentMap<String, ProviderCapabilities> providers = new ConcurrentHashMap<>();
  private final Duration ttl;

  @Autowired
  public InMemoryProviderRegistry(ProviderProperties props) {
    this(Duration.ofSeconds(props.ttlSeconds()));
  }

  public InMemoryProviderRegistry(Duration ttl) {
    if (ttl == null || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must not be negative");
    }
    this.ttl = ttl;
  }

  @Override
  public ProviderCapabilities upsert(ProviderCapabilities capabilities, Instant now) {
    ProviderCapabilities record = capabilities.seenAt(now);
    ProviderCapabilities previous = providers.put(record.providerId(), record);
    if (previous == null) {
      log.info("event=provider.registered providerId={} models={} requestTypes={}",
          record.providerId(), record.supportedModels(), record.supportedRequestTypes());
    }
    return record;
  }

  @Override
  public List<ProviderCapabilities> activeSnapshot(Instant now) {
    List<ProviderCapabilities> active = new ArrayList<>();
    for (Map.Entry<String, ProviderCapabilities> e : providers.entrySet()) {
      if (isAlive(e.getValue(), now)) {
        active.add(e.getValue());
      } else {
        evict(e.getValue(), now);
      }
    }
    active.sort(Comparator.comparing(ProviderCapabilities::providerId));
    return active;
  }

  @Override
  public Optional<ProviderCapabilities> findActive(String providerId, Instant now) {
    if (providerId == null) {
      return Optional.empty();
    }
    ProviderCapabilities record = providers.get(providerId);
    if (record == null) {
      return Optional.empty();
    }
    if (!isAlive(record, now)) {
      evict(record, now);
      return Optional.empty();
    }
    return Optional.of(record);
  }

  private boolean isAlive(ProviderCapabilities record, Instant now) {
    return record.lastSeen() != null
        && Duration.between(record.lastSeen(), now).compareTo(ttl) <= 0;
  }

  private void evict(ProviderCapabilities stale, Instant now) {
    // 그 사이 새로 등록된 기록은 지우지 않는다
    if (providers.remove(stale.providerId(), stale)) {
      log.info("event=provider.expired providerId={} lastSeen={} ageSec={}",
          stale.providerId(), stale.lastSeen(), Duration.between(stale.lastSeen(), now).toSeconds());
    }
  }
}
