package inferline.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import inferline.model.ProviderCapabilities;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import org.junit.jupiter.api.Test;

class InMemoryProviderRegistryTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  private final InMemoryProviderRegistry registry = new InMemoryProviderRegistry(Duration.ofSeconds(300));

  @Test
  void upsertStampsLastSeen() {
    ProviderCapabilities record = registry.upsert(caps("p1", Set.of("m1")), T0);

    assertThat(record.lastSeen()).isEqualTo(T0);
    assertThat(registry.findActive("p1", T0)).contains(record);
  }

  @Test
  void reRegistrationSupersedesInsteadOfMerging() {
    registry.upsert(caps("p1", Set.of("m1", "m2")), T0);
    registry.upsert(caps("p1", Set.of("m3")), T0.plusSeconds(10));

    ProviderCapabilities current = registry.findActive("p1", T0.plusSeconds(10)).orElseThrow();
    assertThat(current.supportedModels()).containsExactly("m3");
    assertThat(current.lastSeen()).isEqualTo(T0.plusSeconds(10));
    assertThat(registry.activeSnapshot(T0.plusSeconds(10))).hasSize(1);
  }

  @Test
  void recordAtExactlyTtlIsStillActive() {
    registry.upsert(caps("p1", Set.of("m1")), T0);

    assertThat(registry.activeSnapshot(T0.plusSeconds(300))).hasSize(1);
  }

  @Test
  void expiredRecordsAreExcludedWithoutDeregistration() {
    registry.upsert(caps("stale", Set.of("m1")), T0.minusSeconds(400));
    registry.upsert(caps("fresh", Set.of("m2")), T0.minusSeconds(10));

    assertThat(registry.activeSnapshot(T0))
        .extracting(ProviderCapabilities::providerId)
        .containsExactly("fresh");
    assertThat(registry.findActive("stale", T0)).isEmpty();
  }

  @Test
  void expiredRecordIsPurgedLazilyOnRead() {
    registry.upsert(caps("p1", Set.of("m1")), T0);

    assertThat(registry.findActive("p1", T0.plusSeconds(301))).isEmpty();
    // 읽기가 지웠으므로 시간을 되돌려도 보이지 않는다
    assertThat(registry.findActive("p1", T0)).isEmpty();
  }

  @Test
  void pollAfterExpiryRevivesProvider() {
    registry.upsert(caps("p1", Set.of("m1")), T0);
    assertThat(registry.activeSnapshot(T0.plusSeconds(400))).isEmpty();

    registry.upsert(caps("p1", Set.of("m1")), T0.plusSeconds(400));

    assertThat(registry.activeSnapshot(T0.plusSeconds(400))).hasSize(1);
  }

  @Test
  void capabilitiesRequireProviderId() {
    assertThatThrownBy(() -> caps(" ", Set.of("m1")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static ProviderCapabilities caps(String id, Set<String> models) {
    return new ProviderCapabilities(id, models, Set.of("completion"), null);
  }
}
