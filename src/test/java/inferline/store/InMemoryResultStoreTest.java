package inferline.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import inferline.model.InferenceResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InMemoryResultStoreTest {

  private final InMemoryResultStore store = new InMemoryResultStore();

  @Test
  void getDoesNotConsumeButTakeDoes() {
    store.put(InferenceResult.success("r1", Map.of("text", "hello"), Map.of("tokens", 5)));

    assertThat(store.get("r1")).isPresent();
    assertThat(store.get("r1")).isPresent();

    Optional<InferenceResult> taken = store.takeAndDelete("r1");
    assertThat(taken).isPresent();
    assertThat(taken.get().resultData()).containsEntry("text", "hello");
    assertThat(taken.get().usage()).containsEntry("tokens", 5);

    assertThat(store.takeAndDelete("r1")).isEmpty();
    assertThat(store.get("r1")).isEmpty();
  }

  @Test
  void unknownAndNullIdsAreNotFound() {
    assertThat(store.get("nope")).isEmpty();
    assertThat(store.takeAndDelete(null)).isEmpty();
  }

  @Test
  void putRejectsResultWithoutRequestId() {
    assertThatThrownBy(() -> store.put(new InferenceResult(null, Map.of(), null, null)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void concurrentTakersReceiveResultAtMostOnce() throws Exception {
    store.put(InferenceResult.success("race", Map.of("text", "once"), null));

    int threads = 16;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Optional<InferenceResult>>> futures = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      futures.add(pool.submit(() -> {
        start.await();
        return store.takeAndDelete("race");
      }));
    }
    start.countDown();

    int delivered = 0;
    for (Future<Optional<InferenceResult>> f : futures) {
      if (f.get(5, TimeUnit.SECONDS).isPresent()) {
        delivered++;
      }
    }
    pool.shutdown();

    assertThat(delivered).isEqualTo(1);
    assertThat(store.size()).isZero();
  }
}
