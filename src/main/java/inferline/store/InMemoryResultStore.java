package inferline.store;

import inferline.model.InferenceResult;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/**
 * 프로세스 수명 동안만 유지되는 인메모리 구현. 재시작 시 유실된다.
 */
@Component
public class InMemoryResultStore implements ResultStore {

  private final ConcurrentMap<String, InferenceResult> results = new ConcurrentHashMap<>();

  @Override
  public void put(InferenceResult result) {
    if (result == null || result.requestId() == null) {
      throw new IllegalArgumentException("result and requestId must not be null");
    }
    results.put(result.requestId(), result);
  }

  @Override
  public Optional<InferenceResult> get(String requestId) {
    if (requestId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(results.get(requestId));
  }

  @Override
  public Optional<InferenceResult> takeAndDelete(String requestId) {
    if (requestId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(results.remove(requestId));
  }

  @Override
  public int size() {
    return results.size();
  }
}
