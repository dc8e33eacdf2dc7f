package inferline.store;

import inferline.model.InferenceResult;
import java.util.Optional;

/**
 * 완료/실패한 요청의 결과 저장소. key 는 requestId.
 */
public interface ResultStore {

  void put(InferenceResult result);

  Optional<InferenceResult> get(String requestId);

  /**
   * 읽기와 삭제를 한 번에 한다. 두 호출자가 경쟁해도 결과는 한쪽에만 전달된다.
   */
  Optional<InferenceResult> takeAndDelete(String requestId);

  int size();
}
