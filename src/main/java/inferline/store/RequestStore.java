package inferline.store;

import inferline.model.InferenceRequest;
import inferline.model.RequestStatus;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 진행 중인 요청과 그 생명주기 상태를 보관하는 저장소.
 *
 * <p>
 * - 모든 상태 변경은 이 인터페이스의 원자적 연산으로만 일어난다.
 * - 조회 결과는 항상 사본이다. 반환된 객체를 고쳐도 저장 상태에는 영향이 없다.
 * </p>
 */
public interface RequestStore {

  /**
   * PENDING 상태로 새 요청을 만들고 새 id 를 돌려준다. 항상 성공한다.
   */
  String enqueue(String requestType, String model, Map<String, Object> payload);

  /**
   * PENDING → PROCESSING. 요청이 존재하고 PENDING 일 때만 성공하며, 실패 시 아무것도 바꾸지 않는다.
   * 같은 요청에 대해 동시에 호출해도 하나만 true 를 받는다.
   */
  boolean claim(String requestId);

  /**
   * PROCESSING → COMPLETED. 결과는 같은 임계 구역 안에서 {@link ResultStore} 에 게시된다.
   *
   * @throws RequestNotFoundException 요청이 없을 때
   * @throws InvalidStateException 요청이 PROCESSING 이 아닐 때
   */
  void complete(String requestId, Map<String, Object> resultData, Map<String, Object> usage);

  /**
   * PENDING 또는 PROCESSING → FAILED.
   *
   * @throws RequestNotFoundException 요청이 없을 때
   * @throws InvalidStateException 이미 종료 상태일 때
   */
  void fail(String requestId, String errorMessage);

  Optional<InferenceRequest> get(String requestId);

  /**
   * 삭제. 없는 id 에 대해서도 조용히 성공한다.
   */
  void remove(String requestId);

  /**
   * 아직 PENDING 인 요청만 삭제한다. 이미 누군가 가져간 요청은 건드리지 않는다.
   *
   * @return 삭제했으면 true
   */
  boolean withdraw(String requestId);

  /**
   * 한 시점 기준의 일관된 사본 목록 (생성 순서).
   */
  List<InferenceRequest> snapshot();

  /**
   * 요청이 종료 상태에 도달하면 완료되는 신호.
   * 요청이 종료 전에 삭제되면 취소된다.
   */
  Optional<CompletableFuture<RequestStatus>> terminalSignal(String requestId);
}
