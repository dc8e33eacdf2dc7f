package inferline.model;

/**
 * 요청 생명주기 상태.
 *
 * <pre>
 * PENDING ──claim──► PROCESSING ──complete──► COMPLETED
 *    │                    └──────fail───────► FAILED
 *    └─────────────────fail─────────────────► FAILED   (디스패치 전 거절)
 * </pre>
 *
 * <p>역방향 전이는 없다. COMPLETED 와 FAILED 는 서로 배타적인 종료 상태.</p>
 */
public enum RequestStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
