package inferline.store;

import inferline.model.InferenceRequest;
import inferline.model.InferenceResult;
import inferline.model.RequestStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * 단일 인스턴스용 인메모리 구현.
 *
 * <p>
 * - 하나의 락으로 맵 전체를 보호한다. 임계 구역은 O(1), snapshot 만 O(n).
 * - 종료 신호(future)는 락을 놓은 뒤에 완료시킨다. 대기자가 락을 잡고 깨어나는 일은 없다.
 * - 재시작/스케일아웃 시 데이터는 유실된다.
 * </p>
 */
@Component
public class InMemoryRequestStore implements RequestStore {

  private final Clock clock;
  private final ResultStore results;

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Entry> entries = new LinkedHashMap<>();

  public InMemoryRequestStore(Clock clock, ResultStore results) {
    this.clock = clock;
    this.results = results;
  }

  @Override
  public String enqueue(String requestType, String model, Map<String, Object> payload) {
    Instant now = Instant.now(clock);
    lock.lock();
    try {
      String id = newId();
      while (entries.containsKey(id)) {
        id = newId();
      }
      entries.put(id, new Entry(InferenceRequest.pending(id, requestType, model, payload, now)));
      return id;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean claim(String requestId) {
    if (requestId == null) {
      return false;
    }
    lock.lock();
    try {
      Entry e = entries.get(requestId);
      if (e == null || e.request.getStatus() != RequestStatus.PENDING) {
        return false;
      }
      e.request.setStatus(RequestStatus.PROCESSING);
      e.request.setStartedAt(Instant.now(clock));
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void complete(String requestId, Map<String, Object> resultData, Map<String, Object> usage) {
    Entry e;
    lock.lock();
    try {
      e = require(requestId);
      RequestStatus current = e.request.getStatus();
      if (current != RequestStatus.PROCESSING) {
        throw new InvalidStateException(requestId, current, RequestStatus.COMPLETED);
      }
      results.put(InferenceResult.success(requestId, resultData, usage));
      e.request.setStatus(RequestStatus.COMPLETED);
      e.request.setCompletedAt(Instant.now(clock));
    } finally {
      lock.unlock();
    }
    e.terminal.complete(RequestStatus.COMPLETED);
  }

  @Override
  public void fail(String requestId, String errorMessage) {
    Entry e;
    lock.lock();
    try {
      e = require(requestId);
      RequestStatus current = e.request.getStatus();
      if (current.isTerminal()) {
        throw new InvalidStateException(requestId, current, RequestStatus.FAILED);
      }
      results.put(InferenceResult.failure(requestId, errorMessage));
      e.request.setStatus(RequestStatus.FAILED);
      e.request.setErrorMessage(errorMessage);
      e.request.setCompletedAt(Instant.now(clock));
    } finally {
      lock.unlock();
    }
    e.terminal.complete(RequestStatus.FAILED);
  }

  @Override
  public Optional<InferenceRequest> get(String requestId) {
    if (requestId == null) {
      return Optional.empty();
    }
    lock.lock();
    try {
      Entry e = entries.get(requestId);
      return e == null ? Optional.empty() : Optional.of(e.request.copy());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void remove(String requestId) {
    if (requestId == null) {
      return;
    }
    Entry removed;
    lock.lock();
    try {
      removed = entries.remove(requestId);
    } finally {
      lock.unlock();
    }
    if (removed != null) {
      removed.terminal.cancel(false);
    }
  }

  @Override
  public boolean withdraw(String requestId) {
    if (requestId == null) {
      return false;
    }
    Entry removed = null;
    lock.lock();
    try {
      Entry e = entries.get(requestId);
      if (e != null && e.request.getStatus() == RequestStatus.PENDING) {
        removed = entries.remove(requestId);
      }
    } finally {
      lock.unlock();
    }
    if (removed == null) {
      return false;
    }
    removed.terminal.cancel(false);
    return true;
  }

  @Override
  public List<InferenceRequest> snapshot() {
    lock.lock();
    try {
      List<InferenceRequest> copies = new ArrayList<>(entries.size());
      for (Entry e : entries.values()) {
        copies.add(e.request.copy());
      }
      return copies;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<CompletableFuture<RequestStatus>> terminalSignal(String requestId) {
    if (requestId == null) {
      return Optional.empty();
    }
    lock.lock();
    try {
      Entry e = entries.get(requestId);
      // 호출자가 신호를 직접 완료시키지 못하도록 의존 사본을 준다
      return e == null ? Optional.empty() : Optional.of(e.terminal.copy());
    } finally {
      lock.unlock();
    }
  }

  private Entry require(String requestId) {
    Entry e = requestId == null ? null : entries.get(requestId);
    if (e == null) {
      throw new RequestNotFoundException(requestId);
    }
    return e;
  }

  private static String newId() {
    return UUID.randomUUID().toString();
  }

  private static final class Entry {
    private final InferenceRequest request;
    private final CompletableFuture<RequestStatus> terminal = new CompletableFuture<>();

    private Entry(InferenceRequest request) {
      this.request = request;
    }
  }
}
