package inferline.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import inferline.model.InferenceRequest;
import inferline.model.RequestStatus;
import inferline.store.InMemoryRequestStore;
import inferline.store.InMemoryResultStore;
import inferline.store.RequestNotFoundException;
import inferline.testsupport.Polling;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CompletionWaiterTest {

  private InMemoryResultStore results;
  private InMemoryRequestStore store;
  private CompletionWaiter waiter;
  private ExecutorService callers;

  @BeforeEach
  void setUp() {
    results = new InMemoryResultStore();
    store = new InMemoryRequestStore(Clock.systemUTC(), results);
    waiter = new CompletionWaiter(store, results);
    callers = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() {
    callers.shutdownNow();
  }

  @Test
  void blockedCallerReceivesResultAndEntryIsRemoved() throws Exception {
    Future<WaitOutcome> call = callers.submit(() ->
        waiter.submitAndWait("completion", "m1", Map.of("model", "m1", "prompt", "hi"), Duration.ofSeconds(5)));

    String id = awaitPendingRequest();
    store.claim(id);
    store.complete(id, Map.of("text", "hello"), Map.of("tokens", 5));

    WaitOutcome outcome = call.get(5, TimeUnit.SECONDS);
    assertThat(outcome.getKind()).isEqualTo(WaitOutcome.Kind.COMPLETED);
    assertThat(outcome.getRequestId()).isEqualTo(id);
    assertThat(outcome.getResultData()).containsEntry("text", "hello");
    assertThat(outcome.getResult().usage()).containsEntry("tokens", 5);

    assertThat(store.get(id)).isEmpty();
    assertThat(results.get(id)).isEmpty();
  }

  @Test
  void providerFailureIsForwardedVerbatim() throws Exception {
    Future<WaitOutcome> call = callers.submit(() ->
        waiter.submitAndWait("completion", "m1", Map.of(), Duration.ofSeconds(5)));

    String id = awaitPendingRequest();
    store.claim(id);
    store.fail(id, "model overloaded");

    WaitOutcome outcome = call.get(5, TimeUnit.SECONDS);
    assertThat(outcome.getKind()).isEqualTo(WaitOutcome.Kind.UPSTREAM_FAILURE);
    assertThat(outcome.getErrorMessage()).isEqualTo("model overloaded");
    assertThat(outcome.getResult()).isNull();
    assertThat(store.get(id)).isEmpty();
    assertThat(results.size()).isZero();
  }

  @Test
  void timeoutLeavesRequestPendingForLateDispatch() throws Exception {
    long started = System.nanoTime();
    WaitOutcome outcome = waiter.submitAndWait("completion", "m1", Map.of(), Duration.ofMillis(300));
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    assertThat(outcome.getKind()).isEqualTo(WaitOutcome.Kind.TIMEOUT);
    assertThat(elapsedMs).isGreaterThanOrEqualTo(250L);
    assertThat(store.get(outcome.getRequestId()))
        .map(InferenceRequest::getStatus)
        .contains(RequestStatus.PENDING);
  }

  @Test
  void alreadyTerminalRequestResolvesImmediately() throws Exception {
    String id = store.enqueue("completion", "m1", Map.of());
    store.claim(id);
    store.complete(id, Map.of("text", "done"), null);

    WaitOutcome outcome = waiter.await(id, Duration.ZERO);

    assertThat(outcome.getKind()).isEqualTo(WaitOutcome.Kind.COMPLETED);
    assertThat(outcome.getResultData()).containsEntry("text", "done");
  }

  @Test
  void awaitingUnknownRequestIsNotFound() {
    assertThatThrownBy(() -> waiter.await("missing", Duration.ofMillis(10)))
        .isInstanceOf(RequestNotFoundException.class);
  }

  @Test
  void resultConsumedElsewhereFirstIsNotFoundForWaiter() throws Exception {
    String id = store.enqueue("completion", "m1", Map.of());
    store.claim(id);
    store.complete(id, Map.of("text", "done"), null);
    results.takeAndDelete(id);

    assertThatThrownBy(() -> waiter.await(id, Duration.ofSeconds(1)))
        .isInstanceOf(RequestNotFoundException.class);
  }

  @Test
  void requestRemovedWhileWaitingWakesWaiterPromptly() throws Exception {
    String id = store.enqueue("completion", "m1", Map.of());
    Future<WaitOutcome> call = callers.submit(() -> waiter.await(id, Duration.ofSeconds(30)));

    Thread.sleep(50);
    store.remove(id);

    assertThatThrownBy(() -> call.get(2, TimeUnit.SECONDS))
        .hasCauseInstanceOf(RequestNotFoundException.class);
  }

  @Test
  void cancellationWithdrawsPendingRequest() throws Exception {
    AtomicReference<Thread> waiting = new AtomicReference<>();
    Future<WaitOutcome> call = callers.submit(() -> {
      waiting.set(Thread.currentThread());
      return waiter.submitAndWait("completion", "m1", Map.of(), Duration.ofSeconds(30));
    });

    String id = awaitPendingRequest();
    waiting.get().interrupt();

    assertThatThrownBy(() -> call.get(2, TimeUnit.SECONDS))
        .hasCauseInstanceOf(InterruptedException.class);
    assertThat(store.get(id)).isEmpty();
  }

  @Test
  void cancellationLeavesClaimedRequestToItsProvider() throws Exception {
    AtomicReference<Thread> waiting = new AtomicReference<>();
    Future<WaitOutcome> call = callers.submit(() -> {
      waiting.set(Thread.currentThread());
      return waiter.submitAndWait("completion", "m1", Map.of(), Duration.ofSeconds(30));
    });

    String id = awaitPendingRequest();
    store.claim(id);
    waiting.get().interrupt();

    assertThatThrownBy(() -> call.get(2, TimeUnit.SECONDS))
        .hasCauseInstanceOf(InterruptedException.class);
    assertThat(store.get(id)).map(InferenceRequest::getStatus).contains(RequestStatus.PROCESSING);
  }

  @Test
  void asyncWaitCompletesWithoutHoldingAThread() throws Exception {
    WaitHandle handle = waiter.submitAsync("completion", "m1", Map.of("prompt", "hi"), Duration.ofSeconds(5));

    assertThat(handle.getOutcome()).isNotDone();
    store.claim(handle.getRequestId());
    store.complete(handle.getRequestId(), Map.of("text", "hello"), null);

    WaitOutcome outcome = handle.getOutcome().get(1, TimeUnit.SECONDS);
    assertThat(outcome.getKind()).isEqualTo(WaitOutcome.Kind.COMPLETED);
    assertThat(outcome.getResultData()).containsEntry("text", "hello");
    assertThat(store.get(handle.getRequestId())).isEmpty();
  }

  @Test
  void asyncWaitTimesOutAndKeepsRequestPending() throws Exception {
    WaitHandle handle = waiter.submitAsync("completion", "m1", Map.of(), Duration.ofMillis(100));

    WaitOutcome outcome = handle.getOutcome().get(2, TimeUnit.SECONDS);

    assertThat(outcome.getKind()).isEqualTo(WaitOutcome.Kind.TIMEOUT);
    assertThat(store.get(handle.getRequestId()))
        .map(InferenceRequest::getStatus)
        .contains(RequestStatus.PENDING);
  }

  @Test
  void abandoningAsyncWaitWithdrawsPendingRequest() {
    WaitHandle handle = waiter.submitAsync("completion", "m1", Map.of(), Duration.ofSeconds(30));

    assertThat(waiter.abandon(handle.getRequestId(), "client_error")).isTrue();

    assertThat(store.get(handle.getRequestId())).isEmpty();
    assertThatThrownBy(() -> handle.getOutcome().get(1, TimeUnit.SECONDS))
        .hasCauseInstanceOf(RequestNotFoundException.class);
  }

  @Test
  void abandoningClaimedRequestLeavesItToProvider() {
    WaitHandle handle = waiter.submitAsync("completion", "m1", Map.of(), Duration.ofSeconds(30));
    store.claim(handle.getRequestId());

    assertThat(waiter.abandon(handle.getRequestId(), "client_error")).isFalse();

    assertThat(store.get(handle.getRequestId()))
        .map(InferenceRequest::getStatus)
        .contains(RequestStatus.PROCESSING);
    assertThat(handle.getOutcome()).isNotDone();
  }

  private String awaitPendingRequest() throws Exception {
    AtomicReference<String> id = new AtomicReference<>();
    Polling.waitUntil(Duration.ofSeconds(2), Duration.ofMillis(10), () -> {
      List<InferenceRequest> snapshot = store.snapshot();
      Optional<InferenceRequest> first = snapshot.stream().findFirst();
      first.ifPresent(r -> id.set(r.getRequestId()));
      return first.isPresent();
    });
    return id.get();
  }
}
