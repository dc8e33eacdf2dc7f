package inferline.controller;

import inferline.model.InferenceRequest;
import inferline.model.ProviderRegistration;
import inferline.model.QueueStats;
import inferline.model.ResultSubmission;
import inferline.service.BrokerService;
import jakarta.validation.Valid;
import java.util.Map;
import java.util.Optional;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 프로바이더 쪽 API. 프로바이더가 일을 가져가고(pull) 결과를 돌려준다.
 */
@RestController
@RequestMapping("/v1/queue")
public class QueueController {

  private final BrokerService broker;

  public QueueController(BrokerService broker) {
    this.broker = broker;
  }

  /**
   * 처리 범위를 실어 폴링한다. 등록이 갱신되고, 줄 일이 없으면 204.
   */
  @PostMapping("/next")
  public ResponseEntity<InferenceRequest> next(@Valid @RequestBody ProviderRegistration provider) {
    return claimed(broker.poll(provider.toCapabilities()));
  }

  /**
   * 이미 등록된 범위로 폴링한다. 등록이 없거나 만료됐으면 204.
   */
  @GetMapping("/next")
  public ResponseEntity<InferenceRequest> nextRegistered(@RequestParam("providerId") String providerId) {
    return claimed(broker.pollRegistered(providerId));
  }

  @PostMapping("/result")
  public ResponseEntity<Map<String, Object>> result(@Valid @RequestBody ResultSubmission submission) {
    try (var ignored = MDC.putCloseable("requestId", submission.getRequestId())) {
      broker.submitResult(
          submission.getRequestId(),
          submission.getResultData(),
          submission.getUsage(),
          submission.getErrorMessage());
      return ResponseEntity.ok(Map.of(
          "requestId", submission.getRequestId(),
          "accepted", true));
    }
  }

  @GetMapping("/stats")
  public QueueStats stats() {
    return broker.stats();
  }

  private static ResponseEntity<InferenceRequest> claimed(Optional<InferenceRequest> request) {
    return request
        .map(r -> ResponseEntity.ok()
            .header(RequestController.REQUEST_ID_HEADER, r.getRequestId())
            .body(r))
        .orElseGet(() -> ResponseEntity.noContent().build());
  }
}
