package inferline.controller;

import inferline.model.InferenceResponse;
import inferline.model.SubmitRequest;
import inferline.service.BrokerService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/requests")
public class RequestController {
  static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final Logger log = LoggerFactory.getLogger(RequestController.class);

  private final BrokerService broker;

  public RequestController(BrokerService broker) {
    this.broker = broker;
  }

  /**
   * 비동기 제출:
   * - 202 Accepted (PENDING)
   * - Location: /v1/requests/{requestId}
   * - id 는 항상 서버가 만든다 (재사용 금지)
   */
  @PostMapping
  public ResponseEntity<InferenceResponse> submit(@Valid @RequestBody SubmitRequest request) {
    InferenceResponse queued = broker.submit(request.getRequestType(), request.getModel(), request.getPayload());
    try (var ignored = MDC.putCloseable("requestId", queued.getRequestId())) {
      HttpHeaders headers = new HttpHeaders();
      headers.set(REQUEST_ID_HEADER, queued.getRequestId());
      headers.setLocation(URI.create("/v1/requests/" + queued.getRequestId()));

      log.info("event=request.submit_accepted requestId={} status={} model={}",
          queued.getRequestId(), queued.getStatus(), queued.getModel());
      return new ResponseEntity<>(queued, headers, HttpStatus.ACCEPTED);
    }
  }

  /**
   * 상태/결과 조회:
   * - 200 PENDING / PROCESSING
   * - 200 COMPLETED / FAILED: 이 응답으로 결과가 소비되고 요청은 삭제된다
   * - 404: 모름 (이미 소비됨/만료/재시작)
   */
  @GetMapping("/{requestId}")
  public ResponseEntity<InferenceResponse> get(@PathVariable String requestId) {
    try (var ignored = MDC.putCloseable("requestId", requestId)) {
      Optional<InferenceResponse> r = broker.getStatus(requestId);
      if (r.isEmpty()) {
        log.info("event=request.get_not_found requestId={}", requestId);
        return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
      }
      log.info("event=request.get requestId={} status={} latencyMs={}",
          requestId, r.get().getStatus(), r.get().getLatencyMs());
      return ResponseEntity.ok()
          .header(REQUEST_ID_HEADER, r.get().getRequestId())
          .body(r.get());
    }
  }
}
