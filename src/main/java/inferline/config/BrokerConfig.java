package inferline.config;

import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BrokerConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public QueueProperties queueProperties(
      @Value("${inferline.queue.waitTimeoutMs:30000}") long waitTimeoutMs,
      @Value("${inferline.queue.maxWaitTimeoutMs:300000}") long maxWaitTimeoutMs,
      @Value("${inferline.queue.orphanTtlMs:600000}") long orphanTtlMs
  ) {
    if (waitTimeoutMs <= 0 || maxWaitTimeoutMs < waitTimeoutMs) {
      throw new IllegalArgumentException(
          "inferline.queue.waitTimeoutMs must be positive and not exceed maxWaitTimeoutMs");
    }
    // reaper 가 아직 대기 중인 요청을 지우면 안 된다
    if (orphanTtlMs <= maxWaitTimeoutMs) {
      throw new IllegalArgumentException(
          "inferline.queue.orphanTtlMs must be greater than maxWaitTimeoutMs");
    }
    return new QueueProperties(waitTimeoutMs, maxWaitTimeoutMs, orphanTtlMs);
  }

  @Bean
  public ProviderProperties providerProperties(
      @Value("${inferline.provider.ttlSeconds:300}") long ttlSeconds
  ) {
    return new ProviderProperties(ttlSeconds);
  }

  @Bean
  public ApiProperties apiProperties(
      @Value("${inferline.api.rejectUnknownModels:false}") boolean rejectUnknownModels
  ) {
    return new ApiProperties(rejectUnknownModels);
  }

  public record QueueProperties(
      long waitTimeoutMs,
      long maxWaitTimeoutMs,
      long orphanTtlMs
  ) {

    /**
     * 호출자가 준 대기 시간을 [1, maxWaitTimeoutMs] 로 맞춘다. null 이면 기본값.
     */
    public long resolveWaitTimeoutMs(Long requested) {
      if (requested == null) {
        return waitTimeoutMs;
      }
      return Math.min(maxWaitTimeoutMs, Math.max(1L, requested));
    }
  }

  public record ProviderProperties(long ttlSeconds) {}

  public record ApiProperties(boolean rejectUnknownModels) {}
}
