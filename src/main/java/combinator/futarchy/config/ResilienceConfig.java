package combinator.futarchy.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class ResilienceConfig {

  private final FutarchyProperties properties;

  /**
   * 원장 읽기 재시도 (기본 1회 재시도)
   *
   * <p>제출(submit)에는 적용하지 않습니다. 중복 제출은 멱등성 검사로만 막습니다.
   */
  @Bean
  public Retry ledgerReadRetry() {
    FutarchyProperties.Ledger ledger = properties.getLedger();
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(ledger.getReadMaxAttempts())
            .waitDuration(ledger.getReadRetryInterval())
            .build();

    RetryRegistry registry = RetryRegistry.of(config);
    return registry.retry("ledgerReadRetry");
  }
}
