package combinator.futarchy.service.sequencer;

import combinator.futarchy.global.error.exception.ConfirmationTimeoutException;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** 조건이 관측될 때까지 고정 간격으로 조회. 상한을 넘기면 실패합니다. */
@Slf4j
@Component
public class BoundedPoller {

  /**
   * @param check 준비되었으면 값을, 아니면 empty를 돌려주는 조회
   * @throws ConfirmationTimeoutException maxWait 안에 준비되지 않았을 때
   */
  public <T> T pollUntil(
      String description, Duration interval, Duration maxWait, Supplier<Optional<T>> check) {
    long startedAt = System.nanoTime();
    long deadline = startedAt + maxWait.toNanos();

    while (true) {
      Optional<T> result = check.get();
      if (result.isPresent()) {
        log.debug(
            "⏱️ [Poller] {} 준비 완료 ({}ms)",
            description,
            Duration.ofNanos(System.nanoTime() - startedAt).toMillis());
        return result.get();
      }
      if (System.nanoTime() + interval.toNanos() > deadline) {
        throw new ConfirmationTimeoutException(
            description + " not ready after " + maxWait.toMillis() + "ms");
      }
      sleep(interval, description);
    }
  }

  private void sleep(Duration interval, String description) {
    try {
      Thread.sleep(interval.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConfirmationTimeoutException(description + " wait interrupted");
    }
  }
}
