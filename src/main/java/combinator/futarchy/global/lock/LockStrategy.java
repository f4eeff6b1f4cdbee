package combinator.futarchy.global.lock;

import combinator.futarchy.global.executor.function.ThrowingSupplier;
import java.time.Duration;

/**
 * 문자열 키 기반 상호 배제
 *
 * <p>같은 키에 대한 획득은 도착 순서(FIFO)대로 허용되며, 서로 다른 키 사이에는 순서 보장이 없습니다. 획득한 스레드가 직접 해제해야 합니다.
 */
public interface LockStrategy {

  /** 키를 독점할 때까지 대기합니다. */
  LockHandle acquire(String key);

  /**
   * 최대 waitTime 동안 대기합니다.
   *
   * @throws combinator.futarchy.global.error.exception.LockAcquisitionException 시간 초과 또는 인터럽트
   */
  LockHandle acquire(String key, Duration waitTime);

  /** 다음 대기자에게 넘기거나, 대기자가 없으면 키를 정리합니다. 이미 해제된 핸들은 무시합니다. */
  void release(LockHandle handle);

  /** 획득 → 작업 → 해제. 작업이 어떤 경로로 끝나든 해제됩니다. */
  <T> T executeWithLock(String key, ThrowingSupplier<T> task);

  <T> T executeWithLock(String key, Duration waitTime, ThrowingSupplier<T> task);

  boolean isLocked(String key);

  /** 보유 중이거나 대기자가 있는 키의 수 */
  int activeLockCount();
}
