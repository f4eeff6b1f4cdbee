package combinator.futarchy.global.lock;

import combinator.futarchy.global.error.exception.LockAcquisitionException;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.global.executor.function.ThrowingSupplier;
import combinator.futarchy.global.executor.strategy.ExceptionTranslator;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 락 전략 추상 클래스
 *
 * <p>Template Method Pattern:
 *
 * <ul>
 *   <li>{@link #executeWithLock}: 템플릿 메서드 (획득 → 작업 → 해제)
 *   <li>{@link #tryLock}, {@link #unlockInternal}: 추상 메서드 (구현체별)
 *   <li>{@link #onLockAcquired}, {@link #onLockFailed}, {@link #onLockReleased}: Hook 메서드
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public abstract class AbstractLockStrategy implements LockStrategy {

  protected final LogicExecutor executor;

  @Override
  public LockHandle acquire(String key) {
    return acquire(key, null);
  }

  @Override
  public LockHandle acquire(String key, Duration waitTime) {
    String lockKey = buildLockKey(key);
    return executor.executeWithTranslation(
        () -> this.performAcquire(key, lockKey, waitTime),
        ExceptionTranslator.forLock(),
        TaskContext.of("Lock", "acquire", key));
  }

  @Override
  public void release(LockHandle handle) {
    if (!handle.markReleased()) {
      return;
    }
    performUnlock(handle.lockKey());
  }

  @Override
  public <T> T executeWithLock(String key, ThrowingSupplier<T> task) {
    return executeWithLock(key, null, task);
  }

  @Override
  public <T> T executeWithLock(String key, Duration waitTime, ThrowingSupplier<T> task) {
    LockHandle handle = acquire(key, waitTime);
    return executor.executeWithFinally(
        task, () -> release(handle), TaskContext.of("Lock", "lockedTask", key));
  }

  @Override
  public boolean isLocked(String key) {
    return isHeld(buildLockKey(key));
  }

  private LockHandle performAcquire(String key, String lockKey, Duration waitTime)
      throws Throwable {
    if (!tryLock(lockKey, waitTime)) {
      onLockFailed(lockKey);
      throw new LockAcquisitionException(lockKey);
    }
    onLockAcquired(lockKey);
    return new LockHandle(key, lockKey, this);
  }

  private void performUnlock(String lockKey) {
    unlockInternal(lockKey);
    onLockReleased(lockKey);
  }

  // ===== 추상 메서드 =====

  /**
   * 락 획득 시도
   *
   * @param lockKey 락 키
   * @param waitTime 최대 대기 시간 (null이면 무기한)
   * @return 획득 성공 여부
   */
  protected abstract boolean tryLock(String lockKey, Duration waitTime) throws Throwable;

  protected abstract void unlockInternal(String lockKey);

  protected abstract boolean isHeld(String lockKey);

  // ===== Hook 메서드 =====

  /** 락 키 생성 전략 (기본: "lock:" 접두사) */
  protected String buildLockKey(String key) {
    return "lock:" + key;
  }

  protected void onLockAcquired(String lockKey) {
    log.debug("🔓 [Lock] '{}' 획득 성공", lockKey);
  }

  protected void onLockFailed(String lockKey) {
    log.warn("⏭️ [Lock] '{}' 획득 실패", lockKey);
  }

  protected void onLockReleased(String lockKey) {
    log.debug("🔒 [Lock] '{}' 해제 완료", lockKey);
  }
}
