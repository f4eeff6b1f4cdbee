package combinator.futarchy.global.lock;

import combinator.futarchy.global.executor.LogicExecutor;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * 프로세스 로컬 공정(FIFO) 키 잠금
 *
 * <p>키마다 fair {@link ReentrantLock}을 두고, 보유자와 대기자 수를 참조 카운트로 관리합니다. 마지막 참조가 빠지면 엔트리를 제거하므로 키
 * 수만큼 메모리가 쌓이지 않습니다. 참조 카운트 변경은 모두 {@link ConcurrentHashMap#compute} 안에서 일어납니다.
 */
@Component
public class FairKeyedLockStrategy extends AbstractLockStrategy {

  private final ConcurrentHashMap<String, LockEntry> entries = new ConcurrentHashMap<>();

  public FairKeyedLockStrategy(LogicExecutor executor) {
    super(executor);
  }

  @Override
  protected boolean tryLock(String lockKey, Duration waitTime) throws InterruptedException {
    LockEntry entry = reference(lockKey);
    boolean acquired = false;
    try {
      if (waitTime == null) {
        entry.lock.lockInterruptibly();
        acquired = true;
      } else {
        // 타임아웃 있는 tryLock은 fair 정책을 따른다 (무인자 tryLock은 새치기함)
        acquired = entry.lock.tryLock(waitTime.toMillis(), TimeUnit.MILLISECONDS);
      }
      return acquired;
    } finally {
      if (!acquired) {
        dereference(lockKey);
      }
    }
  }

  @Override
  protected void unlockInternal(String lockKey) {
    LockEntry entry = entries.get(lockKey);
    if (entry == null) {
      throw new IllegalStateException("보유하지 않은 락 해제 시도: " + lockKey);
    }
    entry.lock.unlock();
    dereference(lockKey);
  }

  @Override
  protected boolean isHeld(String lockKey) {
    LockEntry entry = entries.get(lockKey);
    return entry != null && entry.lock.isLocked();
  }

  @Override
  public int activeLockCount() {
    return entries.size();
  }

  /** 키를 기다리는 스레드 수 (추정치) */
  int queueLength(String key) {
    LockEntry entry = entries.get(buildLockKey(key));
    return entry == null ? 0 : entry.lock.getQueueLength();
  }

  private LockEntry reference(String lockKey) {
    return entries.compute(
        lockKey,
        (k, existing) -> {
          LockEntry entry = existing != null ? existing : new LockEntry();
          entry.references++;
          return entry;
        });
  }

  private void dereference(String lockKey) {
    entries.computeIfPresent(lockKey, (k, entry) -> --entry.references == 0 ? null : entry);
  }

  private static final class LockEntry {
    private final ReentrantLock lock = new ReentrantLock(true);
    private int references;
  }
}
