package combinator.futarchy.global.lock;

import java.util.concurrent.atomic.AtomicBoolean;

/** 획득한 잠금을 나타내는 토큰. try-with-resources로 해제할 수 있습니다. */
public final class LockHandle implements AutoCloseable {

  private final String key;
  private final String lockKey;
  private final LockStrategy owner;
  private final AtomicBoolean released = new AtomicBoolean(false);

  LockHandle(String key, String lockKey, LockStrategy owner) {
    this.key = key;
    this.lockKey = lockKey;
    this.owner = owner;
  }

  public String key() {
    return key;
  }

  String lockKey() {
    return lockKey;
  }

  public boolean isReleased() {
    return released.get();
  }

  boolean markReleased() {
    return released.compareAndSet(false, true);
  }

  @Override
  public void close() {
    owner.release(this);
  }
}
