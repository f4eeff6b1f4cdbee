package combinator.futarchy.global.cache;

import combinator.futarchy.config.FutarchyProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 원장 집계 조회의 프로세스 로컬 캐시
 *
 * <p>엔트리마다 TTL이 다르므로 Caffeine의 가변 만료({@link Expiry})를 사용합니다. 손실되어도 안전하며, 미스는 항상 원장 재조회로 이어질 뿐
 * 오류가 되지 않습니다.
 *
 * <ul>
 *   <li>{@link #set(String, Object, Duration)}: TTL 지정 저장
 *   <li>{@link #set(String, Object)}: 만료 없음 (조직별 제안 수)
 *   <li>{@link #increment(String)}: 존재할 때만 +1, 기존 만료 시각 유지
 * </ul>
 *
 * <p>정수 값(Integer, Short, Byte)은 저장할 때 Long으로 바꿉니다. 증가 전후로 같은 타입으로 읽힙니다.
 */
@Slf4j
@Component
public class ReadModelCache {

  private static final long NO_EXPIRY = Long.MAX_VALUE;

  private final Cache<String, CachedValue> cache;

  public ReadModelCache(Ticker cacheTicker, FutarchyProperties properties) {
    this.cache =
        Caffeine.newBuilder()
            .ticker(cacheTicker)
            .maximumSize(properties.getCache().getMaximumSize())
            .expireAfter(new PerEntryExpiry())
            .build();
  }

  public <T> Optional<T> get(String key, Class<T> type) {
    CachedValue cached = cache.getIfPresent(key);
    if (cached == null) {
      return Optional.empty();
    }
    if (!type.isInstance(cached.value())) {
      log.warn("⚠️ [Cache] '{}' 타입 불일치: {} (기대: {})", key, cached.value().getClass(), type);
      return Optional.empty();
    }
    return Optional.of(type.cast(cached.value()));
  }

  public void set(String key, Object value, Duration ttl) {
    cache.put(key, new CachedValue(normalize(value), ttl.toNanos(), false));
  }

  public void set(String key, Object value) {
    cache.put(key, new CachedValue(normalize(value), NO_EXPIRY, false));
  }

  /**
   * 정수 값을 1 증가시킵니다. 키가 없으면 아무것도 하지 않습니다 (추정 값으로 채우지 않음).
   *
   * @return 증가 후 값, 키가 없거나 정수가 아니면 empty
   */
  public Optional<Long> increment(String key) {
    CachedValue updated =
        cache
            .asMap()
            .computeIfPresent(
                key,
                (k, current) -> {
                  if (!(current.value() instanceof Long number)) {
                    log.warn("⚠️ [Cache] '{}' 정수가 아닌 값은 증가할 수 없음", k);
                    return current;
                  }
                  return new CachedValue(number + 1, current.ttlNanos(), true);
                });
    if (updated == null || !(updated.value() instanceof Long value)) {
      return Optional.empty();
    }
    return Optional.of(value);
  }

  public void invalidate(String key) {
    cache.invalidate(key);
  }

  private static Object normalize(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    return value;
  }

  private record CachedValue(Object value, long ttlNanos, boolean keepExpiry) {}

  private static final class PerEntryExpiry implements Expiry<String, CachedValue> {

    @Override
    public long expireAfterCreate(String key, CachedValue value, long currentTime) {
      return value.ttlNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, CachedValue value, long currentTime, long currentDuration) {
      return value.keepExpiry() ? currentDuration : value.ttlNanos();
    }

    @Override
    public long expireAfterRead(
        String key, CachedValue value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
