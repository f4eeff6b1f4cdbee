package combinator.futarchy.global.executor;

import combinator.futarchy.global.executor.function.ThrowingRunnable;
import combinator.futarchy.global.executor.function.ThrowingSupplier;
import combinator.futarchy.global.executor.strategy.ExceptionTranslator;
import java.util.function.Function;

/**
 * 예외 처리와 메트릭 수집을 한 곳으로 모은 실행기
 *
 * <p>비즈니스 코드에서 try-catch를 제거하고, 원격 호출·서명·제출 등의 작업을 {@link TaskContext} 단위로 실행합니다.
 *
 * <ul>
 *   <li>{@code BaseException}은 그대로 전파
 *   <li>그 외 예외는 {@code InternalSystemException}으로 규격화
 *   <li>{@link Error}는 절대 잡지 않음
 * </ul>
 */
public interface LogicExecutor {

  /** 작업 실행. 실패 시 규격화된 RuntimeException을 던집니다. */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** 작업 실행. 실패 시 기본값을 반환합니다. */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /** 작업 실행. 실패 시 번역된 예외를 recovery에 전달하여 그 결과를 반환합니다. */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  /** 작업 실행 후 성공/실패와 무관하게 finallyBlock을 정확히 1회 실행합니다. */
  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  /** 기본 변환 대신 주어진 translator로 예외를 변환합니다. */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
