package combinator.futarchy.global.executor;

import combinator.futarchy.global.error.exception.base.BaseException;
import combinator.futarchy.global.executor.function.ThrowingRunnable;
import combinator.futarchy.global.executor.function.ThrowingSupplier;
import combinator.futarchy.global.executor.strategy.ExceptionTranslator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li>Checked Exception → Runtime Exception 자동 변환
 *   <li>Micrometer 타이머 자동 수집 ({@code logic.executor})
 *   <li><b>Error 격리</b>: Error(OOM 등)는 절대 캐치하지 않고 상위로 전파
 *   <li><b>카디널리티 통제</b>: 동적 값은 로그에만 기록, 메트릭 태그는 component/operation만 사용
 * </ul>
 *
 * <p>비즈니스 예외({@link BaseException})는 이미 사용자에게 보여줄 진단을 담고 있으므로 WARN 한 줄로만 남기고, 그 외 예외는 스택과 함께
 * ERROR로 남깁니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String METRIC_NAME = "logic.executor";

  private final MeterRegistry meterRegistry;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithMetrics(task, context, ExceptionTranslator.defaultTranslator());
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(recovery, "recovery");
    try {
      return executeWithMetrics(task, context, ExceptionTranslator.defaultTranslator());
    } catch (RuntimeException e) {
      log.debug("[{}] 예외 발생, 복구 로직 실행: {}", context.toTaskName(), e.getMessage());
      return recovery.apply(e);
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    Objects.requireNonNull(finallyBlock, "finallyBlock");
    try {
      return executeWithMetrics(task, context, ExceptionTranslator.defaultTranslator());
    } finally {
      finallyBlock.run();
    }
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context) {
    Objects.requireNonNull(translator, "translator");
    return executeWithMetrics(task, context, translator);
  }

  private <T> T executeWithMetrics(
      ThrowingSupplier<T> task, TaskContext context, ExceptionTranslator translator) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");
    Timer.Sample sample = Timer.start(meterRegistry);

    try {
      T result = task.get();
      record(sample, context, "success", null);
      return result;
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      record(sample, context, "failure", t);
      logFailure(context, t);
      throw translator.translate(t, context);
    }
  }

  private void record(Timer.Sample sample, TaskContext context, String result, Throwable t) {
    Timer.Builder builder =
        Timer.builder(METRIC_NAME)
            .tag("component", context.component())
            .tag("operation", context.operation())
            .tag("result", result);
    if (t != null) {
      builder.tag("exception", t.getClass().getSimpleName());
    }
    sample.stop(builder.register(meterRegistry));
  }

  private void logFailure(TaskContext context, Throwable t) {
    if (t instanceof BaseException) {
      log.warn("[{}] {}", context.toTaskName(), t.getMessage());
      return;
    }
    log.error("[{}] 실행 중 예외 발생", context.toTaskName(), t);
  }
}
