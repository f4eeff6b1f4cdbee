package combinator.futarchy.service.readiness;

import combinator.futarchy.global.error.exception.ReadinessCheckFailedException;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 준비 상태 게이트
 *
 * <p>검사를 순서대로 실행하고 첫 실패에서 멈춥니다. 그 외의 분기는 없습니다. 검사 도중 협력자 예외가 나면 해당 검사의 실패로 취급합니다 (fail
 * closed).
 */
@Slf4j
@Component
public class ReadinessGate {

  private final List<ReadinessCheck> checks;
  private final LogicExecutor executor;

  /** checks는 {@code @Order} 순으로 주입됩니다. */
  public ReadinessGate(List<ReadinessCheck> checks, LogicExecutor executor) {
    this.checks = List.copyOf(checks);
    this.executor = executor;
  }

  public ReadinessReport evaluate(ReadinessContext context) {
    List<String> passed = new ArrayList<>();
    for (ReadinessCheck check : checks) {
      if (!check.appliesTo(context)) {
        continue;
      }
      ReadinessResult result = run(check, context);
      if (!result.ready()) {
        log.warn(
            "🚫 [Readiness] {} 실패 ({}): {}",
            check.name(),
            context.organization().name(),
            result.reason());
        return ReadinessReport.failed(passed, check.name(), result.reason());
      }
      passed.add(check.name());
    }
    log.info("🟢 [Readiness] {} 모든 검사 통과: {}", context.organization().name(), passed);
    return ReadinessReport.allPassed(passed);
  }

  /**
   * @throws ReadinessCheckFailedException 첫 번째 실패 검사의 이름과 사유
   */
  public ReadinessReport verify(ReadinessContext context) {
    ReadinessReport report = evaluate(context);
    if (!report.ready()) {
      throw new ReadinessCheckFailedException(report.failedCheck(), report.reason());
    }
    return report;
  }

  private ReadinessResult run(ReadinessCheck check, ReadinessContext context) {
    return executor.executeOrCatch(
        () -> check.check(context),
        e -> ReadinessResult.notReady("Failed to run " + check.name() + ": " + e.getMessage()),
        TaskContext.of("Readiness", check.name(), context.organization().address()));
  }
}
