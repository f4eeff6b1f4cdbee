package combinator.futarchy.service.sequencer;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 단계 목록을 선언 순서대로 실행하는 시퀀서
 *
 * <p>각 단계 앞에서 멱등성 검사를 먼저 수행하므로, 중간에 죽은 워크플로를 처음부터 다시 실행해도 안전합니다. 실패하면 완료된 단계와 재확인 방법을
 * 남기고 예외를 그대로 전파합니다.
 */
@Slf4j
@Component
public class StepSequencer {

  public <C> SequenceReport run(String workflow, C context, List<? extends WorkflowStep<C>> steps) {
    List<String> executed = new ArrayList<>();
    List<String> resumed = new ArrayList<>();

    for (WorkflowStep<C> step : steps) {
      try {
        if (step.isAlreadyDone(context)) {
          log.info("⏩ [Sequencer] {} / {} 이미 완료됨, resuming", workflow, step.name());
          resumed.add(step.name());
          continue;
        }
        step.checkPrecondition(context);
        step.execute(context);
        executed.add(step.name());
        log.info("✅ [Sequencer] {} / {} 완료", workflow, step.name());
      } catch (RuntimeException e) {
        log.error(
            "💥 [Sequencer] {} / {} 실패. 완료: {}, 건너뜀: {}, 재확인: {}",
            workflow,
            step.name(),
            executed,
            resumed,
            step.recoveryHint(context));
        throw e;
      }
    }
    return new SequenceReport(workflow, executed, resumed);
  }
}
