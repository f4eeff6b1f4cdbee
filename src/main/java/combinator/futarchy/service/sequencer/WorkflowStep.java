package combinator.futarchy.service.sequencer;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 워크플로의 한 단계: (멱등성 검사, 사전 조건, 실행)
 *
 * @param <C> 단계 사이에 결과를 주고받는 워크플로 컨텍스트
 */
public interface WorkflowStep<C> {

  String name();

  /** 원장에 이미 목표 상태가 있으면 true. 건너뛰고 "resuming"을 남깁니다. */
  default boolean isAlreadyDone(C context) {
    return false;
  }

  /** 실행 전 검사. 진행 불가 상태면 예외를 던집니다. */
  default void checkPrecondition(C context) {}

  void execute(C context);

  /** 실패 시 로그에 남기는 재확인 방법 */
  default String recoveryHint(C context) {
    return "re-run the workflow; completed steps are detected and skipped";
  }

  /** 멱등성 검사가 필요 없는 단계 (순수 계산, 콘텐츠 주소 게시 등) */
  static <C> WorkflowStep<C> of(String name, Consumer<C> action) {
    return new WorkflowStep<>() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public void execute(C context) {
        action.accept(context);
      }
    };
  }

  /** 실패 시 재확인 방법을 직접 남기는 단계 */
  static <C> WorkflowStep<C> of(
      String name, Consumer<C> action, Function<C, String> hint) {
    return new WorkflowStep<>() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public void execute(C context) {
        action.accept(context);
      }

      @Override
      public String recoveryHint(C context) {
        return hint.apply(context);
      }
    };
  }
}
