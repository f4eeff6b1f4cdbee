package combinator.futarchy.service.sequencer;

import java.util.List;

/**
 * @param executed 이번 실행에서 수행한 단계
 * @param resumed 이미 완료되어 건너뛴 단계
 */
public record SequenceReport(String workflow, List<String> executed, List<String> resumed) {

  public SequenceReport {
    executed = List.copyOf(executed);
    resumed = List.copyOf(resumed);
  }

  public boolean wasResumed() {
    return !resumed.isEmpty();
  }
}
