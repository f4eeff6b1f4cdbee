package combinator.futarchy.service.oracle;

import java.util.List;

/**
 * @param submissionId 일괄 제출 id (대상 풀이 없거나 제출이 실패했으면 null)
 * @param outcomes 풀별 결과 (건너뜀·오류 먼저, 크랭크된 풀은 뒤)
 */
public record CrankResult(
    String proposalAddress,
    String organizationAddress,
    int numOptions,
    String submissionId,
    List<PoolCrankOutcome> outcomes) {

  public CrankResult {
    outcomes = List.copyOf(outcomes);
  }

  public long crankedCount() {
    return outcomes.stream()
        .filter(o -> o.outcome() == PoolCrankOutcome.Outcome.CRANKED)
        .count();
  }
}
