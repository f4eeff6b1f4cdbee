package combinator.futarchy.service.oracle;

/**
 * 풀 하나의 크랭크 결과
 *
 * @param detail CRANKED면 제출 id, 그 외에는 건너뛴 사유 또는 오류
 */
public record PoolCrankOutcome(String poolAddress, Outcome outcome, String detail) {

  public enum Outcome {
    CRANKED,
    SKIPPED,
    ERROR
  }

  static PoolCrankOutcome cranked(String poolAddress, String submissionId) {
    return new PoolCrankOutcome(poolAddress, Outcome.CRANKED, submissionId);
  }

  static PoolCrankOutcome skipped(String poolAddress, String reason) {
    return new PoolCrankOutcome(poolAddress, Outcome.SKIPPED, reason);
  }

  static PoolCrankOutcome error(String poolAddress, String reason) {
    return new PoolCrankOutcome(poolAddress, Outcome.ERROR, reason);
  }
}
