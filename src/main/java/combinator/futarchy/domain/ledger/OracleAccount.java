package combinator.futarchy.domain.ledger;

/** 옵션 풀의 가격 오라클 타이머. 시각은 모두 epoch seconds. */
public record OracleAccount(
    String poolAddress,
    long createdAt,
    long warmupSeconds,
    long lastUpdate,
    long minRecordingIntervalSeconds) {

  public long warmupEndsAt() {
    return createdAt + warmupSeconds;
  }

  public long nextRecordingAt() {
    return lastUpdate + minRecordingIntervalSeconds;
  }
}
