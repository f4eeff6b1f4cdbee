package combinator.futarchy.service.projection;

import combinator.futarchy.domain.proposal.ProposalStatus;
import java.util.OptionalInt;

/**
 * 원장 계정 + 현재 시각으로부터 파생한 제안 상태
 *
 * @param endsAt createdAt + length (epoch seconds)
 * @param warmupEndsAt createdAt + warmup (epoch seconds)
 * @param expired PENDING이면서 now >= endsAt
 * @param winningIndex RESOLVED일 때만 존재
 */
public record ProposalProjection(
    ProposalStatus status,
    long endsAt,
    long warmupEndsAt,
    boolean expired,
    OptionalInt winningIndex) {

  /**
   * 같은 모더레이터에서 새 제안 생성을 막는지
   *
   * <p>SETUP은 항상 막습니다 (반쯤 만들어진 제안은 완료하거나 폐기해야 함). PENDING은 만료 전까지만 막습니다.
   */
  public boolean blocksNewProposal() {
    return switch (status) {
      case SETUP -> true;
      case PENDING -> !expired;
      case RESOLVED -> false;
    };
  }

  public boolean isActive() {
    return status == ProposalStatus.PENDING && !expired;
  }

  public long secondsRemaining(long nowEpochSeconds) {
    return Math.max(0, endsAt - nowEpochSeconds);
  }

  /** 남은 시간 (시간 단위, 올림) */
  public long hoursRemaining(long nowEpochSeconds) {
    long seconds = secondsRemaining(nowEpochSeconds);
    return (seconds + 3599) / 3600;
  }
}
