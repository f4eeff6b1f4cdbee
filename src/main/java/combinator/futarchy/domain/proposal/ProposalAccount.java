package combinator.futarchy.domain.proposal;

import java.util.List;

/**
 * 원장에서 읽은 제안 계정 원본
 *
 * <p>로컬에 저장하지 않습니다. 상태 판단은 {@code ProposalStateProjector}를 거칩니다.
 *
 * @param createdAt 생성 시각 (epoch seconds)
 * @param lengthSeconds 진행 기간
 * @param warmupSeconds 워밍업 기간 (이 동안 오라클 기록 불가)
 * @param pools 옵션별 풀 주소 (numOptions 이후 칸은 기본 주소로 채워질 수 있음)
 */
public record ProposalAccount(
    String address,
    String moderatorAddress,
    long proposalId,
    int numOptions,
    long createdAt,
    long lengthSeconds,
    long warmupSeconds,
    String metadataRef,
    List<String> pools,
    ProposalState state) {

  public ProposalAccount {
    pools = pools == null ? List.of() : List.copyOf(pools);
  }

  public ProposalStatus status() {
    return state.status();
  }

  public ProposalAccount withState(ProposalState newState) {
    return new ProposalAccount(
        address,
        moderatorAddress,
        proposalId,
        numOptions,
        createdAt,
        lengthSeconds,
        warmupSeconds,
        metadataRef,
        pools,
        newState);
  }
}
