package combinator.futarchy.domain.ledger;

import java.util.OptionalLong;

/**
 * 제안 순번 네임스페이스
 *
 * @param proposalIdCounter 지금까지 초기화된 제안 수 (다음 제안 id)
 */
public record ModeratorAccount(String address, long proposalIdCounter) {

  /** 가장 최근 제안의 id. 제안이 없으면 empty */
  public OptionalLong latestProposalId() {
    return proposalIdCounter == 0 ? OptionalLong.empty() : OptionalLong.of(proposalIdCounter - 1);
  }
}
