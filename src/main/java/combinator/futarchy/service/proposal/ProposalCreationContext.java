package combinator.futarchy.service.proposal;

import combinator.futarchy.domain.ledger.AdminIdentity;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.external.program.ProposalParameters;
import java.math.BigInteger;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;

/**
 * 제안 생성 단계 사이에 전달되는 값
 *
 * <p>{@code proposal}은 마지막으로 관측한 제안 계정입니다. 각 단계의 멱등성 검사는 이 값을 봅니다.
 */
@Getter
@Setter
@RequiredArgsConstructor
class ProposalCreationContext {

  private final CreateProposalCommand command;
  private final Organization organization;
  private final Organization liquidity;
  private final AdminIdentity admin;
  private final boolean resuming;

  private long proposalId;
  private String proposalAddress;
  private ProposalAccount proposal;
  private BigInteger baseAmount;
  private BigInteger quoteAmount;
  private ProposalParameters parameters;
  private String metadataRef;
  private String lookupTable;

  String moderator() {
    return organization.moderatorAddress();
  }

  int optionCount() {
    return command.options().size();
  }
}
