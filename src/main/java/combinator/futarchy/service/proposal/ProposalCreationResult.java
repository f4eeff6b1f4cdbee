package combinator.futarchy.service.proposal;

import combinator.futarchy.domain.proposal.ProposalStatus;
import java.util.List;

/**
 * @param resumedSteps 원장에 이미 반영되어 건너뛴 단계 (새로 만든 경우 비어 있음)
 */
public record ProposalCreationResult(
    String proposalAddress,
    long proposalId,
    String metadataRef,
    String organizationAddress,
    ProposalStatus status,
    List<String> resumedSteps) {

  public ProposalCreationResult {
    resumedSteps = List.copyOf(resumedSteps);
  }
}
