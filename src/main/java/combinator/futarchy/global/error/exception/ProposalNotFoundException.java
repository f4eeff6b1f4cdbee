package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.FutarchyErrorCode;
import combinator.futarchy.global.error.exception.base.ClientBaseException;

public class ProposalNotFoundException extends ClientBaseException {

  public ProposalNotFoundException(String proposalAddress) {
    super(FutarchyErrorCode.PROPOSAL_NOT_FOUND, proposalAddress);
  }
}
