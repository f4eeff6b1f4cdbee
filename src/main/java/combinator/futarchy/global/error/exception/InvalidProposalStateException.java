package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.FutarchyErrorCode;
import combinator.futarchy.global.error.exception.base.ClientBaseException;

public class InvalidProposalStateException extends ClientBaseException {

  public InvalidProposalStateException(String detail) {
    super(FutarchyErrorCode.INVALID_PROPOSAL_STATE, detail);
  }
}
