package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.FutarchyErrorCode;
import combinator.futarchy.global.error.exception.base.ClientBaseException;
import lombok.Getter;

@Getter
public class ProposalNotEndedException extends ClientBaseException {

  private final long endsInSeconds;

  public ProposalNotEndedException(String proposalAddress, long endsInSeconds) {
    super(FutarchyErrorCode.PROPOSAL_NOT_ENDED, proposalAddress, endsInSeconds);
    this.endsInSeconds = endsInSeconds;
  }
}
