package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.FutarchyErrorCode;
import combinator.futarchy.global.error.exception.base.ClientBaseException;

public class ProposerNotFoundException extends ClientBaseException {

  public ProposerNotFoundException(String wallet) {
    super(FutarchyErrorCode.PROPOSER_NOT_FOUND, wallet);
  }
}
