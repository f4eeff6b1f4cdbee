package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.FutarchyErrorCode;
import combinator.futarchy.global.error.exception.base.ServerBaseException;

public class LedgerTransientException extends ServerBaseException {

  public LedgerTransientException(String operation, Throwable cause) {
    super(FutarchyErrorCode.LEDGER_TRANSIENT_FAILURE, cause, operation);
  }
}
