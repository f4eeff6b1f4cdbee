package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.FutarchyErrorCode;
import combinator.futarchy.global.error.exception.base.ServerBaseException;

/** 제한 시간 안에 원장 확정(또는 폴링 조건)을 관측하지 못한 경우 */
public class ConfirmationTimeoutException extends ServerBaseException {

  public ConfirmationTimeoutException(String detail) {
    super(FutarchyErrorCode.CONFIRMATION_TIMEOUT, detail);
  }
}
