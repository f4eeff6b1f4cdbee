package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.CommonErrorCode;
import combinator.futarchy.global.error.exception.base.ClientBaseException;

/** 잠금 획득 전 입력 검증 단계에서 발생하는 예외 (부수 효과 없음) */
public class InvalidInputException extends ClientBaseException {

  public InvalidInputException(String detail) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }
}
