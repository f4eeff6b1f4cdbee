package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.FutarchyErrorCode;
import combinator.futarchy.global.error.exception.base.ClientBaseException;

/**
 * 멱등성 검사에서 대상이 진행 불가능한 상태로 이미 존재할 때 발생
 *
 * <p>일시적 오류와 구분되어야 하므로 호출자는 이 예외를 받고 그대로 재시도해서는 안 됩니다.
 */
public class IdempotencyConflictException extends ClientBaseException {

  public IdempotencyConflictException(String detail) {
    super(FutarchyErrorCode.IDEMPOTENCY_CONFLICT, detail);
  }
}
