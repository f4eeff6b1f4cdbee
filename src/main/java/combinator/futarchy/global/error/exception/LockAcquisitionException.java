package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.CommonErrorCode;
import combinator.futarchy.global.error.exception.base.ServerBaseException;

/** 키 잠금 획득 실패 (대기 시간 초과 또는 인터럽트) */
public class LockAcquisitionException extends ServerBaseException {

  public LockAcquisitionException(String lockKey) {
    super(CommonErrorCode.LOCK_ACQUISITION_FAILURE, lockKey);
  }

  public LockAcquisitionException(String lockKey, Throwable cause) {
    super(CommonErrorCode.LOCK_ACQUISITION_FAILURE, cause, lockKey);
  }
}
