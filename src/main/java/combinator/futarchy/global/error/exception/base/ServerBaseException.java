package combinator.futarchy.global.error.exception.base;

import combinator.futarchy.global.error.ErrorCode;

/**
 * ServerBaseException: 원장·외부 협력자·설정 오류로 인해 발생하는 '서버 예외' 5xx 계열의 에러를 처리하며, 복구를 위한 상세 로그를 남기는 것이
 * 주 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
