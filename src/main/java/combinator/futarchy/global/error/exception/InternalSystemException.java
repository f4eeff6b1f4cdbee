package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.CommonErrorCode;
import combinator.futarchy.global.error.exception.base.ServerBaseException;
import lombok.Getter;

/** LogicExecutor가 관리되지 않은 예외를 규격화할 때 사용하는 예외 */
@Getter
public class InternalSystemException extends ServerBaseException {

  private final String taskName;

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause);
    this.taskName = taskName;
  }
}
