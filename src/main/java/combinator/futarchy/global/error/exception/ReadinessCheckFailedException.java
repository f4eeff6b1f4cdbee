package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.FutarchyErrorCode;
import combinator.futarchy.global.error.exception.base.ClientBaseException;
import lombok.Getter;

/** 준비 상태 검사 실패. 메시지는 검사가 반환한 사유 그대로입니다. */
@Getter
public class ReadinessCheckFailedException extends ClientBaseException {

  private static final String PROPOSER_AUTHORIZATION = "proposer_authorization";

  private final String check;
  private final String reason;

  public ReadinessCheckFailedException(String check, String reason) {
    super(codeFor(check), reason);
    this.check = check;
    this.reason = reason;
  }

  @Override
  public String getMachineCode() {
    return check;
  }

  private static FutarchyErrorCode codeFor(String check) {
    return PROPOSER_AUTHORIZATION.equals(check)
        ? FutarchyErrorCode.PROPOSER_NOT_AUTHORIZED
        : FutarchyErrorCode.READINESS_CHECK_FAILED;
  }
}
