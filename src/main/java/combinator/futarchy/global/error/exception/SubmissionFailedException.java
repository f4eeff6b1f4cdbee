package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.FutarchyErrorCode;
import combinator.futarchy.global.error.exception.base.ServerBaseException;

public class SubmissionFailedException extends ServerBaseException {

  public SubmissionFailedException(String detail) {
    super(FutarchyErrorCode.SUBMISSION_FAILED, detail);
  }

  public SubmissionFailedException(String detail, Throwable cause) {
    super(FutarchyErrorCode.SUBMISSION_FAILED, cause, detail);
  }
}
