package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.FutarchyErrorCode;
import combinator.futarchy.global.error.exception.base.ClientBaseException;

public class DuplicateOrganizationNameException extends ClientBaseException {

  public DuplicateOrganizationNameException(String name) {
    super(FutarchyErrorCode.DUPLICATE_ORGANIZATION_NAME, name);
  }
}
