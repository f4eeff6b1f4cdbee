package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.FutarchyErrorCode;
import combinator.futarchy.global.error.exception.base.ClientBaseException;

public class OrganizationNotFoundException extends ClientBaseException {

  public OrganizationNotFoundException(String reference) {
    super(FutarchyErrorCode.ORGANIZATION_NOT_FOUND, reference);
  }
}
