package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.FutarchyErrorCode;
import combinator.futarchy.global.error.exception.base.ClientBaseException;

public class NotOrganizationOwnerException extends ClientBaseException {

  public NotOrganizationOwnerException(String organization, String wallet) {
    super(FutarchyErrorCode.NOT_ORGANIZATION_OWNER, organization, wallet);
  }
}
