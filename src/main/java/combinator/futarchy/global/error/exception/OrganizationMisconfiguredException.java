package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.FutarchyErrorCode;
import combinator.futarchy.global.error.exception.base.ServerBaseException;

/** 레지스트리 행에 필수 필드가 없음 (재시도 대상 아님) */
public class OrganizationMisconfiguredException extends ServerBaseException {

  public OrganizationMisconfiguredException(String organization, String missingField) {
    super(FutarchyErrorCode.ORGANIZATION_MISCONFIGURED, organization + " has no " + missingField);
  }
}
