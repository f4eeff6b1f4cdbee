package combinator.futarchy.service.organization;

import combinator.futarchy.domain.ledger.AdminIdentity;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.external.program.OrganizationAccounts;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;

/** 조직 생성 단계 사이에 전달되는 값 */
@Getter
@Setter
@RequiredArgsConstructor
class OrganizationCreationContext {

  private final String name;
  private Integer keyIndex;
  private AdminIdentity admin;
  private OrganizationAccounts accounts;
  private String submissionId;
  private String treasuryVault;
  private String mintAuthorityVault;
  private Organization saved;
}
