package combinator.futarchy.service.organization;

import combinator.futarchy.domain.ledger.AdminIdentity;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.external.identity.IdentityService;
import combinator.futarchy.global.error.exception.OrganizationMisconfiguredException;
import combinator.futarchy.global.error.exception.OrganizationNotFoundException;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.repository.OrganizationRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** 조직 조회와 관리 지갑 해석 */
@Component
@RequiredArgsConstructor
public class OrganizationResolver {

  private final OrganizationRegistry registry;
  private final IdentityService identityService;
  private final LogicExecutor executor;

  public Organization byAddress(String organizationAddress) {
    return registry
        .findByAddress(organizationAddress)
        .orElseThrow(() -> new OrganizationNotFoundException(organizationAddress));
  }

  /** 제안의 모더레이터를 소유한 루트 조직. 수수료 지불과 유동성 회수는 항상 루트 관리 지갑이 합니다. */
  public Organization rootForModerator(String moderatorAddress) {
    return registry
        .findRootByModerator(moderatorAddress)
        .orElseThrow(() -> new OrganizationNotFoundException("moderator " + moderatorAddress));
  }

  /** 유동성을 소유한 조직 (브랜치면 부모 루트, 루트면 자기 자신) */
  public Organization liquidityOrganization(Organization organization) {
    if (organization.isRoot()) {
      return organization;
    }
    if (organization.parentId() == null) {
      throw new OrganizationMisconfiguredException(organization.label(), "parentId");
    }
    return registry
        .findById(organization.parentId())
        .orElseThrow(() -> new OrganizationNotFoundException("id " + organization.parentId()));
  }

  /**
   * @throws OrganizationMisconfiguredException 관리 키 인덱스가 없을 때 (손상된 레지스트리 행)
   */
  public AdminIdentity adminOf(Organization organization) {
    Integer keyIndex = organization.adminKeyIndex();
    if (keyIndex == null) {
      throw new OrganizationMisconfiguredException(organization.label(), "adminKeyIndex");
    }
    return executor.execute(
        () -> identityService.resolve(keyIndex),
        TaskContext.of("Identity", "resolve", organization.address()));
  }

  /** 유동성 작업에 필요한 필드가 모두 있는지 */
  public void requireLiquidityFields(Organization liquidity) {
    if (liquidity.adminKeyIndex() == null) {
      throw new OrganizationMisconfiguredException(liquidity.label(), "adminKeyIndex");
    }
    if (liquidity.poolAddress() == null) {
      throw new OrganizationMisconfiguredException(liquidity.label(), "poolAddress");
    }
    if (liquidity.governanceMint() == null) {
      throw new OrganizationMisconfiguredException(liquidity.label(), "governanceMint");
    }
  }
}
