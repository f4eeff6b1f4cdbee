package combinator.futarchy.service.readiness;

import combinator.futarchy.domain.organization.Organization;
import java.time.Instant;

/**
 * 검사 입력
 *
 * @param organization 제안을 만들 조직
 * @param liquidityOrganization 유동성을 소유한 조직 (브랜치면 루트, 루트면 자기 자신)
 * @param callerWallet 제안 요청자
 * @param now 검사 기준 시각
 * @param resumingSetup 반쯤 만들어진(SETUP) 제안 이어서 만들기 요청인지
 */
public record ReadinessContext(
    Organization organization,
    Organization liquidityOrganization,
    String callerWallet,
    Instant now,
    boolean resumingSetup) {

  /** 유동성을 보유하고 수수료를 내는 지갑 */
  public String liquidityOwner() {
    return liquidityOrganization.adminWallet();
  }
}
