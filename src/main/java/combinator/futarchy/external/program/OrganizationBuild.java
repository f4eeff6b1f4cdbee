package combinator.futarchy.external.program;

import combinator.futarchy.domain.ledger.UnsignedChange;

/**
 * 조직 생성 변경과 생성될 계정 주소
 *
 * @param treasuryMultisig 트레저리 멀티시그 (자산은 파생 금고로 보내야 함)
 * @param mintMultisig 발행 권한 멀티시그
 */
public record OrganizationBuild(
    UnsignedChange change,
    String organizationAddress,
    String moderatorAddress,
    String treasuryMultisig,
    String mintMultisig) {

  public OrganizationAccounts accounts() {
    return new OrganizationAccounts(
        organizationAddress, moderatorAddress, treasuryMultisig, mintMultisig);
  }
}
