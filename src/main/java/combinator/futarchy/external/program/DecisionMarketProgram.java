package combinator.futarchy.external.program;

import combinator.futarchy.domain.ledger.UnsignedChange;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * 의사결정 시장 프로그램 변경 빌더
 *
 * <p>서명 전 변경만 만들며 제출하지 않습니다. 빌드 단계가 원장 상태를 읽으므로, 이전 단계가 확정된 뒤에 호출해야 합니다.
 */
public interface DecisionMarketProgram {

  OrganizationBuild initializeRoot(InitializeRootRequest request);

  OrganizationBuild initializeBranch(InitializeBranchRequest request);

  /** 관리 지갑과 이름으로 파생한 조직 계정이 이미 원장에 있으면 그 주소들. 없으면 empty */
  Optional<OrganizationAccounts> findOrganization(String admin, String name);

  /**
   * 옵션 수에 맞춘 주소 압축 테이블 생성
   *
   * <p>테이블 주소는 전달받은 제안 id로 파생합니다. initialize가 확정되면 모더레이터 카운터는 다음 제안을 가리키므로 카운터에서 읽으면
   * 안 됩니다.
   */
  LookupTableBuild createLookupTable(
      String payer, String moderator, long proposalId, int optionCount);

  UnsignedChange initializeProposal(
      String payer,
      String moderator,
      long proposalId,
      ProposalParameters parameters,
      String metadataRef);

  UnsignedChange addOption(String payer, String proposalAddress);

  /** 수수료 자산을 거래 가능한 래핑 토큰으로 전환 */
  UnsignedChange wrapNative(String owner, BigInteger amount);

  /** 주소 압축 테이블을 참조하는 launch 변경 (연산 예산 포함) */
  UnsignedChange launchProposal(
      String payer,
      String proposalAddress,
      BigInteger baseAmount,
      BigInteger quoteAmount,
      String lookupTable);

  UnsignedChange finalizeProposal(String payer, String proposalAddress);

  /** 옵션 2개 제안의 단일 제출 회수 */
  UnsignedChange redeemLiquidity(String payer, String proposalAddress);

  /** 옵션 3개 이상 제안의 회수. 순서대로 제출·확정해야 하는 여러 변경을 돌려줍니다. */
  List<UnsignedChange> redeemLiquidityCompacted(String payer, String proposalAddress);

  /** 여러 풀의 오라클 기록을 하나의 변경으로 묶습니다. */
  UnsignedChange crankOracles(String payer, List<String> poolAddresses);
}
