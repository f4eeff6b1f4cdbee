package combinator.futarchy.service.liquidity;

import combinator.futarchy.config.FutarchyProperties;
import combinator.futarchy.domain.ledger.AdminIdentity;
import combinator.futarchy.domain.ledger.MintAccount;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.domain.proposal.ProposalStatus;
import combinator.futarchy.external.pool.PoolConfirmation;
import combinator.futarchy.global.error.exception.InvalidProposalStateException;
import combinator.futarchy.global.error.exception.OrganizationMisconfiguredException;
import combinator.futarchy.global.error.exception.ProposalNotFoundException;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.global.lock.LockKeys;
import combinator.futarchy.global.lock.LockStrategy;
import combinator.futarchy.service.organization.OrganizationResolver;
import combinator.futarchy.service.sequencer.LedgerReader;
import combinator.futarchy.service.sequencer.PoolRoundTrip;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 회수한 유동성을 풀에 재예치
 *
 * <ol>
 *   <li>관리 지갑의 거버넌스 자산 보유량이 총 공급량의 임계 비율(기본 50bps) 미만이면 skipped
 *   <li>정리 스왑: 실패해도 경고만 남기고 진행
 *   <li>재예치: 실패하면 전체 실패
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiquidityReturnService {

  static final String BELOW_THRESHOLD_REASON = "Admin token balance below 0.5% threshold";

  private static final BigInteger BPS = BigInteger.valueOf(10_000);

  private final LedgerReader reader;
  private final PoolRoundTrip poolRoundTrip;
  private final OrganizationResolver resolver;
  private final LockStrategy lockStrategy;
  private final LogicExecutor executor;
  private final FutarchyProperties properties;

  public LiquidityReturnResult returnLiquidity(String proposalAddress) {
    return lockStrategy.executeWithLock(
        LockKeys.proposal(proposalAddress),
        properties.getLock().getWaitTimeout(),
        () -> doReturn(proposalAddress));
  }

  private LiquidityReturnResult doReturn(String proposalAddress) {
    ProposalAccount proposal =
        reader
            .proposal(proposalAddress)
            .orElseThrow(() -> new ProposalNotFoundException(proposalAddress));
    if (proposal.status() != ProposalStatus.RESOLVED) {
      throw new InvalidProposalStateException(
          "Proposal must be resolved before returning liquidity (current: "
              + proposal.status().label()
              + ")");
    }

    Organization liquidity = resolver.rootForModerator(proposal.moderatorAddress());
    resolver.requireLiquidityFields(liquidity);
    AdminIdentity admin = resolver.adminOf(liquidity);

    long balanceBps = balanceBps(liquidity, admin);
    int threshold = properties.getLiquidity().getReturnThresholdBps();
    if (balanceBps < threshold) {
      log.info(
          "⏭️ [Return] {} 관리 지갑 보유량 {}bps < {}bps, 재예치 생략",
          proposalAddress,
          balanceBps,
          threshold);
      return LiquidityReturnResult.skipped(proposalAddress, BELOW_THRESHOLD_REASON, balanceBps);
    }

    List<String> swapIds = cleanupSwap(liquidity, admin, proposalAddress);
    PoolConfirmation deposit = poolRoundTrip.deposit(liquidity, admin);

    log.info(
        "🔁 [Return] {} 재예치 완료 (pool={}, 스왑 {}건, 예치 {}건)",
        proposalAddress,
        liquidity.poolAddress(),
        swapIds.size(),
        deposit.submissionIds().size());
    return new LiquidityReturnResult(
        proposalAddress,
        false,
        null,
        balanceBps,
        swapIds,
        deposit.submissionIds(),
        deposit.amounts());
  }

  /** 총 공급량 대비 보유 비율 (bps, 내림). 토큰 계정이 없으면 0 */
  private long balanceBps(Organization liquidity, AdminIdentity admin) {
    MintAccount mint =
        reader
            .mint(liquidity.governanceMint())
            .orElseThrow(
                () -> new OrganizationMisconfiguredException(liquidity.label(), "governanceMint"));
    if (mint.supply().signum() == 0) {
      return 0;
    }
    BigInteger balance =
        reader.tokenBalance(admin.address(), liquidity.governanceMint()).orElse(BigInteger.ZERO);
    return balance.multiply(BPS).divide(mint.supply()).longValueExact();
  }

  private List<String> cleanupSwap(
      Organization liquidity, AdminIdentity admin, String proposalAddress) {
    Optional<PoolConfirmation> swap =
        executor.executeOrCatch(
            () -> Optional.of(poolRoundTrip.swap(liquidity, admin)),
            e -> {
              log.warn("⚠️ [Return] {} 정리 스왑 생략, 재예치 계속: {}", proposalAddress, e.getMessage());
              return Optional.empty();
            },
            TaskContext.of("Return", "cleanupSwap", proposalAddress));
    return swap.map(PoolConfirmation::submissionIds).orElse(List.of());
  }
}
