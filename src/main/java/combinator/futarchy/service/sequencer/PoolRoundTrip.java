package combinator.futarchy.service.sequencer;

import combinator.futarchy.domain.ledger.AdminIdentity;
import combinator.futarchy.domain.ledger.SignedChange;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.external.pool.PoolBuild;
import combinator.futarchy.external.pool.PoolConfirmation;
import combinator.futarchy.external.pool.PoolGateway;
import combinator.futarchy.external.pool.PoolGatewayRegistry;
import combinator.futarchy.global.error.exception.ExternalServiceException;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.global.executor.strategy.ExceptionTranslator;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 풀 협력자 build → 관리 지갑 서명 → confirm 한 바퀴
 *
 * <p>대상 풀과 서명 지갑은 항상 유동성을 소유한 조직(브랜치라면 루트)의 것입니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PoolRoundTrip {

  private final PoolGatewayRegistry gateways;
  private final LedgerSubmitter submitter;
  private final LogicExecutor executor;

  public PoolConfirmation withdraw(Organization liquidity, AdminIdentity admin, int percentage) {
    PoolGateway gateway = gateways.gatewayFor(liquidity.poolKind());
    return roundTrip(
        "withdraw",
        gateway,
        liquidity,
        admin,
        g -> g.withdrawBuild(liquidity.poolAddress(), admin.address(), percentage),
        gateway::withdrawConfirm);
  }

  public PoolConfirmation deposit(Organization liquidity, AdminIdentity admin) {
    PoolGateway gateway = gateways.gatewayFor(liquidity.poolKind());
    return roundTrip(
        "deposit",
        gateway,
        liquidity,
        admin,
        g -> g.depositBuild(liquidity.poolAddress(), admin.address()),
        gateway::depositConfirm);
  }

  public PoolConfirmation swap(Organization liquidity, AdminIdentity admin) {
    PoolGateway gateway = gateways.gatewayFor(liquidity.poolKind());
    return roundTrip(
        "swap",
        gateway,
        liquidity,
        admin,
        g -> g.swapBuild(liquidity.poolAddress(), admin.address()),
        gateway::swapConfirm);
  }

  private PoolConfirmation roundTrip(
      String operation,
      PoolGateway gateway,
      Organization liquidity,
      AdminIdentity admin,
      Function<PoolGateway, PoolBuild> build,
      BiFunction<String, List<SignedChange>, PoolConfirmation> confirm) {
    ExceptionTranslator translator = poolTranslator(liquidity, operation);

    PoolBuild built =
        executor.executeWithTranslation(
            () -> build.apply(gateway),
            translator,
            TaskContext.of("Pool", operation + "Build", liquidity.poolAddress()));
    if (built.changes().isEmpty()) {
      throw new ExternalServiceException(
          "pool:" + liquidity.poolKind() + ":" + operation + " returned no changes");
    }

    List<SignedChange> signed =
        built.changes().stream().map(change -> submitter.sign(admin, change)).toList();
    log.info(
        "✍️ [Pool] {} {} 서명 완료 ({}건, requestId={})",
        liquidity.poolKind(),
        operation,
        signed.size(),
        built.requestId());

    return executor.executeWithTranslation(
        () -> confirm.apply(built.requestId(), signed),
        translator,
        TaskContext.of("Pool", operation + "Confirm", built.requestId()));
  }

  private static ExceptionTranslator poolTranslator(Organization liquidity, String operation) {
    return ExceptionTranslator.forExternalService("pool:" + liquidity.poolKind() + ":" + operation);
  }
}
