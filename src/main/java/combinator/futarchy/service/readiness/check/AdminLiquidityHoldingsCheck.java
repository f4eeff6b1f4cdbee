package combinator.futarchy.service.readiness.check;

import combinator.futarchy.domain.ledger.LiquidityPosition;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.external.pool.PoolGatewayRegistry;
import combinator.futarchy.service.readiness.ReadinessCheck;
import combinator.futarchy.service.readiness.ReadinessCheckNames;
import combinator.futarchy.service.readiness.ReadinessContext;
import combinator.futarchy.service.readiness.ReadinessResult;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** 유동성 소유 지갑이 잠기지 않은 포지션을 보유해야 시장에 넣을 유동성이 생깁니다. */
@Component
@Order(4)
@RequiredArgsConstructor
public class AdminLiquidityHoldingsCheck implements ReadinessCheck {

  private final PoolGatewayRegistry gateways;

  @Override
  public String name() {
    return ReadinessCheckNames.ADMIN_LP_HOLDINGS;
  }

  @Override
  public ReadinessResult check(ReadinessContext context) {
    Organization liquidity = context.liquidityOrganization();
    List<LiquidityPosition> positions =
        gateways
            .gatewayFor(liquidity.poolKind())
            .positions(context.liquidityOwner(), liquidity.poolAddress());

    if (positions.isEmpty()) {
      return ReadinessResult.notReady(
          "Admin wallet holds no LP positions for the " + liquidity.poolKind() + " pool");
    }
    if (positions.stream().noneMatch(LiquidityPosition::hasUnlockedLiquidity)) {
      return ReadinessResult.notReady(
          "Admin wallet LP positions for the "
              + liquidity.poolKind()
              + " pool are empty or fully locked");
    }
    return ReadinessResult.passed();
  }
}
