package combinator.futarchy.service.readiness.check;

import combinator.futarchy.domain.ledger.PoolState;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.external.pool.PoolGatewayRegistry;
import combinator.futarchy.service.readiness.ReadinessCheck;
import combinator.futarchy.service.readiness.ReadinessCheckNames;
import combinator.futarchy.service.readiness.ReadinessContext;
import combinator.futarchy.service.readiness.ReadinessResult;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** 거버넌스 자산이 설정된 풀의 두 자산 중 하나인지 (루트 전용, 브랜치는 루트의 풀을 그대로 씀) */
@Component
@Order(3)
@RequiredArgsConstructor
public class TokenPoolMatchCheck implements ReadinessCheck {

  private final PoolGatewayRegistry gateways;

  @Override
  public String name() {
    return ReadinessCheckNames.TOKEN_POOL_MATCH;
  }

  @Override
  public boolean appliesTo(ReadinessContext context) {
    return context.organization().isRoot();
  }

  @Override
  public ReadinessResult check(ReadinessContext context) {
    Organization organization = context.organization();
    Optional<PoolState> pool =
        gateways.gatewayFor(organization.poolKind()).fetchPoolState(organization.poolAddress());
    if (pool.isEmpty()) {
      return ReadinessResult.notReady(
          "Pool not found: " + organization.poolAddress() + " (" + organization.poolKind() + ")");
    }
    if (!pool.get().holds(organization.governanceMint())) {
      return ReadinessResult.notReady(
          "Token mint "
              + organization.governanceMint()
              + " does not match either pool token ("
              + pool.get().tokenAMint()
              + ", "
              + pool.get().tokenBMint()
              + ")");
    }
    return ReadinessResult.passed();
  }
}
