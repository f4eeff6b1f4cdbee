package combinator.futarchy.external.pool;

import combinator.futarchy.domain.ledger.PoolState;
import combinator.futarchy.domain.organization.PoolKind;
import combinator.futarchy.global.error.exception.ExternalServiceException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** 풀 종류 → 협력자 라우팅 */
@Slf4j
@Component
public class PoolGatewayRegistry {

  private final Map<PoolKind, PoolGateway> gateways = new EnumMap<>(PoolKind.class);

  public PoolGatewayRegistry(List<PoolGateway> gateways) {
    gateways.forEach(g -> this.gateways.put(g.kind(), g));
    log.info("🔌 [Pool] 등록된 풀 협력자: {}", this.gateways.keySet());
  }

  public PoolGateway gatewayFor(PoolKind kind) {
    PoolGateway gateway = gateways.get(kind);
    if (gateway == null) {
      throw new ExternalServiceException("pool:" + kind);
    }
    return gateway;
  }

  /** 등록된 협력자를 차례로 조회해 풀 종류를 판별합니다. */
  public Optional<PoolState> detect(String poolAddress) {
    for (PoolGateway gateway : gateways.values()) {
      Optional<PoolState> state = gateway.fetchPoolState(poolAddress);
      if (state.isPresent()) {
        return state;
      }
    }
    return Optional.empty();
  }
}
