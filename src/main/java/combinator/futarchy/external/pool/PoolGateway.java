package combinator.futarchy.external.pool;

import combinator.futarchy.domain.ledger.LiquidityPosition;
import combinator.futarchy.domain.ledger.PoolState;
import combinator.futarchy.domain.ledger.SignedChange;
import combinator.futarchy.domain.organization.PoolKind;
import java.util.List;
import java.util.Optional;

/**
 * 풀 종류별 유동성 협력자
 *
 * <p>모든 쓰기 작업은 build → (호출 측 서명) → confirm 형태이며, confirm은 제출과 확정 대기까지 수행합니다.
 */
public interface PoolGateway {

  PoolKind kind();

  /** 이 종류의 풀이 아니거나 존재하지 않으면 empty */
  Optional<PoolState> fetchPoolState(String poolAddress);

  List<LiquidityPosition> positions(String owner, String poolAddress);

  PoolBuild withdrawBuild(String poolAddress, String owner, int percentage);

  PoolConfirmation withdrawConfirm(String requestId, List<SignedChange> signed);

  /** 보유 잔액 전부를 재예치 */
  PoolBuild depositBuild(String poolAddress, String owner);

  PoolConfirmation depositConfirm(String requestId, List<SignedChange> signed);

  /** 재예치 전 두 자산 비율을 맞추는 정리 스왑 */
  PoolBuild swapBuild(String poolAddress, String owner);

  PoolConfirmation swapConfirm(String requestId, List<SignedChange> signed);
}
