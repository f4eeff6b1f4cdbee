package combinator.futarchy.external.pool;

import combinator.futarchy.domain.ledger.PoolAmounts;
import combinator.futarchy.domain.ledger.UnsignedChange;
import java.util.List;

/**
 * 풀 작업 빌드 결과
 *
 * @param requestId confirm 호출 시 돌려줘야 하는 요청 id
 * @param changes 순서대로 서명할 변경 (DAMM은 1개, DLMM은 여러 개)
 * @param estimated 예상 이동 수량
 */
public record PoolBuild(String requestId, List<UnsignedChange> changes, PoolAmounts estimated) {

  public PoolBuild {
    changes = List.copyOf(changes);
  }
}
