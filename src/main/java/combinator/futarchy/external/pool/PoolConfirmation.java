package combinator.futarchy.external.pool;

import combinator.futarchy.domain.ledger.PoolAmounts;
import java.util.List;

/** 풀 작업 확정 결과. amounts는 실제로 이동한 수량입니다. */
public record PoolConfirmation(List<String> submissionIds, PoolAmounts amounts) {

  public PoolConfirmation {
    submissionIds = List.copyOf(submissionIds);
  }
}
