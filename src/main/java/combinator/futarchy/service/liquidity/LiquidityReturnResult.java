package combinator.futarchy.service.liquidity;

import combinator.futarchy.domain.ledger.PoolAmounts;
import java.util.List;

/**
 * 재예치 결과
 *
 * <p>skipped는 실패가 아니라 의도된 무동작입니다. 보유량이 총 공급량 대비 임계 비율 미만이면 스왑과 재예치를 모두 건너뜁니다.
 *
 * @param balanceBps 관리 지갑 거버넌스 자산 보유량 (총 공급량 대비 bps)
 * @param swapSubmissionIds 정리 스왑 제출 id (스왑이 실패했거나 건너뛰었으면 비어 있음)
 */
public record LiquidityReturnResult(
    String proposalAddress,
    boolean skipped,
    String reason,
    long balanceBps,
    List<String> swapSubmissionIds,
    List<String> depositSubmissionIds,
    PoolAmounts deposited) {

  public LiquidityReturnResult {
    swapSubmissionIds = List.copyOf(swapSubmissionIds);
    depositSubmissionIds = List.copyOf(depositSubmissionIds);
  }

  static LiquidityReturnResult skipped(String proposalAddress, String reason, long balanceBps) {
    return new LiquidityReturnResult(
        proposalAddress, true, reason, balanceBps, List.of(), List.of(), null);
  }
}
