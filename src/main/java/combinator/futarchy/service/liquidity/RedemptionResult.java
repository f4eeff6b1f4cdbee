package combinator.futarchy.service.liquidity;

import java.util.List;

/**
 * @param compacted 옵션 3개 이상이라 여러 제출로 나눠 회수했는지
 */
public record RedemptionResult(
    String proposalAddress, List<String> submissionIds, boolean compacted) {

  public RedemptionResult {
    submissionIds = List.copyOf(submissionIds);
  }
}
