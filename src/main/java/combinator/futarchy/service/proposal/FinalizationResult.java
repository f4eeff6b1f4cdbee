package combinator.futarchy.service.proposal;

/**
 * @param alreadyFinalized 요청 전에 이미 RESOLVED였으면 true (제출 없음)
 * @param submissionId 이번 요청의 finalize 제출 id (이미 완료된 경우 null)
 */
public record FinalizationResult(
    String proposalAddress, int winningIndex, boolean alreadyFinalized, String submissionId) {}
