package combinator.futarchy.service.query;

import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.domain.proposal.ProposalMetadata;
import combinator.futarchy.domain.proposal.ProposalStatus;
import combinator.futarchy.service.projection.ProposalProjection;
import java.util.List;

/**
 * 목록 조회용 제안 요약
 *
 * @param organizationAddress 메타데이터에 기록된 소유 조직
 * @param winningIndex RESOLVED일 때만 존재
 */
public record ProposalSummary(
    String proposalAddress,
    long proposalId,
    String organizationAddress,
    String title,
    List<String> options,
    ProposalStatus status,
    long createdAt,
    long endsAt,
    long warmupEndsAt,
    boolean expired,
    Integer winningIndex) {

  public ProposalSummary {
    options = options == null ? List.of() : List.copyOf(options);
  }

  static ProposalSummary of(
      ProposalAccount account, ProposalProjection projection, ProposalMetadata metadata) {
    return new ProposalSummary(
        account.address(),
        account.proposalId(),
        metadata.organizationAddress(),
        metadata.title(),
        metadata.options(),
        projection.status(),
        account.createdAt(),
        projection.endsAt(),
        projection.warmupEndsAt(),
        projection.expired(),
        projection.winningIndex().isPresent() ? projection.winningIndex().getAsInt() : null);
  }
}
