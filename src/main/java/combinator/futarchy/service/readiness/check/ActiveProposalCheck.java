package combinator.futarchy.service.readiness.check;

import combinator.futarchy.domain.ledger.ModeratorAccount;
import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.domain.proposal.ProposalStatus;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.service.projection.ProposalProjection;
import combinator.futarchy.service.projection.ProposalStateProjector;
import combinator.futarchy.service.readiness.ReadinessCheck;
import combinator.futarchy.service.readiness.ReadinessCheckNames;
import combinator.futarchy.service.readiness.ReadinessContext;
import combinator.futarchy.service.readiness.ReadinessResult;
import combinator.futarchy.service.sequencer.LedgerReader;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 충돌하는 진행 중 제안이 없는지
 *
 * <p>모더레이터의 가장 최근 제안만 봅니다. 브랜치는 루트의 모더레이터를 공유하므로 형제 브랜치끼리도 자연히 직렬화됩니다. 조회 실패는 통과가 아니라
 * 실패로 취급합니다.
 */
@Component
@Order(5)
@RequiredArgsConstructor
public class ActiveProposalCheck implements ReadinessCheck {

  private final LedgerReader reader;
  private final ProposalStateProjector projector;
  private final LogicExecutor executor;

  @Override
  public String name() {
    return ReadinessCheckNames.ACTIVE_PROPOSAL;
  }

  @Override
  public ReadinessResult check(ReadinessContext context) {
    String moderator = context.organization().moderatorAddress();
    return executor.executeOrCatch(
        () -> evaluate(moderator, context),
        e ->
            ReadinessResult.notReady(
                "Failed to verify proposal state: " + e.getMessage() + ". Please try again."),
        TaskContext.of("Readiness", "activeProposal", moderator));
  }

  private ReadinessResult evaluate(String moderatorAddress, ReadinessContext context) {
    Optional<ModeratorAccount> moderator = reader.moderator(moderatorAddress);
    if (moderator.isEmpty()) {
      return ReadinessResult.notReady("Moderator account not found: " + moderatorAddress);
    }

    // 최근 제안 계정이 닫혔으면 막는 제안이 없는 것과 같다
    Optional<ProposalAccount> latest = reader.latestProposal(moderator.get());
    if (latest.isEmpty()) {
      return ReadinessResult.passed();
    }

    ProposalAccount proposal = latest.get();
    ProposalProjection projection = projector.project(proposal, context.now());
    if (!projection.blocksNewProposal()) {
      return ReadinessResult.passed();
    }
    if (projection.status() == ProposalStatus.SETUP) {
      return context.resumingSetup()
          ? ReadinessResult.passed()
          : ReadinessResult.notReady(
              "Proposal "
                  + proposal.proposalId()
                  + " is still in setup. Complete or abandon it before creating a new proposal.");
    }

    long hours = projection.hoursRemaining(context.now().getEpochSecond());
    return ReadinessResult.notReady(
        "Active proposal "
            + proposal.proposalId()
            + " in progress. ~"
            + hours
            + "h remaining before it can be finalized.");
  }
}
