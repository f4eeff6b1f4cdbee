package combinator.futarchy.service.proposal;

import combinator.futarchy.config.FutarchyProperties;
import combinator.futarchy.domain.ledger.AdminIdentity;
import combinator.futarchy.domain.ledger.UnsignedChange;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.domain.proposal.ProposalState;
import combinator.futarchy.domain.proposal.ProposalStatus;
import combinator.futarchy.external.program.DecisionMarketProgram;
import combinator.futarchy.global.cache.CacheKeys;
import combinator.futarchy.global.cache.ReadModelCache;
import combinator.futarchy.global.error.exception.InvalidProposalStateException;
import combinator.futarchy.global.error.exception.ProposalNotEndedException;
import combinator.futarchy.global.error.exception.ProposalNotFoundException;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.global.lock.LockKeys;
import combinator.futarchy.global.lock.LockStrategy;
import combinator.futarchy.service.organization.OrganizationResolver;
import combinator.futarchy.service.projection.ProposalProjection;
import combinator.futarchy.service.projection.ProposalStateProjector;
import combinator.futarchy.service.sequencer.LedgerReader;
import combinator.futarchy.service.sequencer.LedgerSubmitter;
import combinator.futarchy.service.sequencer.ProposalWatcher;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 제안 종료 처리
 *
 * <p>이미 RESOLVED면 제출 없이 같은 결과를 돌려줍니다. 같은 제안의 회수·재예치와 섞이지 않도록 제안 락 안에서 실행합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProposalFinalizationService {

  private final LedgerReader reader;
  private final LedgerSubmitter submitter;
  private final ProposalWatcher watcher;
  private final ProposalStateProjector projector;
  private final OrganizationResolver resolver;
  private final DecisionMarketProgram program;
  private final LockStrategy lockStrategy;
  private final ReadModelCache cache;
  private final LogicExecutor executor;
  private final Clock clock;
  private final FutarchyProperties properties;

  public FinalizationResult finalizeProposal(String proposalAddress) {
    return lockStrategy.executeWithLock(
        LockKeys.proposal(proposalAddress),
        properties.getLock().getWaitTimeout(),
        () -> doFinalize(proposalAddress));
  }

  private FinalizationResult doFinalize(String proposalAddress) {
    ProposalAccount proposal =
        reader
            .proposal(proposalAddress)
            .orElseThrow(() -> new ProposalNotFoundException(proposalAddress));
    Instant now = clock.instant();
    ProposalProjection projection = projector.project(proposal, now);

    switch (projection.status()) {
      case RESOLVED -> {
        log.info("⏩ [Finalize] {} 이미 종료됨, resuming", proposalAddress);
        return new FinalizationResult(
            proposalAddress, projection.winningIndex().getAsInt(), true, null);
      }
      case SETUP -> throw new InvalidProposalStateException(
          "Proposal " + proposalAddress + " is still in setup and cannot be finalized");
      case PENDING -> {
        if (!projection.expired()) {
          throw new ProposalNotEndedException(
              proposalAddress, projection.secondsRemaining(now.getEpochSecond()));
        }
      }
    }

    Organization root = resolver.rootForModerator(proposal.moderatorAddress());
    AdminIdentity admin = resolver.adminOf(root);
    UnsignedChange change =
        executor.execute(
            () -> program.finalizeProposal(admin.address(), proposalAddress),
            TaskContext.of("Program", "finalizeProposal", proposalAddress));
    String submissionId = submitter.submit(admin, change);

    ProposalAccount resolved =
        watcher.await(
            proposalAddress, "resolved", p -> p.status() == ProposalStatus.RESOLVED);
    int winningIndex = ((ProposalState.Resolved) resolved.state()).winningIndex();
    cache.invalidate(CacheKeys.ALL_PROPOSALS);

    log.info("🏁 [Finalize] {} 종료 완료, 승리 옵션: {}", proposalAddress, winningIndex);
    return new FinalizationResult(proposalAddress, winningIndex, false, submissionId);
  }
}
