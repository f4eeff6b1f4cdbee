package combinator.futarchy.service.liquidity;

import combinator.futarchy.config.FutarchyProperties;
import combinator.futarchy.domain.ledger.AdminIdentity;
import combinator.futarchy.domain.ledger.UnsignedChange;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.domain.proposal.ProposalStatus;
import combinator.futarchy.external.program.DecisionMarketProgram;
import combinator.futarchy.global.error.exception.InvalidProposalStateException;
import combinator.futarchy.global.error.exception.ProposalNotFoundException;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.global.lock.LockKeys;
import combinator.futarchy.global.lock.LockStrategy;
import combinator.futarchy.service.organization.OrganizationResolver;
import combinator.futarchy.service.sequencer.LedgerReader;
import combinator.futarchy.service.sequencer.LedgerSubmitter;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 종료된 제안의 시장 유동성 회수
 *
 * <p>옵션이 2개를 넘으면 한 제출의 크기 한도를 넘으므로 압축 참조 형식의 여러 변경으로 나눠 순서대로 제출합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiquidityRedemptionService {

  private static final int SINGLE_SUBMISSION_MAX_OPTIONS = 2;

  private final LedgerReader reader;
  private final LedgerSubmitter submitter;
  private final OrganizationResolver resolver;
  private final DecisionMarketProgram program;
  private final LockStrategy lockStrategy;
  private final LogicExecutor executor;
  private final FutarchyProperties properties;

  public RedemptionResult redeemLiquidity(String proposalAddress) {
    return lockStrategy.executeWithLock(
        LockKeys.proposal(proposalAddress),
        properties.getLock().getWaitTimeout(),
        () -> doRedeem(proposalAddress));
  }

  private RedemptionResult doRedeem(String proposalAddress) {
    ProposalAccount proposal =
        reader
            .proposal(proposalAddress)
            .orElseThrow(() -> new ProposalNotFoundException(proposalAddress));
    if (proposal.status() != ProposalStatus.RESOLVED) {
      throw new InvalidProposalStateException(
          "Proposal must be resolved before redeeming liquidity (current: "
              + proposal.status().label()
              + ")");
    }

    Organization root = resolver.rootForModerator(proposal.moderatorAddress());
    AdminIdentity admin = resolver.adminOf(root);
    boolean compacted = proposal.numOptions() > SINGLE_SUBMISSION_MAX_OPTIONS;

    List<String> submissionIds;
    if (compacted) {
      List<UnsignedChange> changes =
          executor.execute(
              () -> program.redeemLiquidityCompacted(admin.address(), proposalAddress),
              TaskContext.of("Program", "redeemLiquidityCompacted", proposalAddress));
      submissionIds = submitter.submitAll(admin, changes);
    } else {
      UnsignedChange change =
          executor.execute(
              () -> program.redeemLiquidity(admin.address(), proposalAddress),
              TaskContext.of("Program", "redeemLiquidity", proposalAddress));
      submissionIds = List.of(submitter.submit(admin, change));
    }

    log.info(
        "💰 [Redeem] {} 유동성 회수 완료 (옵션 {}개, 제출 {}건)",
        proposalAddress,
        proposal.numOptions(),
        submissionIds.size());
    return new RedemptionResult(proposalAddress, submissionIds, compacted);
  }
}
