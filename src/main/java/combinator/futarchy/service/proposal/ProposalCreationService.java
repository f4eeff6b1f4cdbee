package combinator.futarchy.service.proposal;

import combinator.futarchy.config.FutarchyProperties;
import combinator.futarchy.domain.ledger.AdminIdentity;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.domain.proposal.ProposalStatus;
import combinator.futarchy.global.cache.CacheKeys;
import combinator.futarchy.global.cache.ReadModelCache;
import combinator.futarchy.global.error.exception.InvalidInputException;
import combinator.futarchy.global.error.exception.OrganizationMisconfiguredException;
import combinator.futarchy.global.lock.LockKeys;
import combinator.futarchy.global.lock.LockStrategy;
import combinator.futarchy.service.organization.OrganizationResolver;
import combinator.futarchy.service.readiness.ReadinessContext;
import combinator.futarchy.service.readiness.ReadinessGate;
import combinator.futarchy.service.readiness.ReadinessReport;
import combinator.futarchy.service.sequencer.SequenceReport;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 제안 생성
 *
 * <p>입력 검증 → 모더레이터 락 → 준비 상태 게이트 → 단계 실행 → 캐시 갱신 순서입니다. 루트와 모든 브랜치가 한 모더레이터를 공유하므로 같은
 * 모더레이터의 생성 요청은 락으로 직렬화되고, 게이트의 active_proposal 검사가 그 안에서 평가됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProposalCreationService {

  static final int MIN_OPTIONS = 2;
  static final int MAX_OPTIONS = 6;

  private final OrganizationResolver resolver;
  private final ReadinessGate readinessGate;
  private final ProposalCreationWorkflow workflow;
  private final LockStrategy lockStrategy;
  private final ReadModelCache cache;
  private final Clock clock;
  private final FutarchyProperties properties;

  public ProposalCreationResult createProposal(CreateProposalCommand command) {
    return create(command, false);
  }

  /**
   * 설정(SETUP) 상태로 남은 최근 제안을 같은 입력으로 이어서 완성합니다.
   *
   * <p>초기화는 건너뛰고 옵션 추가와 launch부터 진행합니다. 메타데이터가 처음 요청과 다르면 충돌로 거부됩니다.
   */
  public ProposalCreationResult resumeProposal(CreateProposalCommand command) {
    return create(command, true);
  }

  /** 잠금 없이 게이트만 평가합니다 (상태 조회용). */
  public ReadinessReport checkReadiness(String organizationAddress, String callerWallet) {
    Organization organization = resolver.byAddress(organizationAddress);
    Organization liquidity = resolver.liquidityOrganization(organization);
    return readinessGate.evaluate(
        new ReadinessContext(organization, liquidity, callerWallet, clock.instant(), false));
  }

  private ProposalCreationResult create(CreateProposalCommand command, boolean resuming) {
    validate(command);
    Organization organization = resolver.byAddress(command.organizationAddress());
    validateLength(command, organization);
    if (organization.moderatorAddress() == null) {
      throw new OrganizationMisconfiguredException(organization.label(), "moderatorAddress");
    }
    Organization liquidity = resolver.liquidityOrganization(organization);
    resolver.requireLiquidityFields(liquidity);

    return lockStrategy.executeWithLock(
        LockKeys.moderator(organization.moderatorAddress()),
        properties.getLock().getWaitTimeout(),
        () -> {
          readinessGate.verify(
              new ReadinessContext(
                  organization, liquidity, command.callerWallet(), clock.instant(), resuming));
          AdminIdentity admin = resolver.adminOf(liquidity);

          ProposalCreationContext context =
              new ProposalCreationContext(command, organization, liquidity, admin, resuming);
          SequenceReport report = workflow.run(context);

          if (report.executed().contains(ProposalCreationWorkflow.LAUNCH)) {
            cache.increment(CacheKeys.proposalCount(organization.address()));
          }
          cache.invalidate(CacheKeys.ALL_PROPOSALS);

          log.info(
              "🗳️ [Proposal] {} 제안 {} 생성 완료 ({})",
              organization.name(),
              context.getProposalId(),
              context.getProposalAddress());
          return new ProposalCreationResult(
              context.getProposalAddress(),
              context.getProposalId(),
              context.getProposal().metadataRef(),
              organization.address(),
              ProposalStatus.PENDING,
              report.resumed());
        });
  }

  private static void validate(CreateProposalCommand command) {
    if (command.organizationAddress() == null || command.organizationAddress().isBlank()) {
      throw new InvalidInputException("organizationAddress is required");
    }
    if (command.title() == null || command.title().isBlank()) {
      throw new InvalidInputException("title is required");
    }
    List<String> options = command.options();
    if (options.size() < MIN_OPTIONS || options.size() > MAX_OPTIONS) {
      throw new InvalidInputException(
          "Proposal must have between " + MIN_OPTIONS + " and " + MAX_OPTIONS + " options");
    }
    if (options.stream().anyMatch(o -> o == null || o.isBlank())) {
      throw new InvalidInputException("Option names must not be blank");
    }
    if (command.lengthSeconds() <= 0) {
      throw new InvalidInputException("lengthSeconds must be positive");
    }
    long maxWarmup = command.lengthSeconds() * 4 / 5;
    if (command.warmupSeconds() <= 0 || command.warmupSeconds() > maxWarmup) {
      throw new InvalidInputException(
          "warmupSeconds must be between 1 and " + maxWarmup + " (80% of the proposal length)");
    }
  }

  /** 조직 소유자는 짧은 테스트 제안도 허용하고, 그 외 제안자는 1~4일로 제한합니다. */
  private void validateLength(CreateProposalCommand command, Organization organization) {
    FutarchyProperties.Proposal config = properties.getProposal();
    boolean owner = organization.isOwnedBy(command.callerWallet());
    Duration min = owner ? config.getOwnerMinLength() : config.getProposerMinLength();
    Duration max = owner ? config.getOwnerMaxLength() : config.getProposerMaxLength();
    long length = command.lengthSeconds();
    if (length < min.toSeconds() || length > max.toSeconds()) {
      throw new InvalidInputException(
          "Proposal length must be between "
              + min.toSeconds()
              + " and "
              + max.toSeconds()
              + " seconds");
    }
  }
}
