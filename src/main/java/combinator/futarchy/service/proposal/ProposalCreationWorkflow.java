package combinator.futarchy.service.proposal;

import combinator.futarchy.config.FutarchyProperties;
import combinator.futarchy.domain.ledger.LedgerAddresses;
import combinator.futarchy.domain.ledger.LookupTableAccount;
import combinator.futarchy.domain.ledger.ModeratorAccount;
import combinator.futarchy.domain.ledger.PoolAmounts;
import combinator.futarchy.domain.ledger.UnsignedChange;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.domain.proposal.ProposalMetadata;
import combinator.futarchy.domain.proposal.ProposalStatus;
import combinator.futarchy.external.metadata.MetadataStore;
import combinator.futarchy.external.metadata.ProposalMetadataCodec;
import combinator.futarchy.external.program.DecisionMarketProgram;
import combinator.futarchy.external.program.LookupTableBuild;
import combinator.futarchy.external.program.ProposalParameters;
import combinator.futarchy.global.error.exception.IdempotencyConflictException;
import combinator.futarchy.global.error.exception.InvalidProposalStateException;
import combinator.futarchy.global.error.exception.OrganizationMisconfiguredException;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.global.executor.strategy.ExceptionTranslator;
import combinator.futarchy.service.sequencer.BoundedPoller;
import combinator.futarchy.service.sequencer.LedgerReader;
import combinator.futarchy.service.sequencer.LedgerSubmitter;
import combinator.futarchy.service.sequencer.PoolRoundTrip;
import combinator.futarchy.service.sequencer.ProposalWatcher;
import combinator.futarchy.service.sequencer.SequenceReport;
import combinator.futarchy.service.sequencer.StepSequencer;
import combinator.futarchy.service.sequencer.WorkflowStep;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 제안 생성 단계 목록
 *
 * <pre>
 * locate_proposal → publish_metadata → withdraw_liquidity → compute_pricing → create_lookup_table
 *   → initialize_proposal → [add_options] → [wrap_native] → launch_proposal
 * </pre>
 *
 * <p>initialize 이후 단계는 앞 단계가 쓴 원장 상태를 빌드 시점에 읽으므로, 각 제출의 확정과 조회 반영을 확인한 뒤 다음 단계로 넘어갑니다. 대상
 * 제안의 위치 확인과 메타데이터 충돌 검사는 되돌릴 수 없는 출금보다 먼저 수행합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProposalCreationWorkflow {

  static final String LOCATE = "locate_proposal";
  static final String WITHDRAW = "withdraw_liquidity";
  static final String PRICING = "compute_pricing";
  static final String METADATA = "publish_metadata";
  static final String LOOKUP_TABLE = "create_lookup_table";
  static final String INITIALIZE = "initialize_proposal";
  static final String ADD_OPTIONS = "add_options";
  static final String WRAP = "wrap_native";
  static final String LAUNCH = "launch_proposal";

  /** initialize가 만드는 기본 옵션 수 */
  static final int INITIAL_OPTIONS = 2;

  private final StepSequencer sequencer;
  private final LedgerReader reader;
  private final LedgerSubmitter submitter;
  private final PoolRoundTrip poolRoundTrip;
  private final ProposalWatcher watcher;
  private final BoundedPoller poller;
  private final DecisionMarketProgram program;
  private final MetadataStore metadataStore;
  private final ProposalMetadataCodec codec;
  private final LogicExecutor executor;
  private final FutarchyProperties properties;

  SequenceReport run(ProposalCreationContext context) {
    return sequencer.run(
        "createProposal:" + context.getOrganization().name(), context, steps(context));
  }

  private List<WorkflowStep<ProposalCreationContext>> steps(ProposalCreationContext context) {
    List<WorkflowStep<ProposalCreationContext>> steps = new ArrayList<>();
    steps.add(WorkflowStep.of(LOCATE, this::locateProposal));
    steps.add(WorkflowStep.of(METADATA, this::publishMetadata));
    steps.add(
        WorkflowStep.of(
            WITHDRAW,
            this::withdrawLiquidity,
            c ->
                "check pool positions of "
                    + c.getAdmin().address()
                    + "; a re-run withdraws another "
                    + c.getOrganization().withdrawalPercentage()
                    + "%"));
    steps.add(WorkflowStep.of(PRICING, this::computePricing));
    steps.add(WorkflowStep.of(LOOKUP_TABLE, this::createLookupTable, this::proposalHint));
    steps.add(new InitializeStep());
    if (context.optionCount() > INITIAL_OPTIONS) {
      steps.add(new AddOptionsStep());
    }
    if (LedgerAddresses.isNative(context.getLiquidity().quoteMint())) {
      steps.add(new WrapNativeStep());
    }
    steps.add(new LaunchStep());
    return steps;
  }

  // ===== 단계 구현 =====

  /** 모더레이터 카운터로 대상 제안 id와 주소를 정합니다. 반쯤 만들어진 제안이 있으면 그것을 이어서 씁니다. */
  private void locateProposal(ProposalCreationContext context) {
    String moderatorAddress = context.moderator();
    ModeratorAccount moderator =
        reader
            .moderator(moderatorAddress)
            .orElseThrow(
                () ->
                    new OrganizationMisconfiguredException(
                        context.getOrganization().label(), "moderatorAddress"));
    Optional<ProposalAccount> latest = reader.latestProposal(moderator);

    if (context.isResuming()) {
      ProposalAccount setup =
          latest
              .filter(p -> p.status() == ProposalStatus.SETUP)
              .orElseThrow(
                  () ->
                      new InvalidProposalStateException(
                          "no proposal in setup to resume for moderator " + moderatorAddress));
      adopt(context, setup);
      return;
    }

    long proposalId = moderator.proposalIdCounter();
    String address = reader.proposalAddress(moderatorAddress, proposalId);
    context.setProposalId(proposalId);
    context.setProposalAddress(address);

    Optional<ProposalAccount> existing = reader.proposal(address);
    if (existing.isEmpty()) {
      return;
    }
    if (existing.get().status() != ProposalStatus.SETUP) {
      throw new IdempotencyConflictException(
          "Proposal "
              + proposalId
              + " already exists in "
              + existing.get().status().label()
              + " state at "
              + address);
    }
    adopt(context, existing.get());
  }

  private void adopt(ProposalCreationContext context, ProposalAccount setup) {
    context.setProposalId(setup.proposalId());
    context.setProposalAddress(setup.address());
    context.setProposal(setup);
    log.info(
        "♻️ [Proposal] 설정 중인 제안 {} ({}) 이어서 진행",
        setup.proposalId(),
        setup.address());
  }

  private void withdrawLiquidity(ProposalCreationContext context) {
    Organization liquidity = context.getLiquidity();
    int percentage = context.getOrganization().withdrawalPercentage();
    PoolAmounts amounts =
        poolRoundTrip.withdraw(liquidity, context.getAdmin(), percentage).amounts();
    context.setBaseAmount(amounts.amountOf(liquidity.governanceMint()));
    context.setQuoteAmount(amounts.amountOf(liquidity.quoteMint()));
    log.info(
        "💧 [Proposal] {}% 출금: base={}, quote={}",
        percentage,
        context.getBaseAmount(),
        context.getQuoteAmount());
  }

  private void computePricing(ProposalCreationContext context) {
    FutarchyProperties.Proposal config = properties.getProposal();
    ProposalPricing pricing =
        ProposalPricing.of(
            context.getBaseAmount(),
            context.getQuoteAmount(),
            config.getMaxObservationDeltaPercent());
    context.setParameters(
        new ProposalParameters(
            context.getCommand().lengthSeconds(),
            context.getCommand().warmupSeconds(),
            pricing.startingObservation(),
            pricing.maxObservationDelta(),
            config.getMarketBias(),
            config.getFeeBps()));
  }

  private void publishMetadata(ProposalCreationContext context) {
    CreateProposalCommand command = context.getCommand();
    ProposalMetadata metadata =
        new ProposalMetadata(
            command.title(),
            command.description(),
            command.options(),
            context.getOrganization().address());
    byte[] blob = codec.encode(metadata);
    String reference =
        executor.executeWithTranslation(
            () -> metadataStore.publish(blob),
            ExceptionTranslator.forExternalService("metadata-store"),
            TaskContext.of("Metadata", "publish", context.getOrganization().address()));

    ProposalAccount setup = context.getProposal();
    if (setup != null && !reference.equals(setup.metadataRef())) {
      throw new IdempotencyConflictException(
          "Proposal "
              + setup.proposalId()
              + " in setup was initialized with metadata "
              + setup.metadataRef()
              + ", not "
              + reference);
    }
    context.setMetadataRef(reference);
  }

  private void createLookupTable(ProposalCreationContext context) {
    String payer = context.getAdmin().address();
    LookupTableBuild build =
        executor.execute(
            () ->
                program.createLookupTable(
                    payer, context.moderator(), context.getProposalId(), context.optionCount()),
            TaskContext.of("Program", "createLookupTable", context.getProposalAddress()));
    submitter.submit(context.getAdmin(), build.change());

    FutarchyProperties.LookupTable config = properties.getLookupTable();
    LookupTableAccount table =
        poller.pollUntil(
            "lookup table " + build.tableAddress(),
            config.getPollInterval(),
            config.getMaxWait(),
            () -> reader.lookupTable(build.tableAddress()).filter(LookupTableAccount::isPopulated));
    context.setLookupTable(table.address());
  }

  private String proposalHint(ProposalCreationContext context) {
    return "fetch proposal "
        + context.getProposalAddress()
        + " (id "
        + context.getProposalId()
        + ") and re-run; completed steps are skipped";
  }

  private void submit(ProposalCreationContext context, UnsignedChange change) {
    submitter.submit(context.getAdmin(), change);
  }

  private class InitializeStep implements WorkflowStep<ProposalCreationContext> {

    @Override
    public String name() {
      return INITIALIZE;
    }

    @Override
    public boolean isAlreadyDone(ProposalCreationContext context) {
      return context.getProposal() != null;
    }

    @Override
    public void execute(ProposalCreationContext context) {
      String payer = context.getAdmin().address();
      UnsignedChange change =
          executor.execute(
              () ->
                  program.initializeProposal(
                      payer,
                      context.moderator(),
                      context.getProposalId(),
                      context.getParameters(),
                      context.getMetadataRef()),
              TaskContext.of("Program", "initializeProposal", context.getProposalAddress()));
      submit(context, change);
      context.setProposal(watcher.await(context.getProposalAddress(), "initialized", p -> true));
    }

    @Override
    public String recoveryHint(ProposalCreationContext context) {
      return proposalHint(context);
    }
  }

  private class AddOptionsStep implements WorkflowStep<ProposalCreationContext> {

    @Override
    public String name() {
      return ADD_OPTIONS;
    }

    @Override
    public boolean isAlreadyDone(ProposalCreationContext context) {
      return context.getProposal().numOptions() >= context.optionCount();
    }

    @Override
    public void checkPrecondition(ProposalCreationContext context) {
      if (context.getProposal().status() != ProposalStatus.SETUP) {
        throw new IdempotencyConflictException(
            "Proposal "
                + context.getProposalId()
                + " is "
                + context.getProposal().status().label()
                + " but has only "
                + context.getProposal().numOptions()
                + " options");
      }
    }

    @Override
    public void execute(ProposalCreationContext context) {
      String address = context.getProposalAddress();
      String payer = context.getAdmin().address();
      // 옵션 하나씩 확정·반영을 확인한 뒤 다음 옵션을 추가한다
      for (int current = context.getProposal().numOptions();
          current < context.optionCount();
          current++) {
        int expected = current + 1;
        UnsignedChange change =
            executor.execute(
                () -> program.addOption(payer, address),
                TaskContext.of("Program", "addOption", address));
        submit(context, change);
        context.setProposal(
            watcher.await(address, "option " + expected, p -> p.numOptions() >= expected));
      }
    }

    @Override
    public String recoveryHint(ProposalCreationContext context) {
      return proposalHint(context);
    }
  }

  private class WrapNativeStep implements WorkflowStep<ProposalCreationContext> {

    @Override
    public String name() {
      return WRAP;
    }

    @Override
    public boolean isAlreadyDone(ProposalCreationContext context) {
      BigInteger wrapped =
          reader
              .tokenBalance(context.getAdmin().address(), LedgerAddresses.NATIVE_MINT)
              .orElse(BigInteger.ZERO);
      return wrapped.compareTo(required(context)) >= 0;
    }

    @Override
    public void execute(ProposalCreationContext context) {
      BigInteger amount = required(context);
      UnsignedChange change =
          executor.execute(
              () -> program.wrapNative(context.getAdmin().address(), amount),
              TaskContext.of("Program", "wrapNative", context.getAdmin().address()));
      submit(context, change);
    }

    private BigInteger required(ProposalCreationContext context) {
      return context.getQuoteAmount().add(properties.getProposal().getWrapBuffer());
    }

    @Override
    public String recoveryHint(ProposalCreationContext context) {
      return "check wrapped balance of " + context.getAdmin().address();
    }
  }

  private class LaunchStep implements WorkflowStep<ProposalCreationContext> {

    @Override
    public String name() {
      return LAUNCH;
    }

    @Override
    public boolean isAlreadyDone(ProposalCreationContext context) {
      return context.getProposal().status() == ProposalStatus.PENDING;
    }

    @Override
    public void checkPrecondition(ProposalCreationContext context) {
      if (context.getProposal().status() == ProposalStatus.RESOLVED) {
        throw new IdempotencyConflictException(
            "Proposal " + context.getProposalId() + " is already resolved");
      }
    }

    @Override
    public void execute(ProposalCreationContext context) {
      String address = context.getProposalAddress();
      UnsignedChange change =
          executor.execute(
              () ->
                  program.launchProposal(
                      context.getAdmin().address(),
                      address,
                      context.getBaseAmount(),
                      context.getQuoteAmount(),
                      context.getLookupTable()),
              TaskContext.of("Program", "launchProposal", address));
      submit(context, change);
      context.setProposal(
          watcher.await(address, "launched", p -> p.status() == ProposalStatus.PENDING));
    }

    @Override
    public String recoveryHint(ProposalCreationContext context) {
      return proposalHint(context);
    }
  }
}
