package combinator.futarchy.service.organization;

import combinator.futarchy.config.FutarchyProperties;
import combinator.futarchy.domain.ledger.AdminIdentity;
import combinator.futarchy.domain.ledger.PoolState;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.domain.organization.OrganizationKind;
import combinator.futarchy.external.identity.IdentityService;
import combinator.futarchy.external.ledger.LedgerClient;
import combinator.futarchy.external.ledger.LedgerSeeds;
import combinator.futarchy.external.pool.PoolGatewayRegistry;
import combinator.futarchy.external.program.DecisionMarketProgram;
import combinator.futarchy.external.program.InitializeBranchRequest;
import combinator.futarchy.external.program.InitializeRootRequest;
import combinator.futarchy.external.program.OrganizationAccounts;
import combinator.futarchy.external.program.OrganizationBuild;
import combinator.futarchy.global.error.exception.DuplicateOrganizationNameException;
import combinator.futarchy.global.error.exception.InvalidInputException;
import combinator.futarchy.global.error.exception.NotOrganizationOwnerException;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.global.lock.LockKeys;
import combinator.futarchy.global.lock.LockStrategy;
import combinator.futarchy.repository.OrganizationRegistry;
import combinator.futarchy.service.sequencer.LedgerSubmitter;
import combinator.futarchy.service.sequencer.StepSequencer;
import combinator.futarchy.service.sequencer.WorkflowStep;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 루트·브랜치 조직 생성
 *
 * <p>두 흐름 모두 전역 생성 락({@link LockKeys#ORGANIZATION_CREATION}) 안에서 실행되며, 키 인덱스 할당과 이름 중복
 * 검사는 모든 생성 요청 사이에서 직렬화됩니다.
 *
 * <pre>
 * verify_name → allocate_identity → initialize_organization → derive_vaults → persist_organization
 * </pre>
 *
 * <p>저장 전에 실패한 생성을 같은 이름으로 다시 요청하면, 조직에 연결되지 않은 관리 키와 원장에 이미 있는 조직 계정을 찾아 금고 파생과 저장만
 * 이어서 실행합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrganizationCreationService {

  private static final String ROOT_KEY_PURPOSE = "organization_root";
  private static final String BRANCH_KEY_PURPOSE = "organization_branch";

  private final OrganizationRegistry registry;
  private final OrganizationResolver resolver;
  private final IdentityService identityService;
  private final DecisionMarketProgram program;
  private final LedgerClient ledger;
  private final LedgerSubmitter submitter;
  private final PoolGatewayRegistry gateways;
  private final StepSequencer sequencer;
  private final LockStrategy lockStrategy;
  private final LogicExecutor executor;
  private final FutarchyProperties properties;

  public OrganizationCreationResult createRoot(CreateOrganizationCommand command) {
    requireText(command.name(), "name");
    requireText(command.ownerWallet(), "ownerWallet");
    requireText(command.governanceMint(), "governanceMint");
    requireText(command.poolAddress(), "poolAddress");
    PoolState pool = detectPool(command.poolAddress(), command.governanceMint());

    return lockStrategy.executeWithLock(
        LockKeys.ORGANIZATION_CREATION,
        properties.getLock().getWaitTimeout(),
        () -> {
          OrganizationCreationContext context = new OrganizationCreationContext(command.name());
          run(
              context,
              ROOT_KEY_PURPOSE,
              c -> submitRoot(c, command, pool),
              c -> rootRow(c, command, pool),
              command.ownerWallet());
          return OrganizationCreationResult.of(context.getSaved(), context.getSubmissionId());
        });
  }

  public OrganizationCreationResult createBranch(CreateBranchCommand command) {
    requireText(command.name(), "name");
    requireText(command.ownerWallet(), "ownerWallet");
    requireText(command.governanceMint(), "governanceMint");
    requireText(command.parentAddress(), "parentAddress");

    Organization parent = resolver.byAddress(command.parentAddress());
    if (!parent.isRoot()) {
      throw new InvalidInputException("Parent organization must be a root: " + parent.name());
    }
    if (!parent.isOwnedBy(command.ownerWallet())) {
      throw new NotOrganizationOwnerException(parent.name(), command.ownerWallet());
    }
    AdminIdentity parentAdmin = resolver.adminOf(parent);

    return lockStrategy.executeWithLock(
        LockKeys.ORGANIZATION_CREATION,
        properties.getLock().getWaitTimeout(),
        () -> {
          OrganizationCreationContext context = new OrganizationCreationContext(command.name());
          run(
              context,
              BRANCH_KEY_PURPOSE,
              c -> submitBranch(c, command, parent, parentAdmin),
              c -> branchRow(c, command, parent),
              command.ownerWallet());
          return OrganizationCreationResult.of(context.getSaved(), context.getSubmissionId());
        });
  }

  private void run(
      OrganizationCreationContext context,
      String keyPurpose,
      Consumer<OrganizationCreationContext> initialize,
      Function<OrganizationCreationContext, Organization> row,
      String creator) {
    List<WorkflowStep<OrganizationCreationContext>> steps =
        List.of(
            WorkflowStep.of("verify_name", this::verifyName),
            new AllocateIdentityStep(keyPurpose),
            new InitializeOrganizationStep(initialize),
            WorkflowStep.of(
                "derive_vaults",
                this::deriveVaults,
                c ->
                    "organization "
                        + c.getAccounts().organizationAddress()
                        + " exists on the ledger"),
            WorkflowStep.of(
                "persist_organization",
                c -> persist(c, row.apply(c), creator),
                c ->
                    "organization "
                        + c.getAccounts().organizationAddress()
                        + " exists on the ledger without a registry row (key index "
                        + c.getKeyIndex()
                        + ")"));
    sequencer.run("createOrganization:" + context.getName(), context, steps);
  }

  private PoolState detectPool(String poolAddress, String governanceMint) {
    PoolState pool =
        executor
            .execute(
                () -> gateways.detect(poolAddress), TaskContext.of("Pool", "detect", poolAddress))
            .orElseThrow(
                () -> new InvalidInputException("Pool not found or unsupported: " + poolAddress));

    int minFee = properties.getOrganization().getMinPoolFeeBps();
    if (pool.feeBps() < minFee) {
      throw new InvalidInputException(
          "Pool fee " + pool.feeBps() + " bps is below the minimum of " + minFee + " bps");
    }
    if (!pool.holds(governanceMint)) {
      throw new InvalidInputException(
          "Token mint " + governanceMint + " is not one of the pool tokens of " + poolAddress);
    }
    return pool;
  }

  private void verifyName(OrganizationCreationContext context) {
    if (registry.findByName(context.getName()).isPresent()) {
      throw new DuplicateOrganizationNameException(context.getName());
    }
  }

  private void allocateIdentity(OrganizationCreationContext context, String purpose) {
    int keyIndex = registry.nextKeyIndex();
    AdminIdentity admin =
        executor.execute(
            () -> identityService.allocate(keyIndex),
            TaskContext.of("Identity", "allocate", Integer.toString(keyIndex)));
    registry.registerKey(keyIndex, admin.address(), purpose, context.getName());
    context.setKeyIndex(keyIndex);
    context.setAdmin(admin);
    log.info(
        "🔑 [Organization] {} 관리 지갑 할당: idx={}, {}",
        context.getName(),
        keyIndex,
        admin.address());
  }

  /** 이전 시도에서 등록만 되고 조직에 연결되지 못한 키를 다시 씁니다. */
  private boolean reuseUnboundKey(OrganizationCreationContext context, String purpose) {
    Optional<Integer> unbound = registry.findUnboundKey(purpose, context.getName());
    if (unbound.isEmpty()) {
      return false;
    }
    int keyIndex = unbound.get();
    AdminIdentity admin =
        executor.execute(
            () -> identityService.resolve(keyIndex),
            TaskContext.of("Identity", "resolve", Integer.toString(keyIndex)));
    context.setKeyIndex(keyIndex);
    context.setAdmin(admin);
    log.info(
        "♻️ [Organization] {} 미연결 관리 지갑 재사용: idx={}, {}",
        context.getName(),
        keyIndex,
        admin.address());
    return true;
  }

  private boolean findInitialized(OrganizationCreationContext context) {
    String admin = context.getAdmin().address();
    Optional<OrganizationAccounts> existing =
        executor.execute(
            () -> program.findOrganization(admin, context.getName()),
            TaskContext.of("Program", "findOrganization", context.getName()));
    existing.ifPresent(context::setAccounts);
    return existing.isPresent();
  }

  private void submitRoot(
      OrganizationCreationContext context, CreateOrganizationCommand command, PoolState pool) {
    InitializeRootRequest request =
        new InitializeRootRequest(
            context.getAdmin().address(),
            command.name(),
            command.governanceMint(),
            quoteMintOf(pool, command),
            command.treasuryCosigner(),
            pool.address(),
            pool.kind());
    OrganizationBuild build =
        executor.execute(
            () -> program.initializeRoot(request),
            TaskContext.of("Program", "initializeRoot", command.name()));
    context.setAccounts(build.accounts());
    context.setSubmissionId(submitter.submit(context.getAdmin(), build.change()));
  }

  private void submitBranch(
      OrganizationCreationContext context,
      CreateBranchCommand command,
      Organization parent,
      AdminIdentity parentAdmin) {
    InitializeBranchRequest request =
        new InitializeBranchRequest(
            context.getAdmin().address(),
            parentAdmin.address(),
            command.name(),
            parent.address(),
            command.governanceMint(),
            command.treasuryCosigner());
    OrganizationBuild build =
        executor.execute(
            () -> program.initializeBranch(request),
            TaskContext.of("Program", "initializeBranch", command.name()));
    context.setAccounts(build.accounts());
    context.setSubmissionId(submitter.submit(context.getAdmin(), parentAdmin, build.change()));
  }

  private void deriveVaults(OrganizationCreationContext context) {
    OrganizationAccounts accounts = context.getAccounts();
    context.setTreasuryVault(LedgerSeeds.vaultAddress(ledger, accounts.treasuryMultisig()));
    context.setMintAuthorityVault(LedgerSeeds.vaultAddress(ledger, accounts.mintMultisig()));
  }

  private Organization rootRow(
      OrganizationCreationContext context, CreateOrganizationCommand command, PoolState pool) {
    return baseRow(
            context, command.ownerWallet(), command.governanceMint(), command.treasuryCosigner())
        .kind(OrganizationKind.ROOT)
        .moderatorAddress(context.getAccounts().moderatorAddress())
        .poolAddress(pool.address())
        .poolKind(pool.kind())
        .quoteMint(quoteMintOf(pool, command))
        .build();
  }

  /** 모더레이터·풀·상대 자산은 부모 루트에서 복사합니다. */
  private Organization branchRow(
      OrganizationCreationContext context, CreateBranchCommand command, Organization parent) {
    return baseRow(
            context, command.ownerWallet(), command.governanceMint(), command.treasuryCosigner())
        .kind(OrganizationKind.BRANCH)
        .moderatorAddress(parent.moderatorAddress())
        .poolAddress(parent.poolAddress())
        .poolKind(parent.poolKind())
        .quoteMint(parent.quoteMint())
        .parentId(parent.id())
        .build();
  }

  private Organization.OrganizationBuilder baseRow(
      OrganizationCreationContext context, String owner, String governanceMint, String cosigner) {
    return Organization.builder()
        .address(context.getAccounts().organizationAddress())
        .name(context.getName())
        .ownerWallet(owner)
        .adminKeyIndex(context.getKeyIndex())
        .adminWallet(context.getAdmin().address())
        .governanceMint(governanceMint)
        .treasuryVault(context.getTreasuryVault())
        .mintAuthorityVault(context.getMintAuthorityVault())
        .treasuryCosigner(cosigner)
        .withdrawalPercentage(properties.getOrganization().getDefaultWithdrawalPercentage());
  }

  private void persist(OrganizationCreationContext context, Organization row, String creator) {
    Organization saved = registry.save(row);
    registry.bindKey(context.getKeyIndex(), saved.id());
    registry.addProposer(saved.id(), creator, creator);
    context.setSaved(saved);
    log.info(
        "🏛️ [Organization] {} 생성 완료 ({}, moderator={})",
        saved.label(),
        saved.kind(),
        saved.moderatorAddress());
  }

  private class AllocateIdentityStep implements WorkflowStep<OrganizationCreationContext> {

    private final String purpose;

    AllocateIdentityStep(String purpose) {
      this.purpose = purpose;
    }

    @Override
    public String name() {
      return "allocate_identity";
    }

    @Override
    public boolean isAlreadyDone(OrganizationCreationContext context) {
      return reuseUnboundKey(context, purpose);
    }

    @Override
    public void execute(OrganizationCreationContext context) {
      allocateIdentity(context, purpose);
    }
  }

  /** 같은 관리 지갑이 같은 이름으로 이미 초기화했다면 주소만 다시 읽고 제출하지 않습니다. */
  private class InitializeOrganizationStep implements WorkflowStep<OrganizationCreationContext> {

    private final Consumer<OrganizationCreationContext> initialize;

    InitializeOrganizationStep(Consumer<OrganizationCreationContext> initialize) {
      this.initialize = initialize;
    }

    @Override
    public String name() {
      return "initialize_organization";
    }

    @Override
    public boolean isAlreadyDone(OrganizationCreationContext context) {
      return findInitialized(context);
    }

    @Override
    public void execute(OrganizationCreationContext context) {
      initialize.accept(context);
    }

    @Override
    public String recoveryHint(OrganizationCreationContext context) {
      return "check whether admin "
          + context.getAdmin().address()
          + " already initialized "
          + context.getName();
    }
  }

  /** detectPool에서 거버넌스 자산이 풀에 있음을 확인했으므로 상대 자산은 항상 존재합니다. */
  private static String quoteMintOf(PoolState pool, CreateOrganizationCommand command) {
    return pool.counterpartOf(command.governanceMint()).orElseThrow();
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new InvalidInputException(field + " is required");
    }
  }
}
