package combinator.futarchy.support;

import combinator.futarchy.domain.ledger.ConfirmationStatus;
import combinator.futarchy.domain.ledger.LedgerAddresses;
import combinator.futarchy.domain.ledger.LookupTableAccount;
import combinator.futarchy.domain.ledger.MintAccount;
import combinator.futarchy.domain.ledger.ModeratorAccount;
import combinator.futarchy.domain.ledger.OracleAccount;
import combinator.futarchy.domain.ledger.SignedChange;
import combinator.futarchy.domain.ledger.UnsignedChange;
import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.domain.proposal.ProposalState;
import combinator.futarchy.external.ledger.LedgerClient;
import combinator.futarchy.external.ledger.LedgerSeeds;
import combinator.futarchy.external.program.DecisionMarketProgram;
import combinator.futarchy.external.program.InitializeBranchRequest;
import combinator.futarchy.external.program.InitializeRootRequest;
import combinator.futarchy.external.program.LookupTableBuild;
import combinator.futarchy.external.program.OrganizationAccounts;
import combinator.futarchy.external.program.OrganizationBuild;
import combinator.futarchy.external.program.ProposalParameters;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * 원장 + 의사결정 시장 프로그램 인메모리 구현
 *
 * <p>빌드한 변경마다 확정 시 적용할 효과를 기억해 두고, 제출되면 그 효과를 원장 상태에 반영합니다. 주소 파생은 시드를 "/"로 이어 붙입니다.
 */
public class FakeLedger implements LedgerClient, DecisionMarketProgram {

  /** 오라클 최소 기록 간격 (초) */
  public static final long ORACLE_INTERVAL_SECONDS = 60;

  private final Clock clock;
  private final FakeIdentityService identity;

  private final Map<String, ProposalAccount> proposals = new HashMap<>();
  private final Map<String, ModeratorAccount> moderators = new HashMap<>();
  private final Map<String, MintAccount> mints = new HashMap<>();
  private final Map<String, LookupTableAccount> lookupTables = new HashMap<>();
  private final Map<String, OracleAccount> oracles = new HashMap<>();
  private final Map<String, String> launchTables = new HashMap<>();
  private final Map<String, OrganizationAccounts> organizations = new HashMap<>();
  private final Map<String, String> organizationAdmins = new HashMap<>();
  private final Map<String, Runnable> effects = new HashMap<>();
  private final Map<String, ConfirmationStatus> confirmations = new HashMap<>();
  private final List<SignedChange> submitted = new ArrayList<>();
  private final Set<String> rejectedInstructions = new HashSet<>();
  private final Set<String> failingBuilds = new HashSet<>();
  private final Set<String> stalledInstructions = new HashSet<>();
  private final Map<String, SubmissionGate> gates = new ConcurrentHashMap<>();

  private int sequence;
  private int readFailures;
  private int winningIndex;
  private boolean emptyNextLookupTable;

  public FakeLedger(Clock clock, FakeIdentityService identity) {
    this.clock = clock;
    this.identity = identity;
  }

  // ===== LedgerClient =====

  @Override
  public synchronized Optional<ProposalAccount> fetchProposal(String address) {
    failReadIfScheduled();
    return Optional.ofNullable(proposals.get(address));
  }

  @Override
  public synchronized Optional<ModeratorAccount> fetchModerator(String address) {
    failReadIfScheduled();
    return Optional.ofNullable(moderators.get(address));
  }

  @Override
  public synchronized Optional<MintAccount> fetchMint(String address) {
    failReadIfScheduled();
    return Optional.ofNullable(mints.get(address));
  }

  @Override
  public synchronized Optional<LookupTableAccount> fetchLookupTable(String address) {
    failReadIfScheduled();
    return Optional.ofNullable(lookupTables.get(address));
  }

  @Override
  public synchronized Optional<OracleAccount> fetchOracle(String poolAddress) {
    failReadIfScheduled();
    return Optional.ofNullable(oracles.get(poolAddress));
  }

  @Override
  public String submit(SignedChange change) {
    SubmissionGate gate = gates.remove(change.instruction());
    if (gate != null) {
      gate.pass();
    }
    return record(change);
  }

  private synchronized String record(SignedChange change) {
    submitted.add(change);
    String submissionId = "sig-" + (++sequence);
    if (rejectedInstructions.contains(change.instruction())) {
      confirmations.put(submissionId, ConfirmationStatus.FAILED);
      return submissionId;
    }
    if (stalledInstructions.remove(change.instruction())) {
      return submissionId;
    }
    Runnable effect = effects.remove(key(change.change()));
    if (effect != null) {
      effect.run();
    }
    confirmations.put(submissionId, ConfirmationStatus.FINALIZED);
    return submissionId;
  }

  @Override
  public synchronized ConfirmationStatus confirm(String submissionId, Duration timeout) {
    return confirmations.getOrDefault(submissionId, ConfirmationStatus.TIMED_OUT);
  }

  @Override
  public String deriveAddress(String... seeds) {
    return String.join("/", seeds);
  }

  // ===== DecisionMarketProgram =====

  @Override
  public synchronized OrganizationBuild initializeRoot(InitializeRootRequest request) {
    String name = request.name();
    String moderator = "moderator-" + name;
    OrganizationAccounts accounts = organizationAccounts(name, moderator);
    UnsignedChange change =
        change(
            "initialize_root",
            request.admin(),
            () -> {
              moderators.put(moderator, new ModeratorAccount(moderator, 0));
              recordOrganization(request.admin(), name, accounts);
            });
    return organizationBuild(change, accounts);
  }

  @Override
  public synchronized OrganizationBuild initializeBranch(InitializeBranchRequest request) {
    String name = request.name();
    OrganizationAccounts accounts = organizationAccounts(name, null);
    UnsignedChange change =
        change(
            "initialize_branch",
            request.admin(),
            () -> recordOrganization(request.admin(), name, accounts));
    return organizationBuild(change, accounts);
  }

  @Override
  public synchronized Optional<OrganizationAccounts> findOrganization(String admin, String name) {
    if (!admin.equals(organizationAdmins.get(name))) {
      return Optional.empty();
    }
    return Optional.ofNullable(organizations.get(name));
  }

  @Override
  public synchronized LookupTableBuild createLookupTable(
      String payer, String moderator, long proposalId, int optionCount) {
    String proposal = LedgerSeeds.proposalAddress(this, moderator, proposalId);
    String table = "lookup-table-" + (sequence + 1) + "-" + proposalId;
    List<String> entries = new ArrayList<>(List.of(moderator, proposal));
    for (int option = 0; option < optionCount; option++) {
      entries.add(poolAddress(proposal, option));
    }
    if (emptyNextLookupTable) {
      emptyNextLookupTable = false;
      entries.clear();
    }
    UnsignedChange change =
        change(
            "create_lookup_table",
            payer,
            () -> lookupTables.put(table, new LookupTableAccount(table, entries)));
    return new LookupTableBuild(change, table);
  }

  @Override
  public synchronized UnsignedChange initializeProposal(
      String payer,
      String moderator,
      long proposalId,
      ProposalParameters parameters,
      String metadataRef) {
    failBuildIfScheduled("initialize_proposal");
    String address = LedgerSeeds.proposalAddress(this, moderator, proposalId);
    return change(
        "initialize_proposal",
        payer,
        () -> {
          proposals.put(
              address,
              new ProposalAccount(
                  address,
                  moderator,
                  proposalId,
                  2,
                  clock.instant().getEpochSecond(),
                  parameters.lengthSeconds(),
                  parameters.warmupSeconds(),
                  metadataRef,
                  List.of(poolAddress(address, 0), poolAddress(address, 1)),
                  ProposalState.setup()));
          moderators.computeIfPresent(
              moderator,
              (k, m) -> new ModeratorAccount(k, Math.max(m.proposalIdCounter(), proposalId + 1)));
        });
  }

  @Override
  public synchronized UnsignedChange addOption(String payer, String proposalAddress) {
    return change(
        "add_option",
        payer,
        () ->
            replace(
                proposalAddress,
                p -> {
                  List<String> pools = new ArrayList<>(p.pools());
                  pools.add(poolAddress(proposalAddress, p.numOptions()));
                  return new ProposalAccount(
                      p.address(),
                      p.moderatorAddress(),
                      p.proposalId(),
                      p.numOptions() + 1,
                      p.createdAt(),
                      p.lengthSeconds(),
                      p.warmupSeconds(),
                      p.metadataRef(),
                      pools,
                      p.state());
                }));
  }

  @Override
  public synchronized UnsignedChange wrapNative(String owner, BigInteger amount) {
    return change(
        "wrap_native", owner, () -> identity.credit(owner, LedgerAddresses.NATIVE_MINT, amount));
  }

  /** launch 시점부터 진행 기간과 오라클 워밍업이 시작됩니다. */
  @Override
  public synchronized UnsignedChange launchProposal(
      String payer,
      String proposalAddress,
      BigInteger baseAmount,
      BigInteger quoteAmount,
      String lookupTable) {
    failBuildIfScheduled("launch_proposal");
    LookupTableAccount table = lookupTables.get(lookupTable);
    if (table == null || !table.addresses().contains(proposalAddress)) {
      throw new IllegalStateException(
          "lookup table " + lookupTable + " does not cover " + proposalAddress);
    }
    launchTables.put(proposalAddress, lookupTable);
    return change(
        "launch_proposal",
        payer,
        () -> {
          long now = clock.instant().getEpochSecond();
          replace(
              proposalAddress,
              p -> {
                for (String pool : p.pools()) {
                  oracles.put(
                      pool,
                      new OracleAccount(
                          pool, now, p.warmupSeconds(), now, ORACLE_INTERVAL_SECONDS));
                }
                return new ProposalAccount(
                    p.address(),
                    p.moderatorAddress(),
                    p.proposalId(),
                    p.numOptions(),
                    now,
                    p.lengthSeconds(),
                    p.warmupSeconds(),
                    p.metadataRef(),
                    p.pools(),
                    ProposalState.pending());
              });
        });
  }

  @Override
  public synchronized UnsignedChange finalizeProposal(String payer, String proposalAddress) {
    int winner = winningIndex;
    return change(
        "finalize_proposal",
        payer,
        () -> replace(proposalAddress, p -> p.withState(ProposalState.resolved(winner))));
  }

  @Override
  public synchronized UnsignedChange redeemLiquidity(String payer, String proposalAddress) {
    return change("redeem_liquidity", payer, () -> {});
  }

  @Override
  public synchronized List<UnsignedChange> redeemLiquidityCompacted(
      String payer, String proposalAddress) {
    return List.of(
        compactedChange("redeem_liquidity_part_1", payer),
        compactedChange("redeem_liquidity_part_2", payer));
  }

  @Override
  public synchronized UnsignedChange crankOracles(String payer, List<String> poolAddresses) {
    List<String> pools = List.copyOf(poolAddresses);
    return change(
        "crank_oracles",
        payer,
        () -> {
          long now = clock.instant().getEpochSecond();
          for (String pool : pools) {
            OracleAccount o = oracles.get(pool);
            oracles.put(
                pool,
                new OracleAccount(
                    pool, o.createdAt(), o.warmupSeconds(), now, o.minRecordingIntervalSeconds()));
          }
        });
  }

  // ===== 시나리오 설정 / 검증 =====

  public synchronized void putProposal(ProposalAccount proposal) {
    proposals.put(proposal.address(), proposal);
  }

  public synchronized void removeProposal(String address) {
    proposals.remove(address);
  }

  public synchronized void removeModerator(String address) {
    moderators.remove(address);
  }

  public synchronized void putModerator(ModeratorAccount moderator) {
    moderators.put(moderator.address(), moderator);
  }

  public synchronized void putMint(MintAccount mint) {
    mints.put(mint.address(), mint);
  }

  public synchronized void putOracle(OracleAccount oracle) {
    oracles.put(oracle.poolAddress(), oracle);
  }

  /** 다음 n번의 조회를 통신 오류로 실패시킵니다. */
  public synchronized void failNextReads(int count) {
    this.readFailures = count;
  }

  /** 해당 작업의 제출을 원장이 거부(FAILED)하게 합니다. */
  public synchronized void rejectInstruction(String instruction) {
    rejectedInstructions.add(instruction);
  }

  /** 해당 작업의 빌드가 한 번 예외를 던지게 합니다. */
  public synchronized void failNextBuild(String instruction) {
    failingBuilds.add(instruction);
  }

  /** 해당 작업의 다음 제출이 확정되지 않게 합니다 (효과 미적용, TIMED_OUT). */
  public synchronized void stallNextConfirmation(String instruction) {
    stalledInstructions.add(instruction);
  }

  /** 해당 작업의 다음 제출을 {@link SubmissionGate#release()} 전까지 붙잡아 둡니다. 원장 모니터는 잡지 않습니다. */
  public SubmissionGate holdNextSubmission(String instruction) {
    SubmissionGate gate = new SubmissionGate();
    gates.put(instruction, gate);
    return gate;
  }

  /** 다음 주소 압축 테이블이 주소를 채우지 못한 채 남게 합니다. */
  public synchronized void leaveNextLookupTableEmpty() {
    emptyNextLookupTable = true;
  }

  /** launch 변경을 빌드할 때 참조한 주소 압축 테이블 */
  public synchronized Optional<LookupTableAccount> lookupTableUsedBy(String proposalAddress) {
    return Optional.ofNullable(launchTables.get(proposalAddress)).map(lookupTables::get);
  }

  public synchronized void setWinningIndex(int winningIndex) {
    this.winningIndex = winningIndex;
  }

  public synchronized List<String> submittedInstructions() {
    return submitted.stream().map(SignedChange::instruction).toList();
  }

  public synchronized List<SignedChange> submitted() {
    return List.copyOf(submitted);
  }

  public synchronized long count(String instruction) {
    return submitted.stream().filter(s -> s.instruction().equals(instruction)).count();
  }

  public static String poolAddress(String proposalAddress, int option) {
    return proposalAddress + "/pool-" + option;
  }

  private void failReadIfScheduled() {
    if (readFailures > 0) {
      readFailures--;
      throw new IllegalStateException("ledger endpoint unavailable");
    }
  }

  private void failBuildIfScheduled(String instruction) {
    if (failingBuilds.remove(instruction)) {
      throw new IllegalStateException(instruction + " build failed");
    }
  }

  private void replace(String address, UnaryOperator<ProposalAccount> update) {
    ProposalAccount current = proposals.get(address);
    if (current == null) {
      throw new IllegalStateException("no proposal at " + address);
    }
    proposals.put(address, update.apply(current));
  }

  private UnsignedChange change(String instruction, String payer, Runnable effect) {
    UnsignedChange change =
        new UnsignedChange(
            instruction,
            payer,
            (instruction + "#" + (++sequence)).getBytes(StandardCharsets.UTF_8),
            false);
    effects.put(key(change), effect);
    return change;
  }

  private UnsignedChange compactedChange(String instruction, String payer) {
    return new UnsignedChange(
        instruction,
        payer,
        (instruction + "#" + (++sequence)).getBytes(StandardCharsets.UTF_8),
        true);
  }

  private static String key(UnsignedChange change) {
    return new String(change.payload(), StandardCharsets.UTF_8);
  }

  private static OrganizationAccounts organizationAccounts(String name, String moderator) {
    return new OrganizationAccounts(
        "org-" + name, moderator, "treasury-ms-" + name, "mint-ms-" + name);
  }

  private static OrganizationBuild organizationBuild(
      UnsignedChange change, OrganizationAccounts accounts) {
    return new OrganizationBuild(
        change,
        accounts.organizationAddress(),
        accounts.moderatorAddress(),
        accounts.treasuryMultisig(),
        accounts.mintMultisig());
  }

  private void recordOrganization(String admin, String name, OrganizationAccounts accounts) {
    organizations.put(name, accounts);
    organizationAdmins.put(name, admin);
  }

  /** 제출 스레드를 멈춰 세우는 관문 */
  public static final class SubmissionGate {

    private final CountDownLatch arrived = new CountDownLatch(1);
    private final CountDownLatch released = new CountDownLatch(1);

    public boolean arrived() {
      return arrived.getCount() == 0;
    }

    public void release() {
      released.countDown();
    }

    private void pass() {
      arrived.countDown();
      try {
        if (!released.await(10, TimeUnit.SECONDS)) {
          throw new IllegalStateException("submission gate was never released");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("submission gate interrupted", e);
      }
    }
  }
}
