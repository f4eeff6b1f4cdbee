package combinator.futarchy.service.oracle;

import combinator.futarchy.domain.ledger.AdminIdentity;
import combinator.futarchy.domain.ledger.LedgerAddresses;
import combinator.futarchy.domain.ledger.OracleAccount;
import combinator.futarchy.domain.ledger.UnsignedChange;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.external.program.DecisionMarketProgram;
import combinator.futarchy.global.error.exception.ProposalNotFoundException;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.service.organization.OrganizationResolver;
import combinator.futarchy.service.sequencer.LedgerReader;
import combinator.futarchy.service.sequencer.LedgerSubmitter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 옵션 풀 가격 오라클 기록 (누구나 호출 가능, 락 없음)
 *
 * <p>모든 대상 풀을 같은 시점에 기록하도록 하나의 변경으로 묶어 제출합니다. 워밍업이나 최소 기록 간격을 채우지 못한 풀은 남은 시간과 함께
 * 건너뜀으로 보고하며 오류로 취급하지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OracleCrankService {

  private final LedgerReader reader;
  private final LedgerSubmitter submitter;
  private final OrganizationResolver resolver;
  private final DecisionMarketProgram program;
  private final LogicExecutor executor;
  private final Clock clock;

  public CrankResult crankOracle(String proposalAddress) {
    ProposalAccount proposal =
        reader
            .proposal(proposalAddress)
            .orElseThrow(() -> new ProposalNotFoundException(proposalAddress));
    Organization root = resolver.rootForModerator(proposal.moderatorAddress());
    AdminIdentity admin = resolver.adminOf(root);
    long now = clock.instant().getEpochSecond();

    List<PoolCrankOutcome> outcomes = new ArrayList<>();
    List<String> eligible = new ArrayList<>();
    for (String pool : validPools(proposal)) {
      Optional<PoolCrankOutcome> ineligible =
          executor.executeOrCatch(
              () -> eligibility(pool, now),
              e -> Optional.of(PoolCrankOutcome.error(pool, "error: " + e.getMessage())),
              TaskContext.of("Oracle", "eligibility", pool));
      if (ineligible.isPresent()) {
        outcomes.add(ineligible.get());
      } else {
        eligible.add(pool);
      }
    }

    String submissionId = null;
    if (!eligible.isEmpty()) {
      Optional<String> submitted =
          executor.executeOrCatch(
              () -> Optional.of(submitBatch(admin, eligible)),
              e -> {
                for (String pool : eligible) {
                  outcomes.add(PoolCrankOutcome.error(pool, "batch error: " + e.getMessage()));
                }
                return Optional.empty();
              },
              TaskContext.of("Oracle", "crankBatch", proposalAddress));
      if (submitted.isPresent()) {
        submissionId = submitted.get();
        for (String pool : eligible) {
          outcomes.add(PoolCrankOutcome.cranked(pool, submitted.get()));
        }
      }
    }

    log.info(
        "📈 [Oracle] {} 크랭크: 대상 {}개 중 {}개 기록",
        proposalAddress,
        outcomes.size(),
        submissionId == null ? 0 : eligible.size());
    return new CrankResult(
        proposalAddress, root.address(), proposal.numOptions(), submissionId, outcomes);
  }

  /** 옵션 수만큼의 풀 중 기본 주소(빈 칸)를 제외한 풀 */
  static List<String> validPools(ProposalAccount proposal) {
    return proposal.pools().stream()
        .limit(proposal.numOptions())
        .filter(pool -> !LedgerAddresses.isDefault(pool))
        .toList();
  }

  /** @return 건너뛸 사유. 기록 가능하면 empty */
  private Optional<PoolCrankOutcome> eligibility(String pool, long now) {
    Optional<OracleAccount> found = reader.oracle(pool);
    if (found.isEmpty()) {
      return Optional.of(PoolCrankOutcome.error(pool, "error: oracle account not found"));
    }
    OracleAccount oracle = found.get();
    if (now < oracle.warmupEndsAt()) {
      return Optional.of(
          PoolCrankOutcome.skipped(
              pool, "Warmup period: " + (oracle.warmupEndsAt() - now) + "s remaining"));
    }
    long sinceLastUpdate = now - oracle.lastUpdate();
    if (sinceLastUpdate < oracle.minRecordingIntervalSeconds()) {
      long wait = oracle.minRecordingIntervalSeconds() - sinceLastUpdate;
      return Optional.of(
          PoolCrankOutcome.skipped(
              pool,
              "Rate limited: "
                  + wait
                  + "s until next crank (interval: "
                  + oracle.minRecordingIntervalSeconds()
                  + "s)"));
    }
    return Optional.empty();
  }

  private String submitBatch(AdminIdentity admin, List<String> pools) {
    UnsignedChange change = program.crankOracles(admin.address(), pools);
    return submitter.submit(admin, change);
  }
}
