package combinator.futarchy.service.sequencer;

import combinator.futarchy.domain.ledger.LookupTableAccount;
import combinator.futarchy.domain.ledger.MintAccount;
import combinator.futarchy.domain.ledger.ModeratorAccount;
import combinator.futarchy.domain.ledger.OracleAccount;
import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.external.identity.IdentityService;
import combinator.futarchy.external.ledger.LedgerClient;
import combinator.futarchy.external.ledger.LedgerSeeds;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.global.executor.strategy.ExceptionTranslator;
import io.github.resilience4j.retry.Retry;
import java.math.BigInteger;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 재시도가 적용된 원장 읽기
 *
 * <p>읽기는 부수 효과가 없으므로 {@code ledgerReadRetry}로 한 번 더 시도합니다. 그래도 실패하면 {@code
 * LedgerTransientException}이 됩니다. "계정 없음"은 실패가 아니라 empty입니다.
 */
@Component
@RequiredArgsConstructor
public class LedgerReader {

  private final LedgerClient ledger;
  private final IdentityService identityService;
  private final Retry ledgerReadRetry;
  private final LogicExecutor executor;

  public Optional<ProposalAccount> proposal(String address) {
    return read("fetchProposal", address, () -> ledger.fetchProposal(address));
  }

  /** 모더레이터의 id번째 제안 */
  public Optional<ProposalAccount> proposal(String moderator, long proposalId) {
    return proposal(proposalAddress(moderator, proposalId));
  }

  public String proposalAddress(String moderator, long proposalId) {
    return LedgerSeeds.proposalAddress(ledger, moderator, proposalId);
  }

  public Optional<ModeratorAccount> moderator(String address) {
    return read("fetchModerator", address, () -> ledger.fetchModerator(address));
  }

  /** 모더레이터의 가장 최근 제안. 제안이 없거나 계정이 닫혔으면 empty */
  public Optional<ProposalAccount> latestProposal(ModeratorAccount moderator) {
    if (moderator.latestProposalId().isEmpty()) {
      return Optional.empty();
    }
    return proposal(moderator.address(), moderator.latestProposalId().getAsLong());
  }

  public Optional<MintAccount> mint(String address) {
    return read("fetchMint", address, () -> ledger.fetchMint(address));
  }

  public Optional<LookupTableAccount> lookupTable(String address) {
    return read("fetchLookupTable", address, () -> ledger.fetchLookupTable(address));
  }

  public Optional<OracleAccount> oracle(String poolAddress) {
    return read("fetchOracle", poolAddress, () -> ledger.fetchOracle(poolAddress));
  }

  public Optional<BigInteger> tokenBalance(String owner, String mint) {
    return read("tokenBalance", owner, () -> identityService.tokenBalance(owner, mint));
  }

  public BigInteger nativeBalance(String owner) {
    return read("nativeBalance", owner, () -> identityService.nativeBalance(owner));
  }

  private <T> T read(String operation, String target, Supplier<T> call) {
    Supplier<T> retrying = Retry.decorateSupplier(ledgerReadRetry, call);
    return executor.executeWithTranslation(
        retrying::get,
        ExceptionTranslator.forLedgerRead(),
        TaskContext.of("Ledger", operation, target));
  }
}
