package combinator.futarchy.external.ledger;

import combinator.futarchy.domain.ledger.ConfirmationStatus;
import combinator.futarchy.domain.ledger.LookupTableAccount;
import combinator.futarchy.domain.ledger.MintAccount;
import combinator.futarchy.domain.ledger.ModeratorAccount;
import combinator.futarchy.domain.ledger.OracleAccount;
import combinator.futarchy.domain.ledger.SignedChange;
import combinator.futarchy.domain.proposal.ProposalAccount;
import java.time.Duration;
import java.util.Optional;

/**
 * 원장 조회·제출 클라이언트
 *
 * <p>계정 조회는 "없음"을 예외가 아닌 {@link Optional#empty()}로 돌려줍니다 (닫힌 계정 포함). 통신 실패만 예외로 던집니다.
 */
public interface LedgerClient {

  Optional<ProposalAccount> fetchProposal(String address);

  Optional<ModeratorAccount> fetchModerator(String address);

  Optional<MintAccount> fetchMint(String address);

  Optional<LookupTableAccount> fetchLookupTable(String address);

  /** 옵션 풀의 오라클 타이머 */
  Optional<OracleAccount> fetchOracle(String poolAddress);

  /** @return 제출 id (서명) */
  String submit(SignedChange change);

  /** 확정 또는 실패가 관측될 때까지, 최대 timeout 동안 대기합니다. */
  ConfirmationStatus confirm(String submissionId, Duration timeout);

  /** 결정적 주소 파생 (네트워크 호출 없음) */
  String deriveAddress(String... seeds);
}
