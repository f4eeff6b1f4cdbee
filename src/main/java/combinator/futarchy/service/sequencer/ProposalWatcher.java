package combinator.futarchy.service.sequencer;

import combinator.futarchy.config.FutarchyProperties;
import combinator.futarchy.domain.proposal.ProposalAccount;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 확정된 제출이 제안 계정 조회에 보일 때까지 대기
 *
 * <p>원장은 방금 확정된 변경이 다음 조회에 바로 보인다고 보장하지 않으므로, 다음 단계의 빌드 전에 이 대기를 거칩니다.
 */
@Component
@RequiredArgsConstructor
public class ProposalWatcher {

  private final LedgerReader reader;
  private final BoundedPoller poller;
  private final FutarchyProperties properties;

  public ProposalAccount await(
      String proposalAddress, String description, Predicate<ProposalAccount> condition) {
    FutarchyProperties.Ledger ledger = properties.getLedger();
    return poller.pollUntil(
        "proposal " + proposalAddress + " " + description,
        ledger.getVisibilityPollInterval(),
        ledger.getVisibilityMaxWait(),
        () -> reader.proposal(proposalAddress).filter(condition));
  }
}
