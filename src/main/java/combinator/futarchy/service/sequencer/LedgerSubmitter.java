package combinator.futarchy.service.sequencer;

import combinator.futarchy.config.FutarchyProperties;
import combinator.futarchy.domain.ledger.AdminIdentity;
import combinator.futarchy.domain.ledger.ConfirmationStatus;
import combinator.futarchy.domain.ledger.SignedChange;
import combinator.futarchy.domain.ledger.UnsignedChange;
import combinator.futarchy.external.identity.IdentityService;
import combinator.futarchy.external.ledger.LedgerClient;
import combinator.futarchy.global.error.exception.ConfirmationTimeoutException;
import combinator.futarchy.global.error.exception.SubmissionFailedException;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.global.executor.strategy.ExceptionTranslator;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 서명 → 제출 → 확정 대기 한 바퀴
 *
 * <p>제출은 자동 재시도하지 않습니다. 확정을 관측하지 못한 제출이 실제로는 반영되었을 수 있으므로, 재시도 여부는 각 단계의 멱등성 검사가 판단합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerSubmitter {

  private final LedgerClient ledger;
  private final IdentityService identityService;
  private final LogicExecutor executor;
  private final FutarchyProperties properties;

  /** @return 확정된 제출 id */
  public String submit(AdminIdentity signer, UnsignedChange change) {
    return submitSigned(sign(signer, change));
  }

  /** signer 서명 후 cosigner 공동 서명까지 붙여 제출합니다. */
  public String submit(AdminIdentity signer, AdminIdentity cosigner, UnsignedChange change) {
    SignedChange signed = sign(signer, change);
    SignedChange cosigned =
        executor.execute(
            () -> identityService.cosign(cosigner, signed),
            TaskContext.of("Identity", "cosign", change.instruction()));
    return submitSigned(cosigned);
  }

  /** 순서대로 하나씩 제출·확정합니다. 앞 변경이 확정되기 전에는 다음 변경을 제출하지 않습니다. */
  public List<String> submitAll(AdminIdentity signer, List<UnsignedChange> changes) {
    List<String> submissionIds = new ArrayList<>(changes.size());
    for (UnsignedChange change : changes) {
      submissionIds.add(submit(signer, change));
    }
    return submissionIds;
  }

  public SignedChange sign(AdminIdentity signer, UnsignedChange change) {
    return executor.execute(
        () -> identityService.sign(signer, change),
        TaskContext.of("Identity", "sign", change.instruction()));
  }

  private String submitSigned(SignedChange signed) {
    String instruction = signed.instruction();
    String submissionId =
        executor.executeWithTranslation(
            () -> ledger.submit(signed),
            ExceptionTranslator.forSubmission(),
            TaskContext.of("Ledger", "submit", instruction));

    ConfirmationStatus status =
        executor.executeWithTranslation(
            () -> ledger.confirm(submissionId, properties.getLedger().getConfirmTimeout()),
            ExceptionTranslator.forLedgerRead(),
            TaskContext.of("Ledger", "confirm", submissionId));

    return switch (status) {
      case FINALIZED -> {
        log.info("📮 [Ledger] {} 확정: {}", instruction, submissionId);
        yield submissionId;
      }
      case FAILED -> throw new SubmissionFailedException(
          instruction + " rejected: " + submissionId);
      case TIMED_OUT -> throw new ConfirmationTimeoutException(
          instruction
              + " not confirmed within "
              + properties.getLedger().getConfirmTimeout().toSeconds()
              + "s: "
              + submissionId);
    };
  }
}
