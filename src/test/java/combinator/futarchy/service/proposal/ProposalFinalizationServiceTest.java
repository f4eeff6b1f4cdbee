package combinator.futarchy.service.proposal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import combinator.futarchy.domain.ledger.ModeratorAccount;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.domain.proposal.ProposalStatus;
import combinator.futarchy.global.cache.CacheKeys;
import combinator.futarchy.global.error.exception.InvalidProposalStateException;
import combinator.futarchy.global.error.exception.ProposalNotEndedException;
import combinator.futarchy.global.error.exception.ProposalNotFoundException;
import combinator.futarchy.global.lock.LockKeys;
import combinator.futarchy.service.liquidity.RedemptionResult;
import combinator.futarchy.support.FakeLedger.SubmissionGate;
import combinator.futarchy.support.FutarchyFixture;
import combinator.futarchy.support.ProposalFixtures;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProposalFinalizationService 테스트")
class ProposalFinalizationServiceTest {

  private FutarchyFixture fixture;
  private ProposalFinalizationService service;
  private String proposalAddress;
  private ExecutorService pool;

  @BeforeEach
  void setUp() {
    pool = Executors.newFixedThreadPool(3);
    fixture = new FutarchyFixture();
    service = fixture.finalization;
    Organization root = fixture.createReadyRoot("ACME");
    proposalAddress =
        fixture
            .proposalCreation
            .createProposal(fixture.proposalCommand(root, List.of("No", "Yes")))
            .proposalAddress();
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  @DisplayName("종료 시각 전에는 남은 시간과 함께 거부한다")
  void rejectsBeforeEnd() {
    fixture.clock.advance(Duration.ofSeconds(3_599));

    assertThatThrownBy(() -> service.finalizeProposal(proposalAddress))
        .isInstanceOf(ProposalNotEndedException.class)
        .hasMessageContaining("남은 시간: 1초");
    assertThat(fixture.ledger.count("finalize_proposal")).isZero();
  }

  @Test
  @DisplayName("종료 시각이 지나면 제출하고 승리 옵션을 돌려준다")
  void finalizesAfterEnd() {
    // given
    fixture.ledger.setWinningIndex(1);
    fixture.cache.set(CacheKeys.ALL_PROPOSALS, "stale");
    fixture.clock.advance(Duration.ofSeconds(3_600));

    // when
    FinalizationResult result = service.finalizeProposal(proposalAddress);

    // then
    assertThat(result.winningIndex()).isEqualTo(1);
    assertThat(result.alreadyFinalized()).isFalse();
    assertThat(result.submissionId()).isNotNull();
    assertThat(fixture.reader.proposal(proposalAddress).orElseThrow().status())
        .isEqualTo(ProposalStatus.RESOLVED);
    assertThat(fixture.cache.get(CacheKeys.ALL_PROPOSALS, String.class)).isEmpty();
  }

  @Test
  @DisplayName("이미 종료된 제안은 다시 제출하지 않고 같은 결과를 돌려준다")
  void idempotentWhenResolved() {
    // given
    fixture.clock.advance(Duration.ofHours(2));
    FinalizationResult first = service.finalizeProposal(proposalAddress);

    // when
    FinalizationResult second = service.finalizeProposal(proposalAddress);

    // then
    assertThat(second.alreadyFinalized()).isTrue();
    assertThat(second.winningIndex()).isEqualTo(first.winningIndex());
    assertThat(second.submissionId()).isNull();
    assertThat(fixture.ledger.count("finalize_proposal")).isEqualTo(1);
  }

  @Test
  @DisplayName("SETUP 제안은 종료할 수 없다")
  void rejectsSetup() {
    fixture.ledger.putModerator(new ModeratorAccount(ProposalFixtures.MODERATOR, 1));
    fixture.ledger.putProposal(ProposalFixtures.setup(0, fixture.clock.epochSecond()));

    assertThatThrownBy(() -> service.finalizeProposal("proposal/moderator-ACME/0"))
        .isInstanceOf(InvalidProposalStateException.class)
        .hasMessageContaining("still in setup");
  }

  @Test
  @DisplayName("없는 제안은 ProposalNotFoundException")
  void missingProposal() {
    assertThatThrownBy(() -> service.finalizeProposal("proposal/moderator-ACME/9"))
        .isInstanceOf(ProposalNotFoundException.class);
  }

  @Test
  @DisplayName("종료 후에는 같은 조직에 새 제안을 만들 수 있다")
  void unblocksNextProposal() {
    fixture.clock.advance(Duration.ofSeconds(3_600));
    service.finalizeProposal(proposalAddress);
    Organization root = fixture.registry.findByName("ACME").orElseThrow();

    assertThat(
            fixture.proposalCreation.checkReadiness(root.address(), FutarchyFixture.OWNER).ready())
        .isTrue();
  }

  @Test
  @DisplayName("같은 제안의 종료와 회수는 한 번에 하나씩, 도착 순서대로 실행된다")
  void finalizeAndRedeemSerializeInArrivalOrder() throws Exception {
    // given: 첫 종료 요청이 제출 직전에 멈춘 채 제안 락을 보유
    fixture.clock.advance(Duration.ofSeconds(3_600));
    String lockKey = LockKeys.proposal(proposalAddress);
    SubmissionGate finalizeGate = fixture.ledger.holdNextSubmission("finalize_proposal");
    Future<FinalizationResult> first = pool.submit(() -> service.finalizeProposal(proposalAddress));
    await().atMost(Duration.ofSeconds(2)).until(finalizeGate::arrived);

    // 회수 요청이 먼저, 두 번째 종료 요청이 나중에 대기열에 도착
    SubmissionGate redeemGate = fixture.ledger.holdNextSubmission("redeem_liquidity");
    Future<RedemptionResult> redeem =
        submitQueued(() -> fixture.redemption.redeemLiquidity(proposalAddress));
    Future<FinalizationResult> second =
        submitQueued(() -> service.finalizeProposal(proposalAddress));

    // then: 보유자는 하나뿐이다
    assertThat(fixture.lockStrategy.isLocked(lockKey)).isTrue();
    assertThat(redeem).isNotDone();
    assertThat(second).isNotDone();
    assertThat(fixture.ledger.count("redeem_liquidity")).isZero();

    // when: 종료가 끝나면 먼저 도착한 회수가 락을 얻는다
    finalizeGate.release();
    assertThat(first.get(5, TimeUnit.SECONDS).alreadyFinalized()).isFalse();
    await().atMost(Duration.ofSeconds(2)).until(redeemGate::arrived);
    assertThat(second).isNotDone();

    redeemGate.release();

    // then
    assertThat(redeem.get(5, TimeUnit.SECONDS).submissionIds()).hasSize(1);
    assertThat(second.get(5, TimeUnit.SECONDS).alreadyFinalized()).isTrue();
    assertThat(fixture.ledger.submittedInstructions())
        .endsWith("finalize_proposal", "redeem_liquidity");
    assertThat(fixture.ledger.count("finalize_proposal")).isEqualTo(1);
    assertThat(fixture.lockStrategy.activeLockCount()).isZero();
  }

  /** 작업 스레드가 제안 락 앞에서 대기하기 시작할 때까지 기다린 뒤 돌려줍니다. */
  private <T> Future<T> submitQueued(Callable<T> task) {
    AtomicReference<Thread> worker = new AtomicReference<>();
    Future<T> future =
        pool.submit(
            () -> {
              worker.set(Thread.currentThread());
              return task.call();
            });
    await()
        .atMost(Duration.ofSeconds(2))
        .until(
            () ->
                worker.get() != null
                    && worker.get().getState() == Thread.State.TIMED_WAITING);
    return future;
  }
}
