package combinator.futarchy.service.proposal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import combinator.futarchy.domain.ledger.LedgerAddresses;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.domain.proposal.ProposalMetadata;
import combinator.futarchy.domain.proposal.ProposalStatus;
import combinator.futarchy.global.cache.CacheKeys;
import combinator.futarchy.global.error.exception.ConfirmationTimeoutException;
import combinator.futarchy.global.error.exception.IdempotencyConflictException;
import combinator.futarchy.global.error.exception.InvalidInputException;
import combinator.futarchy.global.error.exception.InvalidProposalStateException;
import combinator.futarchy.global.error.exception.ReadinessCheckFailedException;
import combinator.futarchy.global.lock.LockKeys;
import combinator.futarchy.support.FutarchyFixture;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ProposalCreationService 테스트")
class ProposalCreationServiceTest {

  private FutarchyFixture fixture;
  private ProposalCreationService service;
  private Organization root;

  @BeforeEach
  void setUp() {
    fixture = new FutarchyFixture();
    service = fixture.proposalCreation;
    root = fixture.createReadyRoot("ACME");
  }

  @Nested
  @DisplayName("새 제안 생성")
  class Create {

    @Test
    @DisplayName("두 옵션 제안은 옵션 추가 없이 initialize → wrap → launch 순으로 제출된다")
    void createsTwoOptionProposal() {
      // when
      ProposalCreationResult result =
          service.createProposal(fixture.proposalCommand(root, List.of("No", "Yes")));

      // then
      assertThat(result.proposalId()).isZero();
      assertThat(result.proposalAddress()).isEqualTo("proposal/moderator-ACME/0");
      assertThat(result.status()).isEqualTo(ProposalStatus.PENDING);
      assertThat(result.resumedSteps()).isEmpty();
      assertThat(fixture.ledger.submittedInstructions())
          .containsExactly(
              "initialize_root",
              "create_lookup_table",
              "initialize_proposal",
              "wrap_native",
              "launch_proposal");
      assertThat(fixture.damm.withdrawCalls()).isEqualTo(1);

      ProposalAccount proposal =
          fixture.reader.proposal(result.proposalAddress()).orElseThrow();
      assertThat(proposal.status()).isEqualTo(ProposalStatus.PENDING);
      assertThat(proposal.numOptions()).isEqualTo(2);
      assertThat(proposal.lengthSeconds()).isEqualTo(3600);
      assertThat(proposal.warmupSeconds()).isEqualTo(300);
    }

    @Test
    @DisplayName("두 개를 넘는 옵션은 initialize 이후 하나씩 추가한다")
    void addsExtraOptions() {
      ProposalCreationResult result =
          service.createProposal(fixture.proposalCommand(root, List.of("No", "Yes", "Later")));

      assertThat(fixture.ledger.count("add_option")).isEqualTo(1);
      assertThat(fixture.reader.proposal(result.proposalAddress()).orElseThrow().numOptions())
          .isEqualTo(3);
    }

    @Test
    @DisplayName("출금한 상대 자산 + 여유분만큼 래핑한다")
    void wrapsQuoteWithBuffer() {
      service.createProposal(fixture.proposalCommand(root, List.of("No", "Yes")));

      assertThat(fixture.identity.tokenBalance(root.adminWallet(), LedgerAddresses.NATIVE_MINT))
          .contains(BigInteger.valueOf(2_000_010_000L));
    }

    @Test
    @DisplayName("이미 충분히 래핑되어 있으면 래핑 단계를 건너뛴다")
    void skipsWrapWhenFunded() {
      fixture.identity.setTokenBalance(
          root.adminWallet(), LedgerAddresses.NATIVE_MINT, 3_000_000_000L);

      ProposalCreationResult result =
          service.createProposal(fixture.proposalCommand(root, List.of("No", "Yes")));

      assertThat(fixture.ledger.count("wrap_native")).isZero();
      assertThat(result.resumedSteps()).containsExactly("wrap_native");
    }

    @Test
    @DisplayName("메타데이터는 조직 주소와 함께 게시되고 제안이 그 참조를 가진다")
    void publishesMetadata() {
      ProposalCreationResult result =
          service.createProposal(fixture.proposalCommand(root, List.of("No", "Yes")));

      ProposalMetadata metadata =
          fixture.codec.decode(
              fixture.metadataStore.fetch(result.metadataRef()).orElseThrow(),
              result.metadataRef());
      assertThat(metadata.organizationAddress()).isEqualTo(root.address());
      assertThat(metadata.options()).containsExactly("No", "Yes");
      assertThat(fixture.reader.proposal(result.proposalAddress()).orElseThrow().metadataRef())
          .isEqualTo(result.metadataRef());
    }

    @Test
    @DisplayName("진행 중인 제안이 있으면 active_proposal 검사에서 거부되고 출금하지 않는다")
    void rejectsWhileActive() {
      // given
      service.createProposal(fixture.proposalCommand(root, List.of("No", "Yes")));

      // when & then
      assertThatThrownBy(
              () -> service.createProposal(fixture.proposalCommand(root, List.of("A", "B"))))
          .isInstanceOf(ReadinessCheckFailedException.class)
          .hasMessageContaining("~1h remaining")
          .extracting("check")
          .isEqualTo("active_proposal");
      assertThat(fixture.damm.withdrawCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("집계된 제안 수가 캐시에 있으면 1 증가시킨다")
    void incrementsCachedCount() {
      // given
      fixture.cache.set(CacheKeys.proposalCount(root.address()), 4L);

      // when
      service.createProposal(fixture.proposalCommand(root, List.of("No", "Yes")));

      // then
      assertThat(fixture.cache.get(CacheKeys.proposalCount(root.address()), Long.class))
          .contains(5L);
    }

    @Test
    @DisplayName("집계된 적 없는 제안 수는 추정값으로 채우지 않는다")
    void doesNotSeedCount() {
      service.createProposal(fixture.proposalCommand(root, List.of("No", "Yes")));

      assertThat(fixture.cache.get(CacheKeys.proposalCount(root.address()), Long.class))
          .isEqualTo(Optional.empty());
    }
  }

  @Nested
  @DisplayName("입력 검증")
  class Validation {

    @ParameterizedTest
    @ValueSource(ints = {1, 7})
    @DisplayName("옵션은 2~6개")
    void optionCount(int count) {
      List<String> options =
          IntStream.range(0, count).mapToObj(i -> "option-" + i).toList();

      assertThatThrownBy(() -> service.createProposal(fixture.proposalCommand(root, options)))
          .isInstanceOf(InvalidInputException.class)
          .hasMessageContaining("between 2 and 6 options");
    }

    @Test
    @DisplayName("빈 옵션 이름은 거부한다")
    void blankOption() {
      assertThatThrownBy(
              () -> service.createProposal(fixture.proposalCommand(root, List.of("No", " "))))
          .isInstanceOf(InvalidInputException.class)
          .hasMessageContaining("Option names must not be blank");
    }

    @Test
    @DisplayName("워밍업은 진행 기간의 80%를 넘을 수 없다")
    void warmupTooLong() {
      CreateProposalCommand command =
          new CreateProposalCommand(
              root.address(), FutarchyFixture.OWNER, "t", "d", List.of("No", "Yes"), 3600, 2881);

      assertThatThrownBy(() -> service.createProposal(command))
          .isInstanceOf(InvalidInputException.class)
          .hasMessageContaining("between 1 and 2880");
    }

    @Test
    @DisplayName("소유자가 아닌 제안자는 1일 미만 제안을 만들 수 없다")
    void proposerLengthBounds() {
      CreateProposalCommand command =
          new CreateProposalCommand(
              root.address(), "proposer", "t", "d", List.of("No", "Yes"), 3600, 300);

      assertThatThrownBy(() -> service.createProposal(command))
          .isInstanceOf(InvalidInputException.class)
          .hasMessage("잘못된 입력값입니다: Proposal length must be between 86400 and 345600 seconds");
    }

    @Test
    @DisplayName("소유자도 1분 미만 제안은 만들 수 없다")
    void ownerLengthBounds() {
      CreateProposalCommand command =
          new CreateProposalCommand(
              root.address(), FutarchyFixture.OWNER, "t", "d", List.of("No", "Yes"), 59, 10);

      assertThatThrownBy(() -> service.createProposal(command))
          .isInstanceOf(InvalidInputException.class)
          .hasMessageContaining("between 60 and 604800 seconds");
    }
  }

  @Nested
  @DisplayName("중단된 제안 이어서 만들기")
  class Resume {

    @Test
    @DisplayName("launch 직전에 실패한 제안은 initialize를 다시 제출하지 않고 완성된다")
    void resumesAfterLaunchFailure() {
      // given
      CreateProposalCommand command = fixture.proposalCommand(root, List.of("No", "Yes"));
      fixture.ledger.failNextBuild("launch_proposal");
      assertThatThrownBy(() -> service.createProposal(command)).isNotNull();
      assertThat(fixture.reader.proposal("proposal/moderator-ACME/0").orElseThrow().status())
          .isEqualTo(ProposalStatus.SETUP);

      // when
      ProposalCreationResult result = service.resumeProposal(command);

      // then
      assertThat(result.proposalId()).isZero();
      assertThat(result.status()).isEqualTo(ProposalStatus.PENDING);
      assertThat(result.resumedSteps()).contains("initialize_proposal", "wrap_native");
      assertThat(fixture.ledger.count("initialize_proposal")).isEqualTo(1);
      assertThat(fixture.ledger.count("launch_proposal")).isEqualTo(1);
    }

    @Test
    @DisplayName("이어서 만들 때 주소 압축 테이블은 카운터가 아니라 이어받은 제안 id로 만든다")
    void resumedLookupTableBelongsToSetupProposal() {
      // given
      CreateProposalCommand command = fixture.proposalCommand(root, List.of("No", "Yes"));
      fixture.ledger.failNextBuild("launch_proposal");
      assertThatThrownBy(() -> service.createProposal(command)).isNotNull();
      assertThat(fixture.reader.moderator("moderator-ACME").orElseThrow().proposalIdCounter())
          .isEqualTo(1);

      // when
      service.resumeProposal(command);

      // then
      assertThat(fixture.ledger.count("create_lookup_table")).isEqualTo(2);
      assertThat(fixture.ledger.lookupTableUsedBy("proposal/moderator-ACME/0"))
          .hasValueSatisfying(
              table ->
                  assertThat(table.addresses())
                      .contains("proposal/moderator-ACME/0")
                      .doesNotContain("proposal/moderator-ACME/1"));
    }

    @Test
    @DisplayName("실패한 생성은 제안 수를 올리지 않고, 이어서 launch할 때 한 번 올린다")
    void countsProposalOnceWhenLaunched() {
      // given
      CreateProposalCommand command = fixture.proposalCommand(root, List.of("No", "Yes"));
      fixture.cache.set(CacheKeys.proposalCount(root.address()), 4L);
      fixture.ledger.failNextBuild("launch_proposal");
      assertThatThrownBy(() -> service.createProposal(command)).isNotNull();
      assertThat(fixture.cache.get(CacheKeys.proposalCount(root.address()), Long.class))
          .contains(4L);

      // when
      service.resumeProposal(command);

      // then
      assertThat(fixture.cache.get(CacheKeys.proposalCount(root.address()), Long.class))
          .contains(5L);
    }

    @Test
    @DisplayName("SETUP 제안이 있으면 새 제안 생성은 거부된다")
    void setupBlocksNewProposal() {
      // given
      fixture.ledger.failNextBuild("launch_proposal");
      CreateProposalCommand command = fixture.proposalCommand(root, List.of("No", "Yes"));
      assertThatThrownBy(() -> service.createProposal(command)).isNotNull();

      // when & then
      assertThatThrownBy(() -> service.createProposal(command))
          .isInstanceOf(ReadinessCheckFailedException.class)
          .hasMessageContaining("is still in setup");
    }

    @Test
    @DisplayName("다른 메타데이터로 이어서 만들면 출금 전에 충돌로 거부한다")
    void rejectsDifferentMetadata() {
      // given
      fixture.ledger.failNextBuild("launch_proposal");
      assertThatThrownBy(
              () -> service.createProposal(fixture.proposalCommand(root, List.of("No", "Yes"))))
          .isNotNull();

      // when & then
      assertThatThrownBy(
              () -> service.resumeProposal(fixture.proposalCommand(root, List.of("A", "B"))))
          .isInstanceOf(IdempotencyConflictException.class);
      assertThat(fixture.damm.withdrawCalls()).isEqualTo(1);
      assertThat(fixture.ledger.count("launch_proposal")).isZero();
    }

    @Test
    @DisplayName("이어서 만들 SETUP 제안이 없으면 거부한다")
    void nothingToResume() {
      assertThatThrownBy(
              () -> service.resumeProposal(fixture.proposalCommand(root, List.of("No", "Yes"))))
          .isInstanceOf(InvalidProposalStateException.class);
    }
  }

  @Nested
  @DisplayName("확정 지연")
  class Timeout {

    @Test
    @DisplayName("주소 압축 테이블 제출이 확정되지 않으면 타임아웃으로 끝나고 모더레이터 락을 놓는다")
    void lookupTableConfirmationTimeout() throws Exception {
      // given
      CreateProposalCommand command = fixture.proposalCommand(root, List.of("No", "Yes"));
      fixture.ledger.stallNextConfirmation("create_lookup_table");

      // when & then
      assertThatThrownBy(() -> service.createProposal(command))
          .isInstanceOf(ConfirmationTimeoutException.class)
          .hasMessageContaining("create_lookup_table not confirmed");
      assertThat(fixture.lockStrategy.isLocked(LockKeys.moderator(root.moderatorAddress())))
          .isFalse();
      assertThat(fixture.lockStrategy.activeLockCount()).isZero();
      assertThat(fixture.ledger.count("initialize_proposal")).isZero();

      // 다른 스레드에서도 같은 모더레이터로 바로 생성할 수 있다
      ProposalCreationResult next =
          CompletableFuture.supplyAsync(() -> service.createProposal(command))
              .get(5, TimeUnit.SECONDS);
      assertThat(next.proposalId()).isZero();
      assertThat(next.status()).isEqualTo(ProposalStatus.PENDING);
    }

    @Test
    @DisplayName("주소 압축 테이블이 대기 상한 안에 채워지지 않아도 락을 놓는다")
    void lookupTableNeverPopulated() throws Exception {
      // given
      CreateProposalCommand command = fixture.proposalCommand(root, List.of("No", "Yes"));
      fixture.ledger.leaveNextLookupTableEmpty();

      // when & then
      assertThatThrownBy(() -> service.createProposal(command))
          .isInstanceOf(ConfirmationTimeoutException.class)
          .hasMessageContaining("not ready after");
      assertThat(fixture.lockStrategy.isLocked(LockKeys.moderator(root.moderatorAddress())))
          .isFalse();

      ProposalCreationResult next =
          CompletableFuture.supplyAsync(() -> service.createProposal(command))
              .get(5, TimeUnit.SECONDS);
      assertThat(next.status()).isEqualTo(ProposalStatus.PENDING);
      assertThat(fixture.ledger.count("create_lookup_table")).isEqualTo(2);
    }

    @Test
    @DisplayName("initialize 확정이 늦어져도 락을 놓고, 원장에 반영되지 않았으므로 같은 id로 다시 만든다")
    void initializeConfirmationTimeout() throws Exception {
      // given
      CreateProposalCommand command = fixture.proposalCommand(root, List.of("No", "Yes"));
      fixture.ledger.stallNextConfirmation("initialize_proposal");

      // when & then
      assertThatThrownBy(() -> service.createProposal(command))
          .isInstanceOf(ConfirmationTimeoutException.class);
      assertThat(fixture.lockStrategy.isLocked(LockKeys.moderator(root.moderatorAddress())))
          .isFalse();
      assertThat(fixture.reader.proposal("proposal/moderator-ACME/0")).isEmpty();

      ProposalCreationResult next =
          CompletableFuture.supplyAsync(() -> service.createProposal(command))
              .get(5, TimeUnit.SECONDS);
      assertThat(next.proposalId()).isZero();
      assertThat(fixture.ledger.count("launch_proposal")).isEqualTo(1);
    }
  }
}
