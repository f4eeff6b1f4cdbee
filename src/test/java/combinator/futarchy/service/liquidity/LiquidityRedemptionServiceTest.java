package combinator.futarchy.service.liquidity;

import static combinator.futarchy.support.ProposalFixtures.MODERATOR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.domain.proposal.ProposalState;
import combinator.futarchy.global.error.exception.InvalidProposalStateException;
import combinator.futarchy.support.FutarchyFixture;
import combinator.futarchy.support.ProposalFixtures;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LiquidityRedemptionService 테스트")
class LiquidityRedemptionServiceTest {

  private FutarchyFixture fixture;
  private LiquidityRedemptionService service;

  @BeforeEach
  void setUp() {
    fixture = new FutarchyFixture();
    service = fixture.redemption;
    fixture.createReadyRoot("ACME");
  }

  @Test
  @DisplayName("두 옵션 제안은 한 번의 제출로 회수한다")
  void singleSubmission() {
    // given
    ProposalAccount proposal = ProposalFixtures.resolved(0, 1);
    fixture.ledger.putProposal(proposal);

    // when
    RedemptionResult result = service.redeemLiquidity(proposal.address());

    // then
    assertThat(result.compacted()).isFalse();
    assertThat(result.submissionIds()).hasSize(1);
    assertThat(fixture.ledger.submitted())
        .last()
        .satisfies(s -> assertThat(s.signers()).containsExactly("admin-0"));
  }

  @Test
  @DisplayName("옵션이 2개를 넘으면 압축 참조 형식으로 나눠 순서대로 제출한다")
  void compactedSubmissions() {
    // given
    String address = "proposal/" + MODERATOR + "/0";
    ProposalAccount threeOptions =
        new ProposalAccount(
            address,
            MODERATOR,
            0,
            3,
            1_000,
            3_600,
            300,
            "meta-0",
            List.of(address + "/pool-0", address + "/pool-1", address + "/pool-2"),
            ProposalState.resolved(2));
    fixture.ledger.putProposal(threeOptions);

    // when
    RedemptionResult result = service.redeemLiquidity(address);

    // then
    assertThat(result.compacted()).isTrue();
    assertThat(result.submissionIds()).hasSize(2);
    assertThat(fixture.ledger.submittedInstructions())
        .endsWith("redeem_liquidity_part_1", "redeem_liquidity_part_2");
  }

  @Test
  @DisplayName("종료되지 않은 제안은 회수할 수 없다")
  void rejectsUnresolved() {
    ProposalAccount pending = ProposalFixtures.pending(0, fixture.clock.epochSecond(), 3_600);
    fixture.ledger.putProposal(pending);

    assertThatThrownBy(() -> service.redeemLiquidity(pending.address()))
        .isInstanceOf(InvalidProposalStateException.class)
        .hasMessageContaining(
            "Proposal must be resolved before redeeming liquidity (current: pending)");
    assertThat(fixture.ledger.count("redeem_liquidity")).isZero();
  }
}
