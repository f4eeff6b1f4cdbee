package combinator.futarchy.service.projection;

import static org.assertj.core.api.Assertions.assertThat;

import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.domain.proposal.ProposalStatus;
import combinator.futarchy.support.ProposalFixtures;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ProposalStateProjector 테스트")
class ProposalStateProjectorTest {

  private static final long CREATED_AT = 1_700_000_000L;
  private static final long LENGTH = 3600;

  private final ProposalStateProjector projector = new ProposalStateProjector();

  @Nested
  @DisplayName("PENDING 제안")
  class PendingTests {

    @ParameterizedTest(name = "now = endsAt{0} → expired={1}, blocks={2}")
    @CsvSource({"-1, false, true", "0, true, false", "1, true, false"})
    @DisplayName("endsAt 경계에서 만료 여부가 바뀐다")
    void expiresExactlyAtEndsAt(long offset, boolean expired, boolean blocks) {
      // given
      ProposalAccount account = ProposalFixtures.pending(0, CREATED_AT, LENGTH);
      Instant now = Instant.ofEpochSecond(CREATED_AT + LENGTH + offset);

      // when
      ProposalProjection projection = projector.project(account, now);

      // then
      assertThat(projection.status()).isEqualTo(ProposalStatus.PENDING);
      assertThat(projection.endsAt()).isEqualTo(CREATED_AT + LENGTH);
      assertThat(projection.expired()).isEqualTo(expired);
      assertThat(projection.blocksNewProposal()).isEqualTo(blocks);
      assertThat(projection.isActive()).isEqualTo(!expired);
    }

    @Test
    @DisplayName("남은 시간은 시간 단위로 올림한다")
    void hoursRemainingRoundsUp() {
      ProposalAccount account = ProposalFixtures.pending(0, CREATED_AT, LENGTH);
      ProposalProjection projection =
          projector.project(account, Instant.ofEpochSecond(CREATED_AT + 1));

      assertThat(projection.secondsRemaining(CREATED_AT + 1)).isEqualTo(3599);
      assertThat(projection.hoursRemaining(CREATED_AT + 1)).isEqualTo(1);
      assertThat(projection.hoursRemaining(CREATED_AT + LENGTH + 10)).isZero();
    }
  }

  @Test
  @DisplayName("SETUP은 시각과 무관하게 항상 새 제안을 막는다")
  void setupAlwaysBlocks() {
    ProposalAccount account = ProposalFixtures.setup(0, CREATED_AT);

    ProposalProjection projection =
        projector.project(account, Instant.ofEpochSecond(CREATED_AT + 100 * LENGTH));

    assertThat(projection.status()).isEqualTo(ProposalStatus.SETUP);
    assertThat(projection.expired()).isFalse();
    assertThat(projection.blocksNewProposal()).isTrue();
  }

  @Test
  @DisplayName("RESOLVED는 막지 않고 승리 옵션을 노출한다")
  void resolvedExposesWinningIndex() {
    ProposalAccount account = ProposalFixtures.resolved(3, 1);

    ProposalProjection projection = projector.project(account, Instant.ofEpochSecond(0));

    assertThat(projection.blocksNewProposal()).isFalse();
    assertThat(projection.winningIndex()).hasValue(1);
    assertThat(projection.warmupEndsAt()).isEqualTo(account.createdAt() + 300);
  }

  @Test
  @DisplayName("같은 입력이면 항상 같은 결과")
  void isDeterministic() {
    ProposalAccount account = ProposalFixtures.pending(2, CREATED_AT, LENGTH);
    Instant now = Instant.ofEpochSecond(CREATED_AT + 10);

    assertThat(projector.project(account, now)).isEqualTo(projector.project(account, now));
  }
}
