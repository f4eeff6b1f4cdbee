package combinator.futarchy.service.projection;

import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.domain.proposal.ProposalState;
import java.time.Instant;
import java.util.OptionalInt;
import org.springframework.stereotype.Component;

/**
 * 제안 상태 투영기
 *
 * <p>순수 함수입니다. 같은 계정과 같은 시각이면 항상 같은 결과를 돌려주며, 원장이나 시계에 접근하지 않습니다.
 */
@Component
public class ProposalStateProjector {

  public ProposalProjection project(ProposalAccount account, Instant now) {
    long nowSeconds = now.getEpochSecond();
    long endsAt = account.createdAt() + account.lengthSeconds();
    long warmupEndsAt = account.createdAt() + account.warmupSeconds();
    ProposalState state = account.state();

    return switch (state.status()) {
      case SETUP -> new ProposalProjection(
          state.status(), endsAt, warmupEndsAt, false, OptionalInt.empty());
      case PENDING -> new ProposalProjection(
          state.status(), endsAt, warmupEndsAt, nowSeconds >= endsAt, OptionalInt.empty());
      case RESOLVED -> new ProposalProjection(
          state.status(),
          endsAt,
          warmupEndsAt,
          false,
          OptionalInt.of(((ProposalState.Resolved) state).winningIndex()));
    };
  }
}
