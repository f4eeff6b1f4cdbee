package combinator.futarchy.domain.ledger;

import combinator.futarchy.domain.organization.PoolKind;
import java.util.Optional;

/** 두 자산 유동성 풀의 구성 */
public record PoolState(
    String address, PoolKind kind, String tokenAMint, String tokenBMint, int feeBps) {

  public boolean holds(String mint) {
    return tokenAMint.equals(mint) || tokenBMint.equals(mint);
  }

  /** mint의 상대 자산. mint가 풀에 없으면 empty */
  public Optional<String> counterpartOf(String mint) {
    if (tokenAMint.equals(mint)) {
      return Optional.of(tokenBMint);
    }
    if (tokenBMint.equals(mint)) {
      return Optional.of(tokenAMint);
    }
    return Optional.empty();
  }
}
