package combinator.futarchy.domain.ledger;

import java.math.BigInteger;

public record LiquidityPosition(
    String address, String poolAddress, BigInteger unlockedLiquidity, BigInteger lockedLiquidity) {

  public boolean hasUnlockedLiquidity() {
    return unlockedLiquidity != null && unlockedLiquidity.signum() > 0;
  }
}
