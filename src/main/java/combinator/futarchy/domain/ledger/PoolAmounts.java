package combinator.futarchy.domain.ledger;

import java.math.BigInteger;

/** 풀 작업으로 이동한 두 자산의 수량 */
public record PoolAmounts(
    String tokenAMint, BigInteger tokenAAmount, String tokenBMint, BigInteger tokenBAmount) {

  /**
   * mint에 해당하는 수량
   *
   * @throws IllegalArgumentException mint가 풀의 자산이 아닐 때
   */
  public BigInteger amountOf(String mint) {
    if (tokenAMint.equals(mint)) {
      return tokenAAmount;
    }
    if (tokenBMint.equals(mint)) {
      return tokenBAmount;
    }
    throw new IllegalArgumentException("mint not in pool: " + mint);
  }
}
