package combinator.futarchy.service.proposal;

import java.math.BigInteger;

/**
 * 출금한 두 자산 수량에서 계산한 시작 가격 관측값
 *
 * @param startingObservation quote / base 비율 ({@link #PRICE_SCALE} 배율)
 * @param maxObservationDelta 관측값 1회 최대 변동폭 (시작값의 고정 비율)
 */
public record ProposalPricing(BigInteger startingObservation, BigInteger maxObservationDelta) {

  public static final BigInteger PRICE_SCALE = BigInteger.TEN.pow(12);

  private static final BigInteger HUNDRED = BigInteger.valueOf(100);

  public static ProposalPricing of(
      BigInteger baseAmount, BigInteger quoteAmount, int deltaPercent) {
    BigInteger starting =
        baseAmount.signum() == 0
            ? PRICE_SCALE
            : quoteAmount.multiply(PRICE_SCALE).divide(baseAmount);
    BigInteger delta = starting.multiply(BigInteger.valueOf(deltaPercent)).divide(HUNDRED);
    return new ProposalPricing(starting, delta);
  }
}
