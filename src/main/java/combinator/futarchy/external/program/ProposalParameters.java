package combinator.futarchy.external.program;

import java.math.BigInteger;

/**
 * @param startingObservation 시작 가격 관측값 (PRICE_SCALE 배율)
 * @param maxObservationDelta 관측값 1회 최대 변동폭
 * @param marketBias 통과/거부 간격 (%)
 * @param feeBps 시장 수수료
 */
public record ProposalParameters(
    long lengthSeconds,
    long warmupSeconds,
    BigInteger startingObservation,
    BigInteger maxObservationDelta,
    int marketBias,
    int feeBps) {}
