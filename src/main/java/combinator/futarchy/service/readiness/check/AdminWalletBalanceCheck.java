package combinator.futarchy.service.readiness.check;

import combinator.futarchy.config.FutarchyProperties;
import combinator.futarchy.service.readiness.ReadinessCheck;
import combinator.futarchy.service.readiness.ReadinessCheckNames;
import combinator.futarchy.service.readiness.ReadinessContext;
import combinator.futarchy.service.readiness.ReadinessResult;
import combinator.futarchy.service.sequencer.LedgerReader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** 이후 제출의 수수료를 낼 지갑의 최소 보유량 */
@Component
@Order(6)
@RequiredArgsConstructor
public class AdminWalletBalanceCheck implements ReadinessCheck {

  private static final int NATIVE_DECIMALS = 9;

  private final LedgerReader reader;
  private final FutarchyProperties properties;

  @Override
  public String name() {
    return ReadinessCheckNames.ADMIN_WALLET_BALANCE;
  }

  @Override
  public ReadinessResult check(ReadinessContext context) {
    BigInteger required = properties.getReadiness().getMinAdminNativeBalance();
    BigInteger balance = reader.nativeBalance(context.liquidityOwner());
    if (balance.compareTo(required) >= 0) {
      return ReadinessResult.passed();
    }
    return ReadinessResult.notReady(
        "Admin wallet has insufficient SOL balance: "
            + toNative(balance).setScale(4, RoundingMode.DOWN).toPlainString()
            + " SOL. Minimum required: "
            + toNative(required).stripTrailingZeros().toPlainString()
            + " SOL. Use the fund-admin-wallet script to fund it.");
  }

  private static BigDecimal toNative(BigInteger baseUnits) {
    return new BigDecimal(baseUnits).movePointLeft(NATIVE_DECIMALS);
  }
}
