package combinator.futarchy.domain.ledger;

import java.math.BigInteger;
import java.util.Optional;

/**
 * @param mintAuthority 발행 권한 주소 (권한이 폐기되었으면 null)
 * @param supply 총 공급량 (기본 단위)
 */
public record MintAccount(String address, String mintAuthority, BigInteger supply, int decimals) {

  public Optional<String> authority() {
    return Optional.ofNullable(mintAuthority);
  }
}
