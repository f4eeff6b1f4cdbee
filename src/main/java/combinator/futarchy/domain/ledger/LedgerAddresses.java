package combinator.futarchy.domain.ledger;

public final class LedgerAddresses {

  /** 네트워크 기본 자산의 래핑 토큰 주소 */
  public static final String NATIVE_MINT = "So11111111111111111111111111111111111111112";

  /** 비어 있는 슬롯을 나타내는 기본 주소 */
  public static final String DEFAULT_ADDRESS = "11111111111111111111111111111111";

  private LedgerAddresses() {}

  public static boolean isNative(String mint) {
    return NATIVE_MINT.equals(mint);
  }

  public static boolean isDefault(String address) {
    return address == null || DEFAULT_ADDRESS.equals(address);
  }
}
