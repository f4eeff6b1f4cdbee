package combinator.futarchy.external.ledger;

/** 주소 파생에 쓰는 시드 */
public final class LedgerSeeds {

  public static final String PROPOSAL = "proposal";
  public static final String VAULT = "multisig_vault";

  /** 멀티시그의 기본 금고 인덱스 */
  public static final int DEFAULT_VAULT_INDEX = 0;

  private LedgerSeeds() {}

  public static String proposalAddress(LedgerClient ledger, String moderator, long proposalId) {
    return ledger.deriveAddress(PROPOSAL, moderator, Long.toString(proposalId));
  }

  /** 멀티시그 주소가 아니라 자산을 받는 금고 주소를 파생합니다. */
  public static String vaultAddress(LedgerClient ledger, String multisig) {
    return ledger.deriveAddress(VAULT, multisig, Integer.toString(DEFAULT_VAULT_INDEX));
  }
}
