package combinator.futarchy.service.readiness;

/** 준비 상태 검사 이름. 호출자에게 기계 판독용 코드로 전달되므로 바꾸지 않습니다. */
public final class ReadinessCheckNames {

  public static final String PROPOSER_AUTHORIZATION = "proposer_authorization";
  public static final String MINT_AUTHORITY = "mint_authority";
  public static final String TOKEN_POOL_MATCH = "token_pool_match";
  public static final String ADMIN_LP_HOLDINGS = "admin_lp_holdings";
  public static final String ACTIVE_PROPOSAL = "active_proposal";
  public static final String ADMIN_WALLET_BALANCE = "admin_wallet_balance";

  private ReadinessCheckNames() {}
}
