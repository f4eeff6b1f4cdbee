package combinator.futarchy.global.cache;

public final class CacheKeys {

  /** 전체 조직의 제안 목록 (TTL 적용) */
  public static final String ALL_PROPOSALS = "proposals:all";

  private CacheKeys() {}

  /** 조직별 제안 수 (TTL 없음, 전체 재집계 시 덮어쓰기) */
  public static String proposalCount(String organizationAddress) {
    return "proposal-count:" + organizationAddress;
  }
}
