package combinator.futarchy.global.lock;

/** 잠금 키 규칙 */
public final class LockKeys {

  /** 루트·브랜치 조직 생성이 공유하는 전역 키 (키 할당과 이름 중복 검사 직렬화) */
  public static final String ORGANIZATION_CREATION = "organization-creation";

  private LockKeys() {}

  public static String proposal(String proposalAddress) {
    return "proposal:" + proposalAddress;
  }

  /** 루트와 모든 브랜치가 공유하는 모더레이터 단위 키 (제안 생성 직렬화) */
  public static String moderator(String moderatorAddress) {
    return "moderator:" + moderatorAddress;
  }
}
