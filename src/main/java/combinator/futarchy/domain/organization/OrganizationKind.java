package combinator.futarchy.domain.organization;

public enum OrganizationKind {
  /** 유동성 풀과 모더레이터를 직접 소유하는 조직 */
  ROOT,
  /** 루트의 모더레이터·풀을 공유하는 하위 조직 */
  BRANCH
}
