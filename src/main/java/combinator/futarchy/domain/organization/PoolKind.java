package combinator.futarchy.domain.organization;

/** 유동성 풀 종류. 풀 협력자 구현을 고르는 키로도 쓰입니다. */
public enum PoolKind {
  DAMM,
  DLMM
}
