package combinator.futarchy.external.identity;

import combinator.futarchy.domain.ledger.AdminIdentity;
import combinator.futarchy.domain.ledger.SignedChange;
import combinator.futarchy.domain.ledger.UnsignedChange;
import java.math.BigInteger;
import java.util.Optional;

/** 키 서비스. 키 원본은 이 경계를 넘지 않습니다. */
public interface IdentityService {

  /** keyIndex에 새 관리 지갑을 할당합니다. */
  AdminIdentity allocate(int keyIndex);

  AdminIdentity resolve(int keyIndex);

  SignedChange sign(AdminIdentity identity, UnsignedChange change);

  /** 이미 서명된 변경에 공동 서명을 추가합니다. */
  SignedChange cosign(AdminIdentity identity, SignedChange change);

  /** 토큰 계정 잔액. 토큰 계정이 없으면 empty */
  Optional<BigInteger> tokenBalance(String owner, String mint);

  /** 수수료 자산 잔액 (기본 단위) */
  BigInteger nativeBalance(String owner);
}
