package combinator.futarchy.domain.organization;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import lombok.Builder;

/**
 * 거버넌스 단위 (레지스트리 행)
 *
 * <p>브랜치의 moderatorAddress·poolAddress·poolKind·quoteMint는 생성 시점에 루트에서 복사되며 이후 바뀌지 않습니다. 소유자가 바꿀 수
 * 있는 값은 출금 비율과 제안자 토큰 임계값뿐입니다 (화이트리스트는 별도 컬렉션).
 *
 * @param id 레지스트리 PK (저장 전에는 null)
 * @param address 원장상 조직 계정 주소
 * @param adminKeyIndex 관리 지갑 키 인덱스 (서명 키 조회용)
 * @param treasuryVault 트레저리 멀티시그에서 파생한 금고 주소
 * @param mintAuthorityVault 발행 권한 멀티시그에서 파생한 금고 주소
 * @param proposerThreshold 제안자 최소 보유량 (null이면 미설정)
 */
@Builder(toBuilder = true)
public record Organization(
    Long id,
    String address,
    String name,
    OrganizationKind kind,
    String moderatorAddress,
    String ownerWallet,
    Integer adminKeyIndex,
    String adminWallet,
    String governanceMint,
    String poolAddress,
    PoolKind poolKind,
    String quoteMint,
    String treasuryVault,
    String mintAuthorityVault,
    String treasuryCosigner,
    Long parentId,
    int withdrawalPercentage,
    BigInteger proposerThreshold) {

  public static final int MIN_WITHDRAWAL_PERCENTAGE = 5;
  public static final int MAX_WITHDRAWAL_PERCENTAGE = 50;

  public boolean isRoot() {
    return kind == OrganizationKind.ROOT;
  }

  public boolean isOwnedBy(String wallet) {
    return Objects.equals(ownerWallet, wallet);
  }

  public Optional<BigInteger> threshold() {
    return Optional.ofNullable(proposerThreshold).filter(t -> t.signum() > 0);
  }

  public Organization withId(long newId) {
    return toBuilder().id(newId).build();
  }

  public Organization withWithdrawalPercentage(int percentage) {
    return toBuilder().withdrawalPercentage(percentage).build();
  }

  public Organization withProposerThreshold(BigInteger threshold) {
    return toBuilder().proposerThreshold(threshold).build();
  }

  /** 로그용 식별자 */
  public String label() {
    return name + " (" + address + ")";
  }
}
