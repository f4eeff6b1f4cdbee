package combinator.futarchy.service.organization;

/**
 * 루트 조직 생성 요청
 *
 * @param ownerWallet 요청자 (서명 검증은 호출 측 책임)
 * @param poolAddress 유동성 풀. 풀 종류와 상대 자산은 풀 상태에서 판별합니다.
 */
public record CreateOrganizationCommand(
    String name,
    String ownerWallet,
    String governanceMint,
    String poolAddress,
    String treasuryCosigner) {}
