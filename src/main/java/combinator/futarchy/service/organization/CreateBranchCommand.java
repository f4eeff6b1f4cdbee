package combinator.futarchy.service.organization;

/**
 * 브랜치 조직 생성 요청
 *
 * @param parentAddress 부모 루트 조직 주소
 * @param ownerWallet 요청자. 부모 루트의 소유자여야 합니다.
 */
public record CreateBranchCommand(
    String name,
    String parentAddress,
    String ownerWallet,
    String governanceMint,
    String treasuryCosigner) {}
