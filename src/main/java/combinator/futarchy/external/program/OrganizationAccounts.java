package combinator.futarchy.external.program;

/** 원장에 만들어진 조직 계정 주소. 브랜치는 모더레이터가 없습니다 (null). */
public record OrganizationAccounts(
    String organizationAddress,
    String moderatorAddress,
    String treasuryMultisig,
    String mintMultisig) {}
