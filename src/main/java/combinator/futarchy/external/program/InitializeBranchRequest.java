package combinator.futarchy.external.program;

/** 브랜치 초기화. parentAdmin의 공동 서명이 필요합니다. */
public record InitializeBranchRequest(
    String admin,
    String parentAdmin,
    String name,
    String parentAddress,
    String governanceMint,
    String treasuryCosigner) {}
