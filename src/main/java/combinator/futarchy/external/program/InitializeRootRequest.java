package combinator.futarchy.external.program;

import combinator.futarchy.domain.organization.PoolKind;

public record InitializeRootRequest(
    String admin,
    String name,
    String governanceMint,
    String quoteMint,
    String treasuryCosigner,
    String poolAddress,
    PoolKind poolKind) {}
