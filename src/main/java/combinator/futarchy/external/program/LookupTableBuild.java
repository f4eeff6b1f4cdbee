package combinator.futarchy.external.program;

import combinator.futarchy.domain.ledger.UnsignedChange;

public record LookupTableBuild(UnsignedChange change, String tableAddress) {}
