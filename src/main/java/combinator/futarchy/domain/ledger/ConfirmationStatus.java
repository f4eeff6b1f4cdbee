package combinator.futarchy.domain.ledger;

public enum ConfirmationStatus {
  FINALIZED,
  FAILED,
  TIMED_OUT
}
