package combinator.futarchy.global.error;

/**
 * 호출자가 재시도 여부를 판단할 수 있도록 구분한 실패 범주
 *
 * <p>label은 HTTP 계층으로 그대로 전달되는 기계 판독용 값이므로 변경하지 않습니다.
 */
public enum ErrorCategory {
  VALIDATION("validation"),
  READINESS("readiness"),
  AUTHORIZATION("authorization"),
  NOT_FOUND("not_found"),
  IDEMPOTENCY_CONFLICT("idempotency_conflict"),
  TRANSIENT_LEDGER("transient_ledger"),
  FATAL_CONFIGURATION("fatal_configuration"),
  INTERNAL("internal");

  private final String label;

  ErrorCategory(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /** 전체 워크플로 재시도가 의미 있는 범주인지 */
  public boolean isRetryable() {
    return this == TRANSIENT_LEDGER;
  }
}
