package combinator.futarchy.global.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/** 조직·제안 라이프사이클 전용 에러 코드 */
@Getter
@AllArgsConstructor
public enum FutarchyErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  ORGANIZATION_NOT_FOUND(
      "F001", "존재하지 않는 조직입니다 (%s)", HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND),
  PROPOSAL_NOT_FOUND(
      "F002", "존재하지 않는 제안입니다 (%s)", HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND),
  DUPLICATE_ORGANIZATION_NAME(
      "F003", "이미 사용 중인 조직 이름입니다 (%s)", HttpStatus.CONFLICT, ErrorCategory.VALIDATION),
  NOT_ORGANIZATION_OWNER(
      "F004",
      "조직 소유자만 수행할 수 있습니다 (조직: %s, 요청자: %s)",
      HttpStatus.FORBIDDEN,
      ErrorCategory.AUTHORIZATION),
  INVALID_PROPOSAL_STATE(
      "F005", "제안 상태가 올바르지 않습니다: %s", HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION),
  PROPOSAL_NOT_ENDED(
      "F006",
      "제안이 아직 종료되지 않았습니다 (%s, 남은 시간: %d초)",
      HttpStatus.BAD_REQUEST,
      ErrorCategory.VALIDATION),
  READINESS_CHECK_FAILED("F007", "%s", HttpStatus.BAD_REQUEST, ErrorCategory.READINESS),
  PROPOSER_NOT_AUTHORIZED("F008", "%s", HttpStatus.FORBIDDEN, ErrorCategory.READINESS),
  IDEMPOTENCY_CONFLICT("F009", "%s", HttpStatus.CONFLICT, ErrorCategory.IDEMPOTENCY_CONFLICT),
  PROPOSER_NOT_FOUND(
      "F010", "화이트리스트에 없는 지갑입니다 (%s)", HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND),

  // === Server Errors (5xx) ===
  LEDGER_TRANSIENT_FAILURE(
      "L001", "원장 요청 실패 (%s)", HttpStatus.SERVICE_UNAVAILABLE, ErrorCategory.TRANSIENT_LEDGER),
  CONFIRMATION_TIMEOUT(
      "L002", "원장 확정 대기 시간 초과 (%s)", HttpStatus.GATEWAY_TIMEOUT, ErrorCategory.TRANSIENT_LEDGER),
  SUBMISSION_FAILED(
      "L003", "원장 제출 실패 (%s)", HttpStatus.BAD_GATEWAY, ErrorCategory.TRANSIENT_LEDGER),
  ORGANIZATION_MISCONFIGURED(
      "L004",
      "조직 설정이 손상되었습니다 (%s)",
      HttpStatus.INTERNAL_SERVER_ERROR,
      ErrorCategory.FATAL_CONFIGURATION);

  private final String code;
  private final String message;
  private final HttpStatus status;
  private final ErrorCategory category;
}
