package combinator.futarchy.global.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR(
      "S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR, ErrorCategory.INTERNAL),
  LOCK_ACQUISITION_FAILURE(
      "S002", "락 획득 실패: %s", HttpStatus.INTERNAL_SERVER_ERROR, ErrorCategory.INTERNAL),
  DATA_PROCESSING_ERROR(
      "S004", "데이터 처리 중 오류 발생 (%s)", HttpStatus.INTERNAL_SERVER_ERROR, ErrorCategory.INTERNAL),
  EXTERNAL_API_ERROR(
      "S005", "외부 API 호출 실패 (%s)", HttpStatus.SERVICE_UNAVAILABLE, ErrorCategory.TRANSIENT_LEDGER);

  private final String code;
  private final String message;
  private final HttpStatus status;
  private final ErrorCategory category;
}
