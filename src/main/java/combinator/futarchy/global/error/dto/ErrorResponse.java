package combinator.futarchy.global.error.dto;

import combinator.futarchy.global.error.ErrorCode;
import combinator.futarchy.global.error.exception.base.BaseException;
import java.time.LocalDateTime;

/**
 * HTTP 계층으로 넘기는 구조화된 실패 응답
 *
 * @param status HTTP 상태 코드
 * @param code 에러 코드 (예: F007)
 * @param check 기계 판독용 코드 (준비 상태 검사 이름 또는 범주 라벨)
 * @param message 사람이 읽는 진단 메시지
 * @param retryable 전체 워크플로 재시도가 의미 있는지
 */
public record ErrorResponse(
    int status,
    String code,
    String check,
    String message,
    boolean retryable,
    LocalDateTime timestamp) {

  public static ErrorResponseBuilder builder() {
    return new ErrorResponseBuilder();
  }

  public static class ErrorResponseBuilder {
    private Integer status;
    private String code;
    private String check;
    private String message;
    private boolean retryable;
    private LocalDateTime timestamp;

    public ErrorResponseBuilder status(int status) {
      this.status = status;
      return this;
    }

    public ErrorResponseBuilder code(String code) {
      this.code = code;
      return this;
    }

    public ErrorResponseBuilder check(String check) {
      this.check = check;
      return this;
    }

    public ErrorResponseBuilder message(String message) {
      this.message = message;
      return this;
    }

    public ErrorResponseBuilder retryable(boolean retryable) {
      this.retryable = retryable;
      return this;
    }

    public ErrorResponseBuilder timestamp(LocalDateTime timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public ErrorResponse build() {
      return new ErrorResponse(
          status != null ? status : 500,
          code != null ? code : "E000",
          check != null ? check : "internal",
          message != null ? message : "Unknown error",
          retryable,
          timestamp != null ? timestamp : LocalDateTime.now());
    }
  }

  /** 비즈니스 예외로부터 생성 (동적으로 가공된 메시지 전달) */
  public static ErrorResponse from(BaseException e) {
    return ErrorResponse.builder()
        .status(e.getErrorCode().getStatusCode())
        .code(e.getErrorCode().getCode())
        .check(e.getMachineCode())
        .message(e.getMessage())
        .retryable(e.getErrorCode().getCategory().isRetryable())
        .timestamp(LocalDateTime.now())
        .build();
  }

  /** 에러 코드로부터 생성. 상세 내용은 숨기고 Enum의 기본 메시지만 사용합니다. */
  public static ErrorResponse from(ErrorCode errorCode) {
    return ErrorResponse.builder()
        .status(errorCode.getStatusCode())
        .code(errorCode.getCode())
        .check(errorCode.getCategory().label())
        .message(errorCode.getMessage())
        .retryable(errorCode.getCategory().isRetryable())
        .timestamp(LocalDateTime.now())
        .build();
  }
}
