package combinator.futarchy.global.executor.strategy;

import combinator.futarchy.global.error.exception.ExternalServiceException;
import combinator.futarchy.global.error.exception.InternalSystemException;
import combinator.futarchy.global.error.exception.LedgerTransientException;
import combinator.futarchy.global.error.exception.LockAcquisitionException;
import combinator.futarchy.global.error.exception.MetadataProcessingException;
import combinator.futarchy.global.error.exception.SubmissionFailedException;
import combinator.futarchy.global.error.exception.base.BaseException;
import combinator.futarchy.global.executor.TaskContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** 특정 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * 예외를 변환하여 반환
   *
   * @param e 원본 예외
   * @param context 작업 컨텍스트
   * @return 변환된 RuntimeException
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /** Error guard + async unwrap + BaseException pass-through를 선행 적용하는 Decorator */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = unwrap(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** 기본 변환기: 관리되지 않은 예외는 InternalSystemException으로 규격화 */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /** JSON 처리 예외 변환기 (메타데이터 직렬화) */
  static ExceptionTranslator forJson() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof JsonProcessingException) {
            return new MetadataProcessingException(
                "JSON 직렬화 실패 [" + context.toTaskName() + "]: " + unwrapped.getMessage(),
                unwrapped);
          }
          if (unwrapped instanceof IOException) {
            return new MetadataProcessingException(
                "데이터 I/O 실패 [" + context.toTaskName() + "]: " + unwrapped.getMessage(),
                unwrapped);
          }
          return new InternalSystemException("json-processing:" + context.operation(), unwrapped);
        });
  }

  /** Lock 예외 변환기 */
  static ExceptionTranslator forLock() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new LockAcquisitionException(context.dynamicValue(), unwrapped);
          }
          return new InternalSystemException(context.toTaskName(), unwrapped);
        });
  }

  /** 원장 읽기 예외 변환기 (재시도 후에도 실패한 조회) */
  static ExceptionTranslator forLedgerRead() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new LedgerTransientException(context.toTaskName(), unwrapped));
  }

  /** 원장 제출 예외 변환기. 제출은 재시도하지 않으므로 실패 원인을 그대로 남깁니다. */
  static ExceptionTranslator forSubmission() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) ->
            new SubmissionFailedException(
                context.toTaskName() + ": " + unwrapped.getMessage(), unwrapped));
  }

  /** 외부 협력자(풀, 메타데이터 저장소) 호출 실패 변환기 */
  static ExceptionTranslator forExternalService(String serviceName) {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new ExternalServiceException(serviceName, unwrapped));
  }

  private static Throwable unwrap(Throwable e) {
    Throwable current = e;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
