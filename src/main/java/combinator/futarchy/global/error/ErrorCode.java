package combinator.futarchy.global.error;

import org.springframework.http.HttpStatus;

public interface ErrorCode {
  String getCode();

  String getMessage();

  HttpStatus getStatus();

  ErrorCategory getCategory();

  default int getStatusCode() {
    return getStatus().value();
  }
}
