package combinator.futarchy.global.error.exception;

import combinator.futarchy.global.error.CommonErrorCode;
import combinator.futarchy.global.error.exception.base.ServerBaseException;

public class MetadataProcessingException extends ServerBaseException {

  public MetadataProcessingException(String detail, Throwable cause) {
    super(CommonErrorCode.DATA_PROCESSING_ERROR, cause, detail);
  }
}
