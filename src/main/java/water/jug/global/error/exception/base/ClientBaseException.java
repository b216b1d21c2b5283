package water.jug.global.error.exception.base;

import water.jug.global.error.ErrorCode;

/**
 * Errors caused by the caller's input (4xx). The formatted message is returned to the client as
 * is, so it must not carry internal detail.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
