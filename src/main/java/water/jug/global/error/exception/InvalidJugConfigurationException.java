package water.jug.global.error.exception;

import water.jug.global.error.CommonErrorCode;
import water.jug.global.error.exception.base.ClientBaseException;

/** Thrown by the solver when called with a non-positive capacity or a negative target. */
public class InvalidJugConfigurationException extends ClientBaseException {

  public InvalidJugConfigurationException(int capacityX, int capacityY, int target) {
    super(CommonErrorCode.INVALID_JUG_CONFIGURATION, capacityX, capacityY, target);
  }
}
