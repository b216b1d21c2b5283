package water.jug.global.error;

import org.springframework.http.HttpStatus;

public interface ErrorCode {
  String getCode();

  /** Short, stable title, e.g. "Validation failed". */
  String getTitle();

  String getMessage();

  HttpStatus getStatus();
}
