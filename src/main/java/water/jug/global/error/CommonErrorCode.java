package water.jug.global.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE(
      "C001", "Validation failed", "Invalid input parameters", HttpStatus.BAD_REQUEST),
  MALFORMED_REQUEST(
      "C002", "Malformed request", "Request body could not be parsed", HttpStatus.BAD_REQUEST),
  INVALID_JUG_CONFIGURATION(
      "C003",
      "Invalid jug configuration",
      "Capacities must be positive and the target non-negative (X=%s, Y=%s, Z=%s)",
      HttpStatus.BAD_REQUEST),
  RESOURCE_NOT_FOUND("C004", "Not found", "No endpoint %s", HttpStatus.NOT_FOUND),
  METHOD_NOT_ALLOWED(
      "C005", "Method not allowed", "Method %s is not supported", HttpStatus.METHOD_NOT_ALLOWED),
  UNSUPPORTED_MEDIA_TYPE(
      "C006",
      "Unsupported media type",
      "Content type %s is not supported",
      HttpStatus.UNSUPPORTED_MEDIA_TYPE),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR(
      "S001",
      "Internal server error",
      "An error occurred while processing your request",
      HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String title;
  private final String message;
  private final HttpStatus status;
}
