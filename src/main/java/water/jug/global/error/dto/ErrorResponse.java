package water.jug.global.error.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import org.springframework.http.ResponseEntity;
import water.jug.global.error.ErrorCode;
import water.jug.global.error.exception.base.BaseException;

/**
 * Body of every non-2xx response.
 *
 * @param status HTTP status code
 * @param code stable error code (C001, S001, ...)
 * @param error short title of the error
 * @param message human readable detail
 * @param validationErrors every violated input rule, only for validation failures
 * @param timestamp server time of the failure
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    int status,
    String code,
    String error,
    String message,
    List<String> validationErrors,
    LocalDateTime timestamp) {

  /** Business exception: uses the exception's formatted message. */
  public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
    return toResponseEntity(e.getErrorCode(), e.getMessage(), null);
  }

  /** Fixed message from the code; used for unexpected failures so nothing internal leaks. */
  public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
    return toResponseEntity(errorCode, errorCode.getMessage(), null);
  }

  public static ResponseEntity<ErrorResponse> toResponseEntity(
      ErrorCode errorCode, List<String> validationErrors) {
    return toResponseEntity(errorCode, errorCode.getMessage(), validationErrors);
  }

  public static ResponseEntity<ErrorResponse> toResponseEntity(
      ErrorCode errorCode, String message, List<String> validationErrors) {
    return ResponseEntity.status(errorCode.getStatus())
        .body(
            ErrorResponse.builder()
                .status(errorCode.getStatus().value())
                .code(errorCode.getCode())
                .error(errorCode.getTitle())
                .message(message)
                .validationErrors(validationErrors)
                .timestamp(LocalDateTime.now())
                .build());
  }
}
