package water.jug.global.error;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import water.jug.global.error.dto.ErrorResponse;
import water.jug.global.error.exception.base.BaseException;

/**
 * Maps every exception that escapes a controller to an {@link ErrorResponse}.
 *
 * <ul>
 *   <li>Bean Validation failures: 400 with all violated rules, field rules (by field name) before
 *       cross-field rules
 *   <li>{@link BaseException}: status and code from its {@link ErrorCode}
 *   <li>Anything else: 500 with a fixed message, full stack trace in the log
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(MethodArgumentNotValidException.class)
  protected ResponseEntity<ErrorResponse> handleValidationException(
      MethodArgumentNotValidException e) {
    BindingResult bindingResult = e.getBindingResult();
    List<String> violations =
        Stream.concat(
                bindingResult.getFieldErrors().stream()
                    .sorted(Comparator.comparing(FieldError::getField)),
                bindingResult.getGlobalErrors().stream())
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .toList();
    log.warn(
        "Validation failed: target={} | Errors: {}",
        bindingResult.getTarget(),
        String.join("; ", violations));
    return ErrorResponse.toResponseEntity(CommonErrorCode.INVALID_INPUT_VALUE, violations);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  protected ResponseEntity<ErrorResponse> handleUnreadableMessage(
      HttpMessageNotReadableException e) {
    log.warn("Malformed request body: {}", e.getMostSpecificCause().getMessage());
    return ErrorResponse.toResponseEntity(CommonErrorCode.MALFORMED_REQUEST);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  protected ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException e) {
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.RESOURCE_NOT_FOUND,
        String.format(CommonErrorCode.RESOURCE_NOT_FOUND.getMessage(), "/" + e.getResourcePath()),
        null);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  protected ResponseEntity<ErrorResponse> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException e) {
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.METHOD_NOT_ALLOWED,
        String.format(CommonErrorCode.METHOD_NOT_ALLOWED.getMessage(), e.getMethod()),
        null);
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  protected ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(
      HttpMediaTypeNotSupportedException e) {
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.UNSUPPORTED_MEDIA_TYPE,
        String.format(CommonErrorCode.UNSUPPORTED_MEDIA_TYPE.getMessage(), e.getContentType()),
        null);
  }

  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    log.warn(
        "Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    return ErrorResponse.toResponseEntity(e);
  }

  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    return ErrorResponse.toResponseEntity(CommonErrorCode.INTERNAL_SERVER_ERROR);
  }
}
