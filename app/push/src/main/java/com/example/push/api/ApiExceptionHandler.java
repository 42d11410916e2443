/*
 * どこで: Push API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: プロバイダ障害と入力不正を一貫したエラー応答に揃えるため
 */
package com.example.push.api;

import com.example.push.client.ProviderTransportException;
import com.example.push.model.UnknownProviderException;
import com.example.push.service.DeviceNotFoundException;
import com.example.push.service.DuplicateDeviceException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(UnknownProviderException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownProvider(UnknownProviderException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ApiErrorResponse(ApiErrorCode.UNKNOWN_PROVIDER, ex.getMessage()));
  }

  @ExceptionHandler(DeviceNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleDeviceNotFound(DeviceNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.DEVICE_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(DuplicateDeviceException.class)
  public ResponseEntity<ApiErrorResponse> handleDuplicateDevice(DuplicateDeviceException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.DUPLICATE_DEVICE, ex.getMessage()));
  }

  @ExceptionHandler(ProviderTransportException.class)
  public ResponseEntity<ApiErrorResponse> handleProviderTransport(ProviderTransportException ex) {
    final ApiErrorCode code =
        switch (ex.reason()) {
          case TIMEOUT -> ApiErrorCode.PROVIDER_TIMEOUT;
          case UNAUTHORIZED -> ApiErrorCode.PROVIDER_UNAUTHORIZED;
          case REJECTED -> ApiErrorCode.PROVIDER_REJECTED;
          case PAYLOAD_TOO_LARGE -> ApiErrorCode.PROVIDER_PAYLOAD_TOO_LARGE;
          case BAD_GATEWAY -> ApiErrorCode.PROVIDER_BAD_GATEWAY;
          case INVALID_RESPONSE -> ApiErrorCode.PROVIDER_INVALID_RESPONSE;
          case FEEDBACK_UNAVAILABLE -> ApiErrorCode.PROVIDER_FEEDBACK_UNAVAILABLE;
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
          case PAYLOAD_TOO_LARGE -> HttpStatus.PAYLOAD_TOO_LARGE;
          case FEEDBACK_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
          case UNAUTHORIZED, REJECTED, BAD_GATEWAY, INVALID_RESPONSE -> HttpStatus.BAD_GATEWAY;
        };
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先する
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
