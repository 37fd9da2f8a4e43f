package com.vaultlend.ledger.service.web;

import com.vaultlend.ledger.custody.CustodyException;
import com.vaultlend.ledger.error.LedgerError;
import com.vaultlend.ledger.error.LedgerException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps rejected operations to HTTP responses with a {@code {code, message}} body and counts them.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class LedgerExceptionHandler {

  public static final String REJECTIONS_METER = "ledger.rejections";

  private final @NonNull MeterRegistry meterRegistry;

  @ExceptionHandler(LedgerException.class)
  public ResponseEntity<ErrorResponse> handleLedger(LedgerException e) {
    LedgerError error = e.getError();
    HttpStatus status = statusOf(error);
    log.debug("ledger operation rejected (code={}, status={}): {}", error, status.value(), e.getMessage());
    return reject(status, error.name(), e.getMessage());
  }

  @ExceptionHandler(CustodyException.class)
  public ResponseEntity<ErrorResponse> handleCustody(CustodyException e) {
    log.warn("asset transfer failed: {}", e.getMessage());
    return reject(HttpStatus.UNPROCESSABLE_ENTITY, "TRANSFER_FAILED", e.getMessage());
  }

  @ExceptionHandler(ArithmeticException.class)
  public ResponseEntity<ErrorResponse> handleArithmetic(ArithmeticException e) {
    log.warn("uint256 range violation: {}", e.getMessage());
    return reject(HttpStatus.UNPROCESSABLE_ENTITY, "ARITHMETIC_RANGE", e.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
    return reject(HttpStatus.BAD_REQUEST, "INVALID_ACCOUNT", e.getMessage());
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
    return reject(HttpStatus.CONFLICT, "ILLEGAL_STATE", e.getMessage());
  }

  @ExceptionHandler({
      MethodArgumentNotValidException.class,
      MissingRequestHeaderException.class,
      MissingServletRequestParameterException.class,
      MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
    return reject(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
  }

  static HttpStatus statusOf(LedgerError error) {
    return switch (error.category()) {
      case VALIDATION -> HttpStatus.BAD_REQUEST;
      case CONFLICT -> HttpStatus.CONFLICT;
      case INSUFFICIENT, SAFETY -> HttpStatus.UNPROCESSABLE_ENTITY;
      case AUTHORIZATION -> HttpStatus.FORBIDDEN;
      case OPERATIONAL -> HttpStatus.LOCKED;
    };
  }

  private ResponseEntity<ErrorResponse> reject(HttpStatus status, String code, String message) {
    Counter.builder(REJECTIONS_METER)
        .description("Rejected ledger requests by error code")
        .tag("code", code)
        .register(meterRegistry)
        .increment();
    return ResponseEntity.status(status).body(new ErrorResponse(code, message));
  }

  public record ErrorResponse(String code, String message) {
  }
}
