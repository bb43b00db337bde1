package com.raisket.advisor.controller;

import com.raisket.advisor.controller.dto.ErrorResponseDto;
import com.raisket.advisor.planning.DebtUnpayableException;
import com.raisket.advisor.planning.InsufficientIncomeException;
import com.raisket.advisor.planning.InvalidInputException;
import com.raisket.advisor.planning.PaymentTooLowException;
import com.raisket.advisor.security.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidInput(InvalidInputException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage(), Map.of("violations", ex.violations()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException ex) {
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be read", Map.of());
    }

    @ExceptionHandler(DebtUnpayableException.class)
    public ResponseEntity<ErrorResponseDto> handleDebtUnpayable(DebtUnpayableException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("debt", ex.debtName());
        if (ex.getCause() instanceof PaymentTooLowException tooLow) {
            details.put("payment", tooLow.payment());
            details.put("monthlyInterest", tooLow.monthlyInterest());
        }
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "DEBT_UNPAYABLE", ex.getMessage(), details);
    }

    @ExceptionHandler(PaymentTooLowException.class)
    public ResponseEntity<ErrorResponseDto> handlePaymentTooLow(PaymentTooLowException ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "PAYMENT_TOO_LOW", ex.getMessage(), Map.of(
                "payment", ex.payment(),
                "monthlyInterest", ex.monthlyInterest()
        ));
    }

    @ExceptionHandler(InsufficientIncomeException.class)
    public ResponseEntity<ErrorResponseDto> handleInsufficientIncome(InsufficientIncomeException ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "INSUFFICIENT_INCOME", ex.getMessage(), Map.of(
                "required", ex.required(),
                "available", ex.available()
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of("reason", reason));
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
