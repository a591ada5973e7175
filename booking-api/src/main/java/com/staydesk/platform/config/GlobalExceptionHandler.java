package com.staydesk.platform.config;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import com.staydesk.platform.exceptions.CodedError;
import com.staydesk.platform.exceptions.CodedErrorException;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CodedErrorException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleCodedErrorException(CodedErrorException ex) {
        return Mono.deferContextual(ctx -> {
            String traceId = ctx.getOrDefault("traceId", generateTraceId());
            logError(traceId, ex);

            ErrorResponse error = ErrorResponse.builder()
                    .code(ex.getError().getCode())
                    .message(buildUserFriendlyMessage(ex))
                    .traceId(traceId)
                    .documentationUrl(ex.getError().getDocumentationUrl())
                    .variables(ex.getVariables())
                    .build();

            return Mono.just(new ResponseEntity<>(error, statusOf(ex.getError())));
        });
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        return Mono.deferContextual(ctx -> {
            String traceId = ctx.getOrDefault("traceId", generateTraceId());
            logError(traceId, ex);

            Map<String, Object> variables = new HashMap<>();
            variables.put("fields", ex.getBindingResult().getFieldErrors().stream()
                    .map(error -> Map.of(
                            "field", error.getField(),
                            "message", String.valueOf(error.getDefaultMessage())))
                    .toList());

            ErrorResponse error = ErrorResponse.builder()
                    .code(CodedError.INVALID_INPUT.getCode())
                    .message("Validation failed")
                    .traceId(traceId)
                    .documentationUrl(CodedError.INVALID_INPUT.getDocumentationUrl())
                    .variables(variables)
                    .build();

            return Mono.just(new ResponseEntity<>(error, HttpStatus.UNPROCESSABLE_ENTITY));
        });
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException ex) {
        return Mono.deferContextual(ctx -> {
            String traceId = ctx.getOrDefault("traceId", generateTraceId());
            logError(traceId, ex);

            ErrorResponse error = ErrorResponse.builder()
                    .code(CodedError.INVALID_INPUT.getCode())
                    .message(CodedError.INVALID_INPUT.getDefaultMessage())
                    .traceId(traceId)
                    .documentationUrl(CodedError.INVALID_INPUT.getDocumentationUrl())
                    .build();

            return Mono.just(new ResponseEntity<>(error, HttpStatus.BAD_REQUEST));
        });
    }

    @ExceptionHandler(DataAccessException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDataAccessException(DataAccessException ex) {
        return Mono.deferContextual(ctx -> {
            String traceId = ctx.getOrDefault("traceId", generateTraceId());
            logError(traceId, ex);

            ErrorResponse error = ErrorResponse.builder()
                    .code(CodedError.RESERVATION_STORE_UNAVAILABLE.getCode())
                    .message(CodedError.RESERVATION_STORE_UNAVAILABLE.getDefaultMessage())
                    .traceId(traceId)
                    .documentationUrl(CodedError.RESERVATION_STORE_UNAVAILABLE.getDocumentationUrl())
                    .build();

            return Mono.just(new ResponseEntity<>(error, HttpStatus.SERVICE_UNAVAILABLE));
        });
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleException(Exception ex) {
        return Mono.deferContextual(ctx -> {
            String traceId = ctx.getOrDefault("traceId", generateTraceId());
            logError(traceId, ex);

            ErrorResponse error = ErrorResponse.builder()
                    .code(CodedError.INTERNAL_ERROR.getCode())
                    .message("An unexpected error occurred")
                    .traceId(traceId)
                    .build();

            return Mono.just(new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR));
        });
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString();
    }

    private void logError(String traceId, Exception ex) {
        log.error("Error occurred - TraceId: {} - Message: {}", traceId, ex.getMessage(), ex);
    }

    private String buildUserFriendlyMessage(CodedErrorException ex) {
        CodedError error = ex.getError();
        Map<String, Object> variables = ex.getVariables();

        switch (error) {
            case RESERVATION_NOT_FOUND:
                Object reservationId = variables.get("reservationId");
                return reservationId != null ? String.format("Reservation %s was not found", reservationId)
                        : error.getDefaultMessage();

            case INVALID_INTERVAL:
                Object checkIn = variables.get("checkIn");
                Object checkOut = variables.get("checkOut");
                return checkIn != null && checkOut != null
                        ? String.format("Check-out %s must be strictly after check-in %s", checkOut, checkIn)
                        : error.getDefaultMessage();

            default:
                return error.getDefaultMessage();
        }
    }

    static HttpStatus statusOf(CodedError error) {
        if (error == CodedError.INTERNAL_ERROR) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (error.getCode().startsWith("VAL")) {
            return HttpStatus.BAD_REQUEST;
        }
        if (error.getCode().startsWith("RES")) {
            return HttpStatus.NOT_FOUND;
        }
        if (error.isInfrastructure()) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
