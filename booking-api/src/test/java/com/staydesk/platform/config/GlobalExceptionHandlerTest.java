package com.staydesk.platform.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.LocalDate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import com.staydesk.platform.exceptions.CodedError;
import com.staydesk.platform.exceptions.CodedErrorException;

import reactor.test.StepVerifier;
import reactor.util.context.Context;

@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Error families map to HTTP statuses")
    void shouldMapStatuses() {
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusOf(CodedError.INVALID_INTERVAL));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusOf(CodedError.RESERVATION_NOT_FOUND));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                GlobalExceptionHandler.statusOf(CodedError.SESSION_STORE_UNAVAILABLE));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                GlobalExceptionHandler.statusOf(CodedError.RESERVATION_STORE_UNAVAILABLE));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, GlobalExceptionHandler.statusOf(CodedError.INTERNAL_ERROR));
    }

    @Test
    @DisplayName("Coded errors carry their code, variables and the trace id of the context")
    void shouldRenderCodedError() {
        CodedErrorException exception = new CodedErrorException(CodedError.INVALID_INTERVAL,
                "checkIn", LocalDate.of(2025, 6, 3), "checkOut", LocalDate.of(2025, 6, 1));

        StepVerifier.create(handler.handleCodedErrorException(exception)
                .contextWrite(Context.of("traceId", "trace-1")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("VAL010", response.getBody().getCode());
                    assertEquals("trace-1", response.getBody().getTraceId());
                    assertEquals("Check-out 2025-06-01 must be strictly after check-in 2025-06-03",
                            response.getBody().getMessage());
                    assertEquals("2025-06-03", response.getBody().getVariables().get("checkIn"));
                })
                .verifyComplete();
    }
}
