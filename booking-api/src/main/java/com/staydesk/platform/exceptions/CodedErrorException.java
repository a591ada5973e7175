package com.staydesk.platform.exceptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * Exception carrying a {@link CodedError} and the variables needed to render
 * it, e.g. {@code new CodedErrorException(CodedError.RESERVATION_NOT_FOUND, "reservationId", id)}.
 */
@Getter
public class CodedErrorException extends RuntimeException {

    private final CodedError error;
    private final Map<String, Object> variables;

    public CodedErrorException(CodedError error) {
        this(error, Collections.emptyMap(), null);
    }

    public CodedErrorException(CodedError error, String key, Object value) {
        this(error, Map.of(key, String.valueOf(value)), null);
    }

    public CodedErrorException(CodedError error, String key1, Object value1, String key2, Object value2) {
        this(error, Map.of(key1, String.valueOf(value1), key2, String.valueOf(value2)), null);
    }

    public CodedErrorException(CodedError error, Map<String, Object> variables, Throwable cause) {
        super(error.getDefaultMessage(), cause);
        this.error = error;
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public CodedErrorException(CodedError error, Throwable cause) {
        this(error, Collections.emptyMap(), cause);
    }
}
