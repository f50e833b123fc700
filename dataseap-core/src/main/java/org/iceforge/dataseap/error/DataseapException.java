package org.iceforge.dataseap.error;

import java.util.Objects;

public class DataseapException extends RuntimeException {

    private final ErrorCode code;

    public DataseapException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public DataseapException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() {
        return code;
    }

    public static DataseapException invalidArgument(String message) {
        return new DataseapException(ErrorCode.INVALID_ARGUMENT, message);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
