package ru.javaboys.huntymatch.ai;

/**
 * Failure of a call to the text-generation model.
 */
public class OracleException extends RuntimeException {

    public enum ErrorCode {
        UNAVAILABLE,
        CALL_FAILED,
        EMPTY_RESPONSE,
        RATE_LIMITED
    }

    private final ErrorCode errorCode;

    public OracleException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public OracleException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
