package com.astroslide.model;

/**
 * Explicit failure of an enhancement request. A request either produces a complete
 * image or ends with one of these; partial results are never returned.
 */
public class EnhancementException extends Exception {

    private final ErrorKind kind;

    public EnhancementException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EnhancementException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static EnhancementException invalid(String message) {
        return new EnhancementException(ErrorKind.INVALID_PARAMETER, message);
    }

    public static EnhancementException degenerate(String message) {
        return new EnhancementException(ErrorKind.DEGENERATE_INPUT, message);
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
