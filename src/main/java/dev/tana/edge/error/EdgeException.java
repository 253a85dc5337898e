package dev.tana.edge.error;

import java.util.Objects;

/**
 * Exception carrying the failure class and the error constructor the guest should observe.
 */
public final class EdgeException extends RuntimeException {
    public static final String GUEST_ERROR = "Error";
    public static final String GUEST_TYPE_ERROR = "TypeError";

    private final ErrorKind kind;
    private final String guestName;

    public EdgeException(ErrorKind kind, String guestName, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.guestName = guestName == null ? GUEST_ERROR : guestName;
    }

    public static EdgeException validation(String message) {
        return new EdgeException(ErrorKind.VALIDATION, GUEST_ERROR, message, null);
    }

    public static EdgeException typeError(String message) {
        return new EdgeException(ErrorKind.VALIDATION, GUEST_TYPE_ERROR, message, null);
    }

    public static EdgeException limit(String message) {
        return new EdgeException(ErrorKind.LIMIT, GUEST_ERROR, message, null);
    }

    public static EdgeException transport(String message, Throwable cause) {
        return new EdgeException(ErrorKind.TRANSPORT, GUEST_ERROR, message, cause);
    }

    public static EdgeException setup(String message) {
        return new EdgeException(ErrorKind.SETUP, GUEST_ERROR, message, null);
    }

    public static EdgeException setup(String message, Throwable cause) {
        return new EdgeException(ErrorKind.SETUP, GUEST_ERROR, message, cause);
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Name of the JavaScript error constructor used when the failure is rethrown in the guest.
     */
    public String guestName() {
        return guestName;
    }
}
