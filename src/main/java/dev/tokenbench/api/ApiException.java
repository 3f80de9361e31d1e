package dev.tokenbench.api;

/** A Files or Skills API call failed: non-2xx status, I/O error or an unparsable body. */
public class ApiException extends RuntimeException {
    public ApiException(String message) {
        super(message);
    }

    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(Throwable cause) {
        super(cause);
    }
}
