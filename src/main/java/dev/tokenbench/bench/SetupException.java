package dev.tokenbench.bench;

/** The setup phase failed before any task ran. Fatal to the run. */
public class SetupException extends RuntimeException {
    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
