package dev.tokenbench.config;

import javax.annotation.Nullable;

/**
 * Thrown when a required input is missing before any benchmark setup is attempted: a credential,
 * the sample spreadsheet, a release asset, or an unknown task id.
 *
 * <p>This is fatal for the run. No record is written.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
