package io.github.byzatic.cronengine.base_exceptions;

/**
 * Raised when an external runtime process cannot be started or supervised.
 */
public class ExternalProcessException extends Exception {
    private final Integer exitCode;

    public ExternalProcessException(String message) {
        this(message, null, null);
    }

    public ExternalProcessException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ExternalProcessException(String message, Integer exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    /**
     * @return exit code of the process, or {@code null} if it never exited normally
     */
    public Integer getExitCode() {
        return exitCode;
    }
}
