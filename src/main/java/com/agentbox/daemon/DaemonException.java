package com.agentbox.daemon;

/**
 * A control request that failed. {@code code} is returned to the caller as the
 * {@code error} field and recorded on the {@code daemon_error} event.
 */
public class DaemonException extends RuntimeException {

    private final String code;
    private final int status;

    public DaemonException(String code, int status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }

    public DaemonException(String code, int status, String message) {
        this(code, status, message, null);
    }

    public String getCode() {
        return code;
    }

    public int getStatus() {
        return status;
    }
}
