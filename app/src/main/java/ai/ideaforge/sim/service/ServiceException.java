package ai.ideaforge.sim.service;

import java.util.Objects;

/**
 * Structured failure carried by a {@link ServiceResult}: a stable machine code plus the HTTP status a route would answer with.
 */
public class ServiceException extends RuntimeException {

    private final String code;
    private final int httpStatus;

    public ServiceException(String message, String code, int httpStatus) {
        this(message, code, httpStatus, null);
    }

    public ServiceException(String message, String code, int httpStatus, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        if (httpStatus < 400 || httpStatus > 599) {
            throw new IllegalArgumentException("httpStatus must be an error status but was " + httpStatus);
        }
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
