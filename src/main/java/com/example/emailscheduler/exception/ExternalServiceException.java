package com.example.emailscheduler.exception;

import lombok.Getter;

/**
 * Exception for mail gateway or processing pipeline communication failures
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final Integer httpStatusCode;
    private final String responseBody;

    public ExternalServiceException(String serviceName, String message, Exception cause) {
        super(String.format("[%s] %s", serviceName, message), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public ExternalServiceException(String serviceName, Exception cause) {
        this(serviceName, cause.getMessage(), cause);
    }

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, responseBody));
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
    }

    /**
     * 4xx errors other than 408 and 429 will not succeed on a retry
     */
    public boolean isRetryable() {
        return httpStatusCode == null || httpStatusCode >= 500 || httpStatusCode == 408 || httpStatusCode == 429;
    }
}
