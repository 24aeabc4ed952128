package com.backstop.dispatch.api;

import com.backstop.core.resource.ResourceNotFoundException;

/**
 * Failure reported by a remote host. Rebuilt as the closest local error type so the
 * classifiers see the same shape they would in-process.
 */
public class ReportedFailure extends RuntimeException {

    private final String errorType;

    public ReportedFailure(String errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public String getErrorType() {
        return errorType;
    }

    static Throwable from(FailureRequest request) {
        String type = request.errorType() != null ? request.errorType() : "";
        String message = request.message();
        if (type.endsWith("IllegalStateException")) {
            return new IllegalStateException(message);
        }
        if (type.endsWith("NotFoundException") || type.endsWith("FileNotFoundException")) {
            return new ResourceNotFoundException(type, message);
        }
        if (type.endsWith("OutOfMemoryError")) {
            return new OutOfMemoryError(message);
        }
        return new ReportedFailure(type.isEmpty() ? "Unknown" : type, message);
    }
}
