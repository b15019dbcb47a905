package com.incidentmigrator.migrator.domain.exceptions;

import lombok.Getter;

/**
 * A remote call reached the monitoring platform and was rejected, or failed in transit.
 */
@Getter
public class ApiException extends RuntimeException {

    private final String remoteError;

    private ApiException(String message, String remoteError, Throwable cause) {
        super(message, cause);
        this.remoteError = remoteError;
    }

    public static ApiException of(String action, String remoteError, Throwable cause) {
        return new ApiException("Failed to " + action + ": " + remoteError, remoteError, cause);
    }
}
