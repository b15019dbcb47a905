package com.incidentmigrator.migrator.domain.exceptions;

public class ConnectivityException extends RuntimeException {

    private ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConnectivityException monitorsUnavailable(Throwable cause) {
        return new ConnectivityException("Failed to fetch monitors: " + cause.getMessage(), cause);
    }
}
