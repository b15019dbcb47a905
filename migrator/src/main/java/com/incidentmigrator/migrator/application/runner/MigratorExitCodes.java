package com.incidentmigrator.migrator.application.runner;

import com.incidentmigrator.migrator.domain.exceptions.ConfigurationException;
import com.incidentmigrator.migrator.domain.exceptions.ConnectivityException;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.stereotype.Component;

/**
 * Process exit status for a failed run: 2 for configuration problems, 3 when monitors cannot be fetched.
 */
@Component
public class MigratorExitCodes implements ExitCodeExceptionMapper {

    static final int CONFIGURATION_ERROR = 2;
    static final int CONNECTIVITY_ERROR = 3;
    static final int FAILURE = 1;

    @Override
    public int getExitCode(Throwable exception) {
        for (var cause = exception; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConfigurationException) {
                return CONFIGURATION_ERROR;
            }
            if (cause instanceof ConnectivityException) {
                return CONNECTIVITY_ERROR;
            }
        }
        return FAILURE;
    }
}
