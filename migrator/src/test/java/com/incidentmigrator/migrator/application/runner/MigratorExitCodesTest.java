package com.incidentmigrator.migrator.application.runner;

import com.incidentmigrator.migrator.domain.exceptions.ConfigurationException;
import com.incidentmigrator.migrator.domain.exceptions.ConnectivityException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class MigratorExitCodesTest {

    private final MigratorExitCodes exitCodes = new MigratorExitCodes();

    @Test
    void shouldMapConfigurationErrorWrappedByStartup() {
        var failure = new IllegalStateException("Failed to execute ApplicationRunner",
                ConfigurationException.missingField("migrator.operation"));

        assertThat(exitCodes.getExitCode(failure)).isEqualTo(2);
    }

    @Test
    void shouldMapConnectivityError() {
        var failure = ConnectivityException.monitorsUnavailable(new IOException("Connection refused"));

        assertThat(exitCodes.getExitCode(failure)).isEqualTo(3);
    }

    @Test
    void shouldMapAnythingElseToGenericFailure() {
        assertThat(exitCodes.getExitCode(new IllegalArgumentException("bad pattern"))).isEqualTo(1);
    }
}
