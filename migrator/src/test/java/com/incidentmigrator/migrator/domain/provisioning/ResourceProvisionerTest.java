package com.incidentmigrator.migrator.domain.provisioning;

import com.incidentmigrator.migrator.domain.exceptions.ApiException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

@ExtendWith(MockitoExtension.class)
class ResourceProvisionerTest {

    private static final String URL = "https://api.incident.io/v2/alert_events/http/01HXYZ";

    @Mock
    private DestinationResourceGateway gateway;

    private Counter createdCounter;

    @BeforeEach
    void setUp() {
        createdCounter = new SimpleMeterRegistry().counter("migrator.webhooks.created");
    }

    private ResourceProvisioner provisioner(String url, String token, boolean simulate) {
        return new ResourceProvisioner(gateway, url, token, simulate, createdCounter);
    }

    @Test
    void shouldNotCallRemoteInDryRun() {
        // when
        var result = provisioner(URL, "token", true).ensureExists("incident-io-api", "api", Map.of());

        // then
        assertThat(result.success()).isTrue();
        then(gateway).shouldHaveNoInteractions();
    }

    @Test
    void shouldReuseExistingWebhook() {
        // given
        given(gateway.findByName("incident-io")).willReturn(Optional.of(DestinationResource.builder()
                .name("incident-io")
                .build()));

        // when
        var result = provisioner(URL, "token", false).ensureExists("incident-io", null, Map.of());

        // then
        assertThat(result.success()).isTrue();
        then(gateway).should(never()).create(any());
        assertThat(createdCounter.count()).isZero();
    }

    @Test
    void shouldCreateEachNameOnlyOnce() {
        // given
        var provisioner = provisioner(URL, "token", false);
        given(gateway.findByName("incident-io-api")).willReturn(Optional.empty());

        // when
        for (int i = 0; i < 5; i++) {
            provisioner.ensureExists("incident-io-api", "api", Map.of());
        }

        // then
        then(gateway).should(times(1)).findByName("incident-io-api");
        then(gateway).should(times(1)).create(any());
        assertThat(createdCounter.count()).isEqualTo(1.0);
    }

    @Test
    void shouldFailWithoutCredentials() {
        // given
        given(gateway.findByName("incident-io")).willReturn(Optional.empty());

        // when
        var result = provisioner(URL, " ", false).ensureExists("incident-io", null, Map.of());

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.reason()).isEqualTo("missing incident.io webhook URL or token");
        then(gateway).should(never()).create(any());
    }

    @Test
    void shouldNotRetryFailedCreationInSameRun() {
        // given
        var provisioner = provisioner(URL, "token", false);
        given(gateway.findByName("incident-io-api")).willReturn(Optional.empty());
        willThrow(ApiException.of("create webhook incident-io-api", "Bad Request", null))
                .given(gateway).create(any());

        // when
        var first = provisioner.ensureExists("incident-io-api", "api", Map.of());
        var second = provisioner.ensureExists("incident-io-api", "api", Map.of());

        // then
        assertThat(first.success()).isFalse();
        assertThat(second).isEqualTo(first);
        then(gateway).should(times(1)).create(any());
    }

    @Test
    void shouldTreatLookupFailureAsProvisioningFailure() {
        // given
        given(gateway.findByName("incident-io"))
                .willThrow(ApiException.of("get webhook incident-io", "Forbidden", null));

        // when
        var result = provisioner(URL, "token", false).ensureExists("incident-io", null, Map.of());

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.reason()).isEqualTo("Failed to get webhook incident-io: Forbidden");
    }

    @Test
    void shouldSendTeamAndMetadataInPayload() {
        // given
        given(gateway.findByName("incident-io-api")).willReturn(Optional.empty());

        // when
        provisioner(URL, "token", false).ensureExists("incident-io-api", "api", Map.of("env", "prod"));

        // then
        var captor = ArgumentCaptor.forClass(DestinationResource.class);
        then(gateway).should().create(captor.capture());
        var resource = captor.getValue();
        assertThat(resource.url()).isEqualTo(URL);
        assertThat(resource.authToken()).isEqualTo("token");
        assertThat(resource.payloadTemplate())
                .contains("\"team\": \"api\"")
                .contains("\"env\": \"prod\"")
                .contains("\"title\": \"$EVENT_TITLE\"");
    }
}
