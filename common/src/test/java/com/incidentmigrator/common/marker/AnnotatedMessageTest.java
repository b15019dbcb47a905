package com.incidentmigrator.common.marker;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnnotatedMessageTest {

    @Test
    void shouldRenderParsedMessageUnchanged() {
        var original = "Line one @pagerduty-api\n  indented @webhook-incident-io\ttabbed";

        assertThat(AnnotatedMessage.parse(original, Provider.PAGERDUTY).render()).isEqualTo(original);
    }

    @Test
    void shouldRemoveProviderMarkersAndKeepDestinationMarkers() {
        var message = AnnotatedMessage.parse("Alert @pagerduty-x @webhook-incident-io-y", Provider.PAGERDUTY);

        assertThat(message.withoutProviderMarkers().render()).isEqualTo("Alert @webhook-incident-io-y");
    }

    @Test
    void shouldCollapseSpacesAroundRemovedMarkers() {
        var message = AnnotatedMessage.parse("A @pagerduty-one  @pagerduty-two   B", Provider.PAGERDUTY);

        assertThat(message.withoutProviderMarkers().render()).isEqualTo("A B");
    }

    @Test
    void shouldKeepSpaceBetweenKeptMarkerAndFollowingText() {
        var message = AnnotatedMessage.parse("@webhook-incident-io @pagerduty-x then", Provider.PAGERDUTY);

        assertThat(message.withoutProviderMarkers().render()).isEqualTo("@webhook-incident-io then");
    }

    @Test
    void shouldKeepLineBreaksWhenRemovingMarkers() {
        var message = AnnotatedMessage.parse("Title\n@webhook-incident-io\nBody text", Provider.PAGERDUTY);

        assertThat(message.withoutDestinationMarkers().render()).isEqualTo("Title\nBody text");
    }

    @Test
    void shouldTrimWhenMarkerWasAtEitherEnd() {
        var message = AnnotatedMessage.parse("@webhook-incident-io body @webhook-incident-io-team", Provider.PAGERDUTY);

        assertThat(message.withoutDestinationMarkers().render()).isEqualTo("body");
    }

    @Test
    void shouldAppendMarkerWithSingleSeparator() {
        var message = AnnotatedMessage.parse("High CPU @pagerduty-api-critical ", Provider.PAGERDUTY);

        var appended = message.append("@webhook-incident-io");

        assertThat(appended.render()).isEqualTo("High CPU @pagerduty-api-critical @webhook-incident-io");
        assertThat(appended.destinationMarkers()).containsExactly("@webhook-incident-io");
    }

    @Test
    void shouldAppendToEmptyMessageWithoutLeadingSpace() {
        assertThat(AnnotatedMessage.parse("", Provider.PAGERDUTY).append("@webhook-incident-io").render())
                .isEqualTo("@webhook-incident-io");
    }

    @Test
    void shouldExposeMarkerViews() {
        var message = AnnotatedMessage.parse("@pagerduty-a @opsgenie-b @webhook-incident-io", Provider.PAGERDUTY);

        assertThat(message.providerServiceKeys()).containsExactly("a");
        assertThat(message.destinationMarkers()).containsExactly("@webhook-incident-io");
    }

    @Test
    void shouldResolveProviderFromSource() {
        assertThat(Provider.fromSource(null)).isEqualTo(Provider.PAGERDUTY);
        assertThat(Provider.fromSource(" Opsgenie ")).isEqualTo(Provider.OPSGENIE);
        assertThatThrownBy(() -> Provider.fromSource("victorops"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("victorops");
    }
}
