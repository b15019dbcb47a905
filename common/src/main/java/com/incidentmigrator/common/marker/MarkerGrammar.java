package com.incidentmigrator.common.marker;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Recognisers for the two marker families embedded in monitor messages:
 * provider service markers ({@code @pagerduty-api}) and destination webhook markers
 * ({@code @webhook-incident-io}, {@code @webhook-incident-io-platform-team}).
 *
 * <p>All methods are total: a message without markers yields an empty result, never an error.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class MarkerGrammar {

    public static final String DESTINATION = "incident-io";
    public static final String WEBHOOK_MARKER_PREFIX = "@webhook-";

    private static final String TOKEN = "[A-Za-z0-9_-]+";
    private static final String DESTINATION_REGEX =
            Pattern.quote(WEBHOOK_MARKER_PREFIX + DESTINATION) + "(?:-" + TOKEN + ")?(?![A-Za-z0-9_])";

    private static final Pattern DESTINATION_PATTERN = Pattern.compile(DESTINATION_REGEX);
    private static final Map<Provider, Pattern> PROVIDER_PATTERNS = new EnumMap<>(Provider.class);
    private static final Map<Provider, Pattern> SEGMENT_PATTERNS = new EnumMap<>(Provider.class);

    static {
        for (var provider : Provider.values()) {
            var providerRegex = "@" + Pattern.quote(provider.getLiteral()) + "-(?<service>" + TOKEN + ")";
            PROVIDER_PATTERNS.put(provider, Pattern.compile(providerRegex));
            SEGMENT_PATTERNS.put(provider, Pattern.compile(
                    "(?<provider>" + providerRegex + ")|(?<destination>" + DESTINATION_REGEX + ")"));
        }
    }

    /**
     * Service keys of every {@code @<provider>-<service>} marker, in order of appearance, duplicates kept.
     */
    public static List<String> findProviderMarkers(String message, Provider provider) {
        if (message == null || message.isEmpty()) {
            return Collections.emptyList();
        }
        var matcher = PROVIDER_PATTERNS.get(provider).matcher(message);
        var services = new ArrayList<String>();
        while (matcher.find()) {
            services.add(matcher.group("service"));
        }
        return services;
    }

    /**
     * Exact destination marker substrings, including the leading {@code @}, in order of appearance.
     */
    public static List<String> findDestinationMarkers(String message) {
        if (message == null || message.isEmpty()) {
            return Collections.emptyList();
        }
        var matcher = DESTINATION_PATTERN.matcher(message);
        var markers = new ArrayList<String>();
        while (matcher.find()) {
            markers.add(matcher.group());
        }
        return markers;
    }

    /**
     * Splits a message into literal text and markers. Mentions of the provider that is not configured
     * stay literal.
     */
    public static List<MessageSegment> tokenize(String message, Provider provider) {
        if (message == null || message.isEmpty()) {
            return Collections.emptyList();
        }
        var matcher = SEGMENT_PATTERNS.get(provider).matcher(message);
        var segments = new ArrayList<MessageSegment>();
        var cursor = 0;
        while (matcher.find()) {
            if (matcher.start() > cursor) {
                segments.add(new MessageSegment.Literal(message.substring(cursor, matcher.start())));
            }
            if (matcher.group("provider") != null) {
                segments.add(new MessageSegment.ProviderMarker(provider, matcher.group("service"), matcher.group()));
            } else {
                segments.add(new MessageSegment.DestinationMarker(matcher.group()));
            }
            cursor = matcher.end();
        }
        if (cursor < message.length()) {
            segments.add(new MessageSegment.Literal(message.substring(cursor)));
        }
        return segments;
    }

    /**
     * Name of the webhook resource on the monitoring platform: {@code incident-io} or {@code incident-io-<team>}.
     */
    public static String resourceNameFor(String team) {
        if (team == null || team.isBlank()) {
            return DESTINATION;
        }
        return DESTINATION + "-" + team;
    }

    public static String markerFor(String resourceName) {
        return WEBHOOK_MARKER_PREFIX + resourceName;
    }
}
