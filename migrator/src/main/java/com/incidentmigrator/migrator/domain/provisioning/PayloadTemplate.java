package com.incidentmigrator.migrator.domain.provisioning;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * JSON-shaped webhook body with the monitoring platform's alert-context placeholders. Team and
 * metadata values are interpolated as text into the {@code metadata} object.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class PayloadTemplate {

    private static final String HEAD = """
            {
              "alert_transition": "$ALERT_TRANSITION",
              "deduplication_key": "$AGGREG_KEY-$ALERT_CYCLE_KEY",
              "title": "$EVENT_TITLE",
              "description": "$EVENT_MSG",
              "source_url": "$LINK",
              "metadata": {
                  "id": "$ID",
                  "alert_metric": "$ALERT_METRIC",
                  "alert_query": "$ALERT_QUERY",
                  "alert_scope": "$ALERT_SCOPE",
                  "alert_status": "$ALERT_STATUS",
                  "alert_title": "$ALERT_TITLE",
                  "alert_type": "$ALERT_TYPE",
                  "alert_url": "$LINK",
                  "alert_priority": "$ALERT_PRIORITY",
                  "date": "$DATE",
                  "event_type": "$EVENT_TYPE",
                  "hostname": "$HOSTNAME",
                  "last_updated": "$LAST_UPDATED",
                  "logs_sample": $LOGS_SAMPLE,
                  "org": {
                      "id": "$ORG_ID",
                      "name": "$ORG_NAME"
                  },
                  "snapshot_url": "$SNAPSHOT",
                  "tags": "$TAGS\"""";

    private static final String TAIL = """

              }
            }""";

    public static String render(String team, Map<String, String> metadata) {
        var payload = new StringBuilder(HEAD);
        if (team != null && !team.isBlank()) {
            appendField(payload, "team", team);
        }
        if (metadata != null) {
            metadata.forEach((key, value) -> appendField(payload, key, value));
        }
        return payload.append(TAIL).toString();
    }

    private static void appendField(StringBuilder payload, String key, String value) {
        payload.append(",\n      \"").append(escape(key)).append("\": \"").append(escape(value)).append('"');
    }

    private static String escape(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
