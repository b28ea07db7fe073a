package com.example.routex.service.segment;

import com.example.routex.model.segment.Segment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Reads and writes segment descriptors.
 * <p>
 * Stored form is a JSON object with a {@code type} field, e.g. {@code {"type":"inactive_for","days":14}}.
 * Administrators may also type a bare tag ({@code donors}, {@code inactive_for:14}).
 * Legacy tags are accepted: {@code inactive_30d}, and {@code custom_sql} with a {@code where} field.
 */
@Component
@RequiredArgsConstructor
public class SegmentCodec {

    static final String LEGACY_INACTIVE_30D = "inactive_30d";
    static final String LEGACY_CUSTOM_SQL = "custom_sql";

    private final ObjectMapper objectMapper;

    public Segment parse(String raw) {
        if (!StringUtils.hasText(raw)) {
            return new Segment.AllSubscribed();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("{")) {
            return fromJson(trimmed);
        }
        return fromBareTag(trimmed);
    }

    public String toJson(Segment segment) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", segment.tag());
        if (segment instanceof Segment.InactiveFor inactive) {
            long hours = inactive.inactivity().toHours();
            if (hours % 24 == 0) {
                node.put("days", hours / 24);
            } else {
                node.put("hours", hours);
            }
        } else if (segment instanceof Segment.CustomFilter filter) {
            node.put("expression", filter.expression());
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize segment " + segment, e);
        }
    }

    private Segment fromJson(String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidSegmentException("Segment is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!node.isObject()) {
            throw new InvalidSegmentException("Segment must be a JSON object");
        }
        String type = node.path("type").asText(Segment.TAG_ALL_SUBSCRIBED);
        switch (type) {
            case Segment.TAG_ALL_SUBSCRIBED:
                return new Segment.AllSubscribed();
            case Segment.TAG_NO_KEY:
                return new Segment.NoKey();
            case Segment.TAG_DONORS:
                return new Segment.Donors();
            case LEGACY_INACTIVE_30D:
                return new Segment.InactiveFor(Duration.ofDays(30));
            case Segment.TAG_INACTIVE_FOR:
                return new Segment.InactiveFor(inactivityOf(node));
            case Segment.TAG_CUSTOM_FILTER:
                return new Segment.CustomFilter(node.path("expression").asText(""));
            case LEGACY_CUSTOM_SQL:
                return new Segment.CustomFilter(node.path("where").asText(""));
            default:
                return new Segment.Unknown(type);
        }
    }

    private Segment fromBareTag(String text) {
        String tag = text;
        String argument = null;
        int colon = text.indexOf(':');
        if (colon > 0) {
            tag = text.substring(0, colon).trim();
            argument = text.substring(colon + 1).trim();
        }
        switch (tag) {
            case Segment.TAG_ALL_SUBSCRIBED:
                return new Segment.AllSubscribed();
            case Segment.TAG_NO_KEY:
                return new Segment.NoKey();
            case Segment.TAG_DONORS:
                return new Segment.Donors();
            case LEGACY_INACTIVE_30D:
                return new Segment.InactiveFor(Duration.ofDays(30));
            case Segment.TAG_INACTIVE_FOR:
                if (argument == null) {
                    throw new InvalidSegmentException("inactive_for needs a number of days, e.g. inactive_for:14");
                }
                try {
                    return new Segment.InactiveFor(positiveDuration(Duration.ofDays(Long.parseLong(argument))));
                } catch (NumberFormatException e) {
                    throw new InvalidSegmentException("inactive_for expects whole days, got '" + argument + "'", e);
                }
            case Segment.TAG_CUSTOM_FILTER:
            case LEGACY_CUSTOM_SQL:
                throw new InvalidSegmentException("custom_filter segments must be given as JSON: {\"type\":\"custom_filter\",\"expression\":\"...\"}");
            default:
                return new Segment.Unknown(tag);
        }
    }

    private Duration inactivityOf(JsonNode node) {
        JsonNode days = node.get("days");
        JsonNode hours = node.get("hours");
        if ((days != null && !days.canConvertToLong()) || (hours != null && !hours.canConvertToLong())) {
            throw new InvalidSegmentException("inactive_for expects integer 'days' and/or 'hours'");
        }
        Duration duration = Duration.ofDays(days == null ? 0 : days.asLong())
                .plusHours(hours == null ? 0 : hours.asLong());
        return positiveDuration(duration);
    }

    private Duration positiveDuration(Duration duration) {
        if (duration.isNegative() || duration.isZero()) {
            throw new InvalidSegmentException("inactive_for needs a positive duration");
        }
        return duration;
    }
}
