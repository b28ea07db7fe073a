package com.example.routex.service.schedule;

import com.example.routex.model.TriggerKind;
import com.example.routex.service.EngineConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds {@link ScheduleTrigger}s from the persisted (kind, spec) pair.
 * <p>
 * Cron specs are standard five-field crontab lines (a leading seconds field is added) or six-field
 * expressions. Interval specs are a unit-to-count mapping, either as JSON ({@code {"hours":2,"days":1}})
 * or as {@code hours=2, days=1}.
 */
@Component
@Slf4j
public class ScheduleTriggerFactory {

    static final Map<String, ChronoUnit> INTERVAL_UNITS = Map.of(
            "weeks", ChronoUnit.WEEKS,
            "days", ChronoUnit.DAYS,
            "hours", ChronoUnit.HOURS,
            "minutes", ChronoUnit.MINUTES,
            "seconds", ChronoUnit.SECONDS);

    private final ObjectMapper objectMapper;
    private final ZoneId zone;

    public ScheduleTriggerFactory(ObjectMapper objectMapper,
                                  @Value("${app.schedule.timezone:Europe/Helsinki}") String timezone) {
        this.objectMapper = objectMapper;
        try {
            this.zone = ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new EngineConfigurationException("Invalid schedule timezone '" + timezone + "'", e);
        }
        log.info("Schedules are evaluated in timezone {}", zone);
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * @throws EngineConfigurationException if there is no trigger for {@code kind}
     * @throws InvalidScheduleException     if {@code spec} is malformed for that kind
     */
    public ScheduleTrigger create(String kind, String spec) {
        TriggerKind triggerKind = TriggerKind.fromTag(kind)
                .orElseThrow(() -> new EngineConfigurationException("Unsupported schedule type '" + kind + "'"));
        switch (triggerKind) {
            case CRON:
                return new ScheduleTrigger.Cron(parseCron(spec), zone);
            case INTERVAL:
                return new ScheduleTrigger.Interval(toPeriod(parseInterval(spec)));
            default:
                throw new EngineConfigurationException("No trigger handler for schedule type '" + kind + "'");
        }
    }

    /**
     * Returns the form a spec is stored in: the trimmed cron line, or the interval mapping as JSON.
     */
    public String canonicalSpec(String kind, String spec) {
        TriggerKind triggerKind = TriggerKind.fromTag(kind)
                .orElseThrow(() -> new EngineConfigurationException("Unsupported schedule type '" + kind + "'"));
        if (triggerKind == TriggerKind.CRON) {
            parseCron(spec);
            return spec.trim();
        }
        Map<String, Long> units = parseInterval(spec);
        toPeriod(units);
        try {
            return objectMapper.writeValueAsString(units);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize interval " + units, e);
        }
    }

    CronExpression parseCron(String spec) {
        if (!StringUtils.hasText(spec)) {
            throw new InvalidScheduleException("Cron expression is empty");
        }
        String trimmed = spec.trim();
        String expression = trimmed;
        if (!trimmed.startsWith("@") && trimmed.split("\\s+").length == 5) {
            expression = "0 " + trimmed;
        }
        try {
            return CronExpression.parse(expression);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + trimmed + "': " + e.getMessage(), e);
        }
    }

    Map<String, Long> parseInterval(String spec) {
        if (!StringUtils.hasText(spec)) {
            throw new InvalidScheduleException("Interval is empty, use e.g. minutes=30, hours=2");
        }
        String trimmed = spec.trim();
        Map<String, Long> units = trimmed.startsWith("{") ? intervalFromJson(trimmed) : intervalFromPairs(trimmed);
        if (units.isEmpty()) {
            throw new InvalidScheduleException("Interval needs at least one unit");
        }
        return units;
    }

    private Map<String, Long> intervalFromJson(String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidScheduleException("Interval is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!node.isObject()) {
            throw new InvalidScheduleException("Interval must be a JSON object");
        }
        Map<String, Long> units = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isIntegralNumber()) {
                throw new InvalidScheduleException("Interval value for '" + field.getKey() + "' must be a whole number");
            }
            putUnit(units, field.getKey(), field.getValue().asLong());
        }
        return units;
    }

    private Map<String, Long> intervalFromPairs(String text) {
        Map<String, Long> units = new LinkedHashMap<>();
        for (String part : text.split(",")) {
            if (part.isBlank()) continue;
            String[] keyValue = part.split("=", 2);
            if (keyValue.length != 2) {
                throw new InvalidScheduleException("Use the format minutes=30, hours=2");
            }
            try {
                putUnit(units, keyValue[0].trim(), Long.parseLong(keyValue[1].trim()));
            } catch (NumberFormatException e) {
                throw new InvalidScheduleException("Interval values must be whole numbers, got '" + keyValue[1].trim() + "'", e);
            }
        }
        return units;
    }

    private void putUnit(Map<String, Long> units, String unit, long count) {
        if (!INTERVAL_UNITS.containsKey(unit)) {
            throw new InvalidScheduleException("Unknown interval unit '" + unit + "', expected one of " + INTERVAL_UNITS.keySet());
        }
        if (count < 0) {
            throw new InvalidScheduleException("Interval value for '" + unit + "' must not be negative");
        }
        units.put(unit, count);
    }

    private Duration toPeriod(Map<String, Long> units) {
        Duration period = Duration.ZERO;
        try {
            for (Map.Entry<String, Long> unit : units.entrySet()) {
                period = period.plus(INTERVAL_UNITS.get(unit.getKey()).getDuration().multipliedBy(unit.getValue()));
            }
        } catch (ArithmeticException e) {
            throw new InvalidScheduleException("Interval is too long", e);
        }
        if (period.isZero()) {
            throw new InvalidScheduleException("Interval must be longer than zero");
        }
        return period;
    }
}
