package com.reviewflow.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads the reviewer opt-out keys out of the free-form user preferences JSON.
 * Unknown keys are ignored; malformed documents read as "no preferences".
 */
public final class ReviewerPreferencesJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(ReviewerPreferencesJsonCodec.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static final String FIELD_OPT_OUT = "reviewerOptOut";
    static final String FIELD_OPT_OUT_UNTIL = "reviewerOptOutUntil";
    static final String FIELD_TASK_TYPES = "reviewerTaskTypes";

    private ReviewerPreferencesJsonCodec() {
    }

    public static ReviewerPreferences fromJson(String rawJson) {
        if (!StringUtils.hasText(rawJson)) {
            return ReviewerPreferences.NONE;
        }

        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(rawJson);
        } catch (JsonProcessingException ex) {
            log.warn("Failed to parse reviewer preferences JSON: {}", ex.getOriginalMessage());
            return ReviewerPreferences.NONE;
        }
        if (root == null || !root.isObject()) {
            return ReviewerPreferences.NONE;
        }

        boolean optedOut = root.path(FIELD_OPT_OUT).isBoolean() && root.get(FIELD_OPT_OUT).booleanValue();
        OffsetDateTime optedOutUntil = parseTimestamp(root.path(FIELD_OPT_OUT_UNTIL));
        Set<String> taskTypes = parseTaskTypes(root.path(FIELD_TASK_TYPES));

        return new ReviewerPreferences(optedOut, optedOutUntil, taskTypes);
    }

    public static String toJson(ReviewerPreferences preferences) {
        if (preferences == null) {
            return null;
        }
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put(FIELD_OPT_OUT, preferences.optedOut());
        if (preferences.optedOutUntil() != null) {
            root.put(FIELD_OPT_OUT_UNTIL, preferences.optedOutUntil().toString());
        }
        if (!preferences.taskTypes().isEmpty()) {
            ArrayNode taskTypes = root.putArray(FIELD_TASK_TYPES);
            preferences.taskTypes().stream().sorted().forEach(taskTypes::add);
        }
        return root.toString();
    }

    private static OffsetDateTime parseTimestamp(JsonNode node) {
        if (!node.isTextual() || !StringUtils.hasText(node.textValue())) {
            return null;
        }
        try {
            return OffsetDateTime.parse(node.textValue().trim());
        } catch (DateTimeParseException ex) {
            log.warn("Ignoring unparseable {} value '{}'", FIELD_OPT_OUT_UNTIL, node.textValue());
            return null;
        }
    }

    private static Set<String> parseTaskTypes(JsonNode node) {
        if (!node.isArray()) {
            return Set.of();
        }
        Set<String> taskTypes = new LinkedHashSet<>();
        for (JsonNode element : node) {
            if (element.isTextual() && StringUtils.hasText(element.textValue())) {
                taskTypes.add(element.textValue().trim());
            }
        }
        return taskTypes;
    }
}
