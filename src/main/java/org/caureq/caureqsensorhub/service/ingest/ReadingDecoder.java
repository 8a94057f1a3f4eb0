package org.caureq.caureqsensorhub.service.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns a subscription message into a {@link RawReading}.
 *
 * Topic layout is {@code sensors/<type>/<location>}: the sensor id becomes {@code <type>_<location>},
 * the location label is title-cased with underscores as spaces. A {@code sensor_id} in the payload
 * overrides the id derived from the topic. Validation of the values themselves is left to the gateway.
 */
@Component
@RequiredArgsConstructor
public class ReadingDecoder {
    private final ObjectMapper mapper;

    public RawReading decode(String topic, byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new MalformedPayloadException("empty payload on " + topic);
        }
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            throw new MalformedPayloadException("invalid JSON on " + topic, e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedPayloadException("payload on " + topic + " is not a JSON object");
        }

        var parts = topic == null ? new String[0] : topic.split("/");
        String type = null, location = null, topicId = null;
        if (parts.length >= 3 && !parts[1].isBlank() && !parts[2].isBlank()) {
            type = parts[1];
            location = titleCase(parts[2]);
            topicId = parts[1] + "_" + parts[2];
        }

        var sensorId = text(root, "sensor_id");
        if (sensorId == null) sensorId = topicId;
        if (sensorId == null) {
            throw new MalformedPayloadException("cannot derive a sensor id from topic " + topic);
        }
        if (type == null) type = text(root, "type");

        return new RawReading(sensorId, type,
                type == null ? null : titleCase(type) + " Sensor",
                location,
                number(root.get("value")),
                text(root, "unit"),
                timestamp(root.get("timestamp")));
    }

    private static String text(JsonNode root, String field) {
        var n = root.get(field);
        if (n == null || n.isNull()) return null;
        var s = n.asText().trim();
        return s.isEmpty() ? null : s;
    }

    /** Numbers and numeric strings; anything else is treated as missing. */
    private static Double number(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (n.isNumber()) return n.doubleValue();
        if (n.isTextual()) {
            try {
                return Double.valueOf(n.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedPayloadException("value is not numeric: " + n.asText(), e);
            }
        }
        throw new MalformedPayloadException("value is not numeric: " + n);
    }

    private static String timestamp(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (n.isIntegralNumber()) return Long.toString(n.longValue());
        return n.asText();
    }

    static String titleCase(String raw) {
        return Arrays.stream(raw.split("[_\\s]+"))
                .filter(w -> !w.isEmpty())
                .map(w -> w.substring(0, 1).toUpperCase(Locale.ROOT) + w.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }
}
