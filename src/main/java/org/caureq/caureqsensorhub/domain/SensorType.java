package org.caureq.caureqsensorhub.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Physical quantity a sensor measures. The code is the wire/config name,
 * the unit is what a reading gets when it arrives without one.
 */
public enum SensorType {
    TEMPERATURE("temperature", "°C"),
    HUMIDITY("humidity", "%"),
    PRESSURE("pressure", "hPa"),
    CO2("co2", "ppm"),
    LIGHT("light", "lx"),
    SOIL_MOISTURE("soil_moisture", "%");

    private final String code;
    private final String defaultUnit;

    SensorType(String code, String defaultUnit) {
        this.code = code;
        this.defaultUnit = defaultUnit;
    }

    @JsonValue
    public String code() { return code; }

    public String defaultUnit() { return defaultUnit; }

    /** Case-insensitive lookup by code or enum name; blank or unknown input resolves to empty. */
    public static Optional<SensorType> resolve(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        var s = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (var t : values()) {
            if (t.code.equals(s) || t.name().equalsIgnoreCase(s)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
