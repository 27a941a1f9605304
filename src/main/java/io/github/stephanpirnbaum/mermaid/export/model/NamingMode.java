package io.github.stephanpirnbaum.mermaid.export.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * How output files are named.
 *
 * <ul>
 *     <li>{@link #VERSIONED}: one file per distinct content, {@code diagram-01-a4b2c8ef.svg}. Repeated content reuses the existing file.</li>
 *     <li>{@link #OVERWRITE}: one stable file per base name and format, {@code diagram1.svg}, rewritten on every export.</li>
 * </ul>
 *
 * @author Stephan Pirnbaum
 */
@RequiredArgsConstructor
public enum NamingMode {

    VERSIONED("versioned"),
    OVERWRITE("overwrite");

    private final String representation;

    @JsonValue
    public String getRepresentation() {
        return representation;
    }

    @JsonCreator
    public static NamingMode fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (NamingMode mode : values()) {
            if (mode.representation.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown naming mode: " + value);
    }

}
