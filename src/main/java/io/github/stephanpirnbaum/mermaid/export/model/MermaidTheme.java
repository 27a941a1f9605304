package io.github.stephanpirnbaum.mermaid.export.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * The built-in Mermaid themes.
 *
 * @author Stephan Pirnbaum
 */
@RequiredArgsConstructor
public enum MermaidTheme {

    DEFAULT("default"),
    DARK("dark"),
    FOREST("forest"),
    NEUTRAL("neutral");

    private final String representation;

    @JsonValue
    public String getRepresentation() {
        return representation;
    }

    @JsonCreator
    public static MermaidTheme fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MermaidTheme theme : values()) {
            if (theme.representation.equals(normalized)) {
                return theme;
            }
        }
        throw new IllegalArgumentException("Unknown Mermaid theme: " + value);
    }

}
