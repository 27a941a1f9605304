package io.github.stephanpirnbaum.mermaid.export.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * The output formats a diagram can be exported to.
 *
 * @author Stephan Pirnbaum
 */
@RequiredArgsConstructor
public enum ExportFormat {

    SVG("svg", false),
    PNG("png", true),
    PDF("pdf", false),
    WEBP("webp", true),
    JPG("jpg", true),
    JPEG("jpeg", true);

    private final String extension;

    private final boolean raster;

    /**
     * @return the file extension without leading dot, also used as directory name when organizing by format.
     */
    @JsonValue
    public String getExtension() {
        return extension;
    }

    public boolean isRaster() {
        return raster;
    }

    @JsonCreator
    public static ExportFormat fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExportFormat format : values()) {
            if (format.extension.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported export format: " + value);
    }

}
