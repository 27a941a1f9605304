package io.github.stephanpirnbaum.mermaid.export.naming;

import io.github.stephanpirnbaum.mermaid.export.model.DiagramSource;
import io.github.stephanpirnbaum.mermaid.export.model.SourceKind;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * Derives filesystem-safe base names for output files.
 *
 * @author Stephan Pirnbaum
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class BaseNames {

    public static final String FALLBACK_BASE_NAME = "diagram";

    /**
     * Base name for the artifacts of a source: the file name without extension, suffixed with the
     * one based block number if the source is one of several blocks of the same document.
     */
    public static String forSource(DiagramSource source) {
        String stem = stripExtension(source.getPath().getFileName().toString());
        if (source.getKind() == SourceKind.EMBEDDED_BLOCK
                && source.getBlockIndex() != null
                && source.getDocumentBlockCount() > 1) {
            stem = stem + "-" + (source.getBlockIndex() + 1);
        }
        return sanitize(stem);
    }

    /**
     * Removes path traversal sequences, path separators and characters invalid on common filesystems.
     * Whitespace becomes a dash, dash runs collapse, leading and trailing dashes and dots are dropped and the
     * result is lower case. Never returns an empty string.
     */
    public static String sanitize(String rawName) {
        if (StringUtils.isBlank(rawName)) {
            return FALLBACK_BASE_NAME;
        }
        String name = rawName
                .replace("..", "-")
                .replaceAll("[<>:\"/\\\\|?*\\p{Cntrl}]", "-")
                .replaceAll("\\s+", "-")
                .replaceAll("-+", "-")
                .replaceAll("^[-.]+|[-.]+$", "")
                .toLowerCase(Locale.ROOT);
        return name.isEmpty() ? FALLBACK_BASE_NAME : name;
    }

    static String stripExtension(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

}
