package io.github.stephanpirnbaum.mermaid.export.naming;

import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;

import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stable naming: {@code {cleanBaseName}{suffix}.{format}}, e.g. {@code architecture-flow2} becomes
 * {@code architecture-flow2.svg} and {@code diagram} becomes {@code diagram1.svg}.
 * <p>
 * The path only depends on base name and format. Rendering is never skipped, the stable file always reflects the
 * latest content. Trading deduplication for predictable names is a policy choice of this mode.
 *
 * @author Stephan Pirnbaum
 */
public class OverwriteNamingPolicy implements NamingPolicy {

    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)$");

    private static final String DEFAULT_SUFFIX = "1";

    @Override
    public PathCandidate computePath(Path directory, String baseName, ExportFormat format, String contentHash) {
        return new PathCandidate(directory.resolve(fileName(baseName, format)), null);
    }

    @Override
    public boolean shouldSkip(Path path, String contentHash) {
        return false;
    }

    static String fileName(String baseName, ExportFormat format) {
        Matcher matcher = TRAILING_NUMBER.matcher(baseName);
        String suffix = matcher.find() ? matcher.group(1) : DEFAULT_SUFFIX;
        String cleanBaseName = baseName.replaceAll("[-_]?\\d+$", "");
        return cleanBaseName + suffix + "." + format.getExtension();
    }

}
