package io.github.stephanpirnbaum.mermaid.export.batch;

import io.github.stephanpirnbaum.mermaid.export.discovery.DiscoveryOptions;
import io.github.stephanpirnbaum.mermaid.export.model.DiagramSource;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import io.github.stephanpirnbaum.mermaid.export.model.NamingMode;
import io.github.stephanpirnbaum.mermaid.export.model.RenderOptions;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Parameters of a batch run.
 *
 * @author Stephan Pirnbaum
 */
@Value
@Builder(toBuilder = true)
public class BatchRequest {

    /**
     * Directory to scan, or a single document.
     */
    @NonNull
    Path root;

    /**
     * Requested formats in export order. Every discovered source is exported to each of them.
     */
    @Singular
    List<ExportFormat> formats;

    @Builder.Default
    int maxDepth = DiscoveryOptions.DEFAULT_MAX_DEPTH;

    @NonNull
    @Builder.Default
    NamingMode namingMode = NamingMode.VERSIONED;

    /**
     * Where artifacts are written. {@code null} places them next to their source, a relative path is resolved
     * against the directory of each source.
     */
    @Nullable
    Path outputDirectory;

    /**
     * Whether each format gets its own subdirectory, e.g. {@code svg/} and {@code png/}.
     */
    boolean organizeByFormat;

    /**
     * Theme, size and background. The format is replaced per job.
     */
    @NonNull
    @Builder.Default
    RenderOptions renderOptions = RenderOptions.defaults();

    @Builder.Default
    int workers = 1;

    /**
     * Name of the backend to try first, {@code null} for automatic selection.
     */
    @Nullable
    String preferredBackend;

    @NonNull
    @Builder.Default
    List<String> includePatterns = DiscoveryOptions.DEFAULT_INCLUDE_PATTERNS;

    @NonNull
    @Builder.Default
    List<String> excludeDirectories = DiscoveryOptions.DEFAULT_EXCLUDE_DIRECTORIES;

    /**
     * Whether symbolically linked directories are descended into. The depth limit still applies.
     */
    boolean followSymlinks;

    public DiscoveryOptions toDiscoveryOptions() {
        return DiscoveryOptions.builder()
                .maxDepth(maxDepth)
                .includePatterns(includePatterns)
                .excludeDirectories(excludeDirectories)
                .followSymlinks(followSymlinks)
                .build();
    }

    /**
     * @return the directory the artifacts of {@code source} in {@code format} are written to.
     */
    public Path outputDirectoryFor(DiagramSource source, ExportFormat format) {
        Path sourceDirectory = source.getPath().toAbsolutePath().getParent();
        Path directory;
        if (outputDirectory == null) {
            directory = sourceDirectory;
        } else if (outputDirectory.isAbsolute()) {
            directory = outputDirectory;
        } else {
            directory = sourceDirectory.resolve(outputDirectory);
        }
        if (organizeByFormat) {
            directory = directory.resolve(format.getExtension());
        }
        return directory.normalize();
    }

    public RenderOptions renderOptionsFor(ExportFormat format) {
        return renderOptions.toBuilder().format(format).build();
    }

}
