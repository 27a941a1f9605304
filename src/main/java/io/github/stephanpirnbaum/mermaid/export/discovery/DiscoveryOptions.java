package io.github.stephanpirnbaum.mermaid.export.discovery;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Filters applied while walking a directory tree for diagram sources.
 *
 * @author Stephan Pirnbaum
 */
@Value
@Builder(toBuilder = true)
public class DiscoveryOptions {

    public static final int DEFAULT_MAX_DEPTH = 5;

    public static final List<String> DEFAULT_INCLUDE_PATTERNS = List.of("*.md", "*.mmd", "*.markdown");

    public static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of("node_modules", ".git", ".vscode", "dist", "build", ".next", ".nuxt");

    /**
     * Files directly inside the root are at depth 1. Files deeper than this are never visited.
     */
    @Builder.Default
    int maxDepth = DEFAULT_MAX_DEPTH;

    /**
     * Glob patterns matched case-insensitively against file names.
     */
    @NonNull
    @Singular
    List<String> includePatterns;

    /**
     * Directory names skipped with their whole subtree, compared case-insensitively.
     */
    @NonNull
    @Singular
    List<String> excludeDirectories;

    @Builder.Default
    boolean followSymlinks = false;

    public static DiscoveryOptions defaults() {
        return defaults(DEFAULT_MAX_DEPTH);
    }

    public static DiscoveryOptions defaults(int maxDepth) {
        return DiscoveryOptions.builder()
                .maxDepth(maxDepth)
                .includePatterns(DEFAULT_INCLUDE_PATTERNS)
                .excludeDirectories(DEFAULT_EXCLUDE_DIRECTORIES)
                .build();
    }

}
