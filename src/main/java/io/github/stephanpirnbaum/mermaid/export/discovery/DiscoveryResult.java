package io.github.stephanpirnbaum.mermaid.export.discovery;

import io.github.stephanpirnbaum.mermaid.export.model.DiagramSource;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one discovery pass: the sources in traversal order and the paths below the root that could not be read.
 *
 * @author Stephan Pirnbaum
 */
@Value
public class DiscoveryResult {

    @NonNull
    Path root;

    @NonNull
    List<DiagramSource> sources;

    @NonNull
    List<UnreadablePath> unreadablePaths;

    @Value
    public static class UnreadablePath {

        Path path;

        String reason;

    }

}
