package io.github.stephanpirnbaum.mermaid.export.strategy;

import lombok.NonNull;
import lombok.Value;

/**
 * Bytes rendered for a job together with the backend that produced them.
 *
 * @author Stephan Pirnbaum
 */
@Value
public class RenderOutcome {

    @NonNull
    String backendName;

    @NonNull
    byte[] bytes;

    /**
     * {@code true} if the first backend failed and a fallback rendered the artifact.
     */
    boolean fallbackUsed;

}
