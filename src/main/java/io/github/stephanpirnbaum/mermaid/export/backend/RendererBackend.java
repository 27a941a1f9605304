package io.github.stephanpirnbaum.mermaid.export.backend;

import io.github.stephanpirnbaum.mermaid.export.RenderFailureException;
import io.github.stephanpirnbaum.mermaid.export.model.RenderOptions;

/**
 * A renderer turning Mermaid text into the bytes of the requested format.
 * <p>
 * Implementations must be safe to call from several threads. Grammar errors are not diagnosed here, a diagram the
 * renderer cannot handle is reported as {@link RenderFailureException}.
 *
 * @author Stephan Pirnbaum
 */
public interface RendererBackend {

    /**
     * @return unique, lowercase name used for configuration and reporting, e.g. {@code cli}.
     */
    String getName();

    BackendTier getTier();

    /**
     * Side-effect free capability check. Must not throw.
     *
     * @return {@code true} if the backend can currently render.
     */
    boolean probe();

    /**
     * Renders the given diagram.
     *
     * @param text The Mermaid diagram text.
     * @param options Format, theme, size and background.
     *
     * @return The complete artifact, never partial.
     *
     * @throws RenderFailureException In case the backend could not produce the artifact.
     */
    byte[] render(String text, RenderOptions options) throws RenderFailureException;

}
