package io.github.stephanpirnbaum.mermaid.export.model;

/**
 * Where the text of a {@link DiagramSource} comes from.
 *
 * @author Stephan Pirnbaum
 */
public enum SourceKind {

    /**
     * A dedicated diagram file, e.g. {@code flow.mmd}. The whole file is the diagram.
     */
    STANDALONE,

    /**
     * A fenced {@code mermaid} code block inside a larger document.
     */
    EMBEDDED_BLOCK

}
