package io.github.stephanpirnbaum.mermaid.export.backend;

/**
 * Priority class of a renderer backend. Backends are tried in the declaration order of their tier.
 *
 * @author Stephan Pirnbaum
 */
public enum BackendTier {

    PRIMARY,
    FALLBACK

}
