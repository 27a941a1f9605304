package io.github.stephanpirnbaum.mermaid.export.strategy;

import io.github.stephanpirnbaum.mermaid.export.RenderFailureException;
import io.github.stephanpirnbaum.mermaid.export.StrategyUnavailableException;
import io.github.stephanpirnbaum.mermaid.export.backend.BackendTier;
import io.github.stephanpirnbaum.mermaid.export.backend.RendererBackend;
import io.github.stephanpirnbaum.mermaid.export.model.RenderOptions;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Chooses the backend servicing a job: the preferred backend if it probes successfully, otherwise the first backend
 * in priority order that does. Probe results are cached for a validity window and dropped when a backend fails to
 * render. Safe to use from several jobs concurrently.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
public class StrategySelector {

    public static final Duration DEFAULT_PROBE_VALIDITY = Duration.ofSeconds(30);

    private final List<RendererBackend> backends;

    private final Duration probeValidity;

    private final Clock clock;

    private final Map<String, ProbeResult> probeCache = new ConcurrentHashMap<>();

    public StrategySelector(List<RendererBackend> backends) {
        this(backends, DEFAULT_PROBE_VALIDITY, Clock.systemUTC());
    }

    public StrategySelector(List<RendererBackend> backends, Duration probeValidity, Clock clock) {
        if (backends.isEmpty()) {
            throw new IllegalArgumentException("At least one renderer backend is required");
        }
        List<RendererBackend> ordered = new ArrayList<>(backends);
        // stable: keeps the given order within a tier
        ordered.sort(Comparator.comparing(RendererBackend::getTier));
        this.backends = List.copyOf(ordered);
        this.probeValidity = probeValidity;
        this.clock = clock;
    }

    /**
     * @return all backends in priority order.
     */
    public List<RendererBackend> getBackends() {
        return backends;
    }

    /**
     * Resolves the backend to use.
     *
     * @param preferredName Name of the preferred backend, or {@code null} / blank for automatic selection.
     *
     * @return The preferred backend if available, otherwise the first available backend in priority order.
     *
     * @throws StrategyUnavailableException In case no backend probes successfully.
     */
    public RendererBackend resolve(@Nullable String preferredName) throws StrategyUnavailableException {
        Optional<RendererBackend> preferred = findByName(preferredName);
        if (preferred.isPresent() && isAvailable(preferred.get())) {
            return preferred.get();
        }
        if (StringUtils.isNotBlank(preferredName)) {
            log.info("Preferred backend '{}' is not available, selecting by priority", preferredName);
        }
        for (RendererBackend backend : backends) {
            if (isAvailable(backend)) {
                if (backend.getTier() != BackendTier.PRIMARY) {
                    log.info("Primary backend unavailable, falling back to '{}'", backend.getName());
                }
                return backend;
            }
        }
        throw new StrategyUnavailableException("No rendering backend available (tried: "
                + backends.stream().map(RendererBackend::getName).collect(Collectors.joining(", ")) + ")");
    }

    /**
     * Renders with the resolved backend. If its render call fails, the probe cache entry of that backend is dropped
     * and the render is retried once with the next available backend in priority order.
     *
     * @throws StrategyUnavailableException In case no backend is available at all.
     * @throws RenderFailureException In case the render failed and no fallback succeeded.
     */
    public RenderOutcome render(String text, RenderOptions options, @Nullable String preferredName)
            throws StrategyUnavailableException, RenderFailureException {
        RendererBackend first = resolve(preferredName);
        RenderFailureException firstFailure;
        try {
            return new RenderOutcome(first.getName(), first.render(text, options), false);
        } catch (RenderFailureException | RuntimeException e) {
            firstFailure = asRenderFailure(first, e);
        }

        invalidate(first.getName());
        Optional<RendererBackend> next = nextAvailable(first);
        if (next.isEmpty()) {
            throw firstFailure;
        }

        RendererBackend fallback = next.get();
        log.warn("Backend '{}' failed ({}), retrying with '{}'", first.getName(), firstFailure.getMessage(), fallback.getName());
        try {
            return new RenderOutcome(fallback.getName(), fallback.render(text, options), true);
        } catch (RenderFailureException | RuntimeException e) {
            invalidate(fallback.getName());
            RenderFailureException fallbackFailure = asRenderFailure(fallback, e);
            fallbackFailure.addSuppressed(firstFailure);
            throw fallbackFailure;
        }
    }

    /**
     * Drops the cached probe result of a backend, forcing a re-probe on next use.
     */
    public void invalidate(String backendName) {
        probeCache.remove(backendName);
    }

    boolean isAvailable(RendererBackend backend) {
        Instant now = clock.instant();
        ProbeResult cached = probeCache.get(backend.getName());
        if (cached != null && cached.probedAt.plus(probeValidity).isAfter(now)) {
            return cached.available;
        }
        boolean available;
        try {
            available = backend.probe();
        } catch (RuntimeException e) {
            log.warn("Probe of backend '{}' failed: {}", backend.getName(), e.getMessage());
            available = false;
        }
        log.debug("Probed backend '{}': {}", backend.getName(), available ? "available" : "unavailable");
        probeCache.put(backend.getName(), new ProbeResult(available, now));
        return available;
    }

    private Optional<RendererBackend> nextAvailable(RendererBackend failed) {
        return backends.stream()
                .filter(b -> !b.getName().equals(failed.getName()))
                .filter(this::isAvailable)
                .findFirst();
    }

    private Optional<RendererBackend> findByName(@Nullable String name) {
        if (StringUtils.isBlank(name)) {
            return Optional.empty();
        }
        return backends.stream().filter(b -> b.getName().equalsIgnoreCase(name.trim())).findFirst();
    }

    private static RenderFailureException asRenderFailure(RendererBackend backend, Exception e) {
        if (e instanceof RenderFailureException) {
            return (RenderFailureException) e;
        }
        return new RenderFailureException("Backend '" + backend.getName() + "' failed: " + e.getMessage(), e);
    }

    private static final class ProbeResult {

        private final boolean available;

        private final Instant probedAt;

        private ProbeResult(boolean available, Instant probedAt) {
            this.available = available;
            this.probedAt = probedAt;
        }
    }

}
