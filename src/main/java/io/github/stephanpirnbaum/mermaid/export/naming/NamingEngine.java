package io.github.stephanpirnbaum.mermaid.export.naming;

import io.github.stephanpirnbaum.mermaid.export.ExportFileSystemException;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import io.github.stephanpirnbaum.mermaid.export.model.ExportJob;
import io.github.stephanpirnbaum.mermaid.export.model.NamingMode;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Computes deterministic output paths and decides whether a render can be skipped.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
public class NamingEngine {

    private final Map<NamingMode, NamingPolicy> policies = new EnumMap<>(NamingMode.class);

    private final ConcurrentMap<String, HeldLock> sequenceLocks = new ConcurrentHashMap<>();

    public NamingEngine() {
        this(new VersionedNamingPolicy(), new OverwriteNamingPolicy());
    }

    public NamingEngine(NamingPolicy versioned, NamingPolicy overwrite) {
        this.policies.put(NamingMode.VERSIONED, versioned);
        this.policies.put(NamingMode.OVERWRITE, overwrite);
    }

    public NamingRecord resolve(ExportJob job) throws ExportFileSystemException {
        return resolve(job.getOutputDirectory(), job.getBaseName(), job.getFormat(), job.getContent(), job.getNamingMode());
    }

    /**
     * Resolves the output of the given content.
     *
     * @param directory The output directory.
     * @param baseName The base name, already passed through {@link BaseNames#sanitize(String)}.
     * @param format The target format.
     * @param content The diagram text. Only its trimmed form contributes to the content identity.
     * @param mode The naming mode.
     *
     * @return The naming record, with {@code reused} set if the render step must be skipped.
     *
     * @throws ExportFileSystemException In case the output directory cannot be scanned.
     */
    public NamingRecord resolve(Path directory, String baseName, ExportFormat format, String content, NamingMode mode) throws ExportFileSystemException {
        if (!baseName.equals(BaseNames.sanitize(baseName))) {
            throw new IllegalArgumentException("Base name is not sanitized: " + baseName);
        }
        NamingPolicy policy = policyFor(mode);
        String hash = HashingUtil.shortHash(content);
        NamingPolicy.PathCandidate candidate = policy.computePath(directory, baseName, format, hash);
        boolean reused = policy.shouldSkip(candidate.getPath(), hash);
        log.debug("Resolved {} output for {} ({}): {} (reused: {})", mode, baseName, hash, candidate.getPath(), reused);
        return new NamingRecord(candidate.getPath(), hash, candidate.getSequenceNumber(), reused);
    }

    /**
     * @return {@code true} if the artifact at {@code path} already represents {@code content} under the given mode.
     */
    public boolean shouldSkipExport(Path path, String content, NamingMode mode) {
        return policyFor(mode).shouldSkip(path, HashingUtil.shortHash(content));
    }

    /**
     * Acquires the lock serializing sequence allocation for one {@code (directory, baseName, format)} triple. Must be
     * held from {@link #resolve} until the artifact is persisted whenever jobs run concurrently. The lock entry is
     * dropped again once its last holder has closed it.
     */
    public SequenceLock acquire(Path directory, String baseName, ExportFormat format) {
        String key = directory.toAbsolutePath().normalize() + "|" + baseName + "|" + format.getExtension();
        HeldLock held = sequenceLocks.compute(key, (k, existing) -> {
            HeldLock entry = existing != null ? existing : new HeldLock();
            entry.holders++;
            return entry;
        });
        held.lock.lock();
        return () -> {
            held.lock.unlock();
            sequenceLocks.computeIfPresent(key, (k, entry) -> --entry.holders == 0 ? null : entry);
        };
    }

    int lockCount() {
        return sequenceLocks.size();
    }

    private NamingPolicy policyFor(NamingMode mode) {
        NamingPolicy policy = policies.get(mode);
        if (policy == null) {
            throw new IllegalArgumentException("No naming policy for mode " + mode);
        }
        return policy;
    }

    /**
     * A held sequence lock. Closing releases it.
     */
    @FunctionalInterface
    public interface SequenceLock extends AutoCloseable {

        @Override
        void close();

    }

    private static final class HeldLock {

        private final ReentrantLock lock = new ReentrantLock();

        // guarded by the map entry, only changed inside compute
        private int holders;

    }

}
