package io.github.stephanpirnbaum.mermaid.export.naming;

import io.github.stephanpirnbaum.mermaid.export.ExportFileSystemException;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Content addressed naming: {@code {baseName}-{seq:02d}-{hash}.{format}}.
 * <p>
 * The output directory is the only source of truth. Sequence numbers are recovered by listing the directory on every
 * call and never cached, so names stay consistent across process restarts. Callers running jobs concurrently must
 * hold {@link NamingEngine#acquire(Path, String, ExportFormat)} from path computation until the artifact is written.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
public class VersionedNamingPolicy implements NamingPolicy {

    /**
     * Highest sequence number ever allocated. Names with more digits are not treated as versioned artifacts.
     */
    public static final int MAX_SEQUENCE = 999_999_999;

    private static final String SEQUENCE_GROUP = "(\\d{2,9})";

    private static final Pattern ANY_VERSIONED_NAME = Pattern.compile("^.+-" + SEQUENCE_GROUP + "-([0-9a-f]{8})\\.[A-Za-z0-9]+$");

    @Override
    public PathCandidate computePath(Path directory, String baseName, ExportFormat format, String contentHash) throws ExportFileSystemException {
        Pattern pattern = patternFor(baseName, format);
        int maxSequence = 0;
        Integer existingSequence = null;

        for (String fileName : listFileNames(directory)) {
            Matcher matcher = pattern.matcher(fileName);
            if (!matcher.matches()) {
                continue;
            }
            int sequence = Integer.parseInt(matcher.group(1));
            maxSequence = Math.max(maxSequence, sequence);
            if (matcher.group(2).equals(contentHash) && (existingSequence == null || sequence < existingSequence)) {
                existingSequence = sequence;
            }
        }

        if (existingSequence != null) {
            Path existing = directory.resolve(fileName(baseName, existingSequence, contentHash, format));
            log.debug("Found existing artifact {} for content {}", existing, contentHash);
            return new PathCandidate(existing, existingSequence);
        }

        if (maxSequence >= MAX_SEQUENCE) {
            throw new ExportFileSystemException("No sequence number left for " + baseName + "." + format.getExtension()
                    + " in " + directory);
        }
        int next = maxSequence + 1;
        return new PathCandidate(directory.resolve(fileName(baseName, next, contentHash, format)), next);
    }

    /**
     * Existence at the computed path proves content equality: the hash is part of the name. The file content itself
     * is not re-hashed.
     */
    @Override
    public boolean shouldSkip(Path path, String contentHash) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        Matcher matcher = ANY_VERSIONED_NAME.matcher(path.getFileName().toString());
        return matcher.matches() && matcher.group(2).equals(contentHash);
    }

    static String fileName(String baseName, int sequence, String contentHash, ExportFormat format) {
        return String.format("%s-%02d-%s.%s", baseName, sequence, contentHash, format.getExtension());
    }

    private static Pattern patternFor(String baseName, ExportFormat format) {
        return Pattern.compile("^" + Pattern.quote(baseName) + "-" + SEQUENCE_GROUP + "-([0-9a-f]{8})\\." + Pattern.quote(format.getExtension()) + "$");
    }

    private static List<String> listFileNames(Path directory) throws ExportFileSystemException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ExportFileSystemException("Failed to scan output directory " + directory, e);
        }
    }

}
