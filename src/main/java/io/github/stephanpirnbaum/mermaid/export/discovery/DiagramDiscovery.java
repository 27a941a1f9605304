package io.github.stephanpirnbaum.mermaid.export.discovery;

import io.github.stephanpirnbaum.mermaid.export.InvalidSourceException;
import io.github.stephanpirnbaum.mermaid.export.model.DiagramSource;
import io.github.stephanpirnbaum.mermaid.export.model.SourceKind;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds diagram sources in a file tree or a single document.
 * <p>
 * Traversal is depth first with directory entries sorted by name, so the order of the returned sources is stable
 * across runs and platforms. The depth limit is applied while walking, deeper directories are never listed.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
public class DiagramDiscovery {

    private static final Set<String> STANDALONE_EXTENSIONS = Set.of("mmd", "mermaid");

    private static final char BOM = '\uFEFF';

    private final MarkdownBlockExtractor blockExtractor;

    private final DiagramTypeDetector typeDetector;

    public DiagramDiscovery() {
        this(new MarkdownBlockExtractor(), new DiagramTypeDetector());
    }

    public DiagramDiscovery(MarkdownBlockExtractor blockExtractor, DiagramTypeDetector typeDetector) {
        this.blockExtractor = blockExtractor;
        this.typeDetector = typeDetector;
    }

    /**
     * Discovers all diagram sources below {@code root}. If {@code root} is a file, only that file is read.
     *
     * @param root The directory or file to start from.
     * @param options Depth limit and filters.
     *
     * @return The sources in traversal order plus the paths below the root that could not be read.
     *
     * @throws InvalidSourceException In case the root itself does not exist or cannot be read.
     */
    public DiscoveryResult discover(Path root, DiscoveryOptions options) throws InvalidSourceException {
        if (options.getMaxDepth() < 1) {
            throw new IllegalArgumentException("Maximum depth must be at least 1, was " + options.getMaxDepth());
        }
        if (!Files.exists(root) || !Files.isReadable(root)) {
            throw new InvalidSourceException("Discovery root does not exist or is not readable: " + root);
        }

        long start = System.currentTimeMillis();
        log.info("Starting diagram discovery in {} (max depth {})", root, options.getMaxDepth());

        List<DiagramSource> sources = new ArrayList<>();
        List<DiscoveryResult.UnreadablePath> unreadable = new ArrayList<>();

        if (Files.isRegularFile(root)) {
            sources.addAll(readFile(root));
        } else {
            List<Path> entries;
            try {
                entries = list(root);
            } catch (IOException e) {
                throw new InvalidSourceException("Failed to list discovery root " + root, e);
            }
            List<PathMatcher> includes = matchers(options.getIncludePatterns());
            Set<String> excludes = options.getExcludeDirectories().stream()
                    .map(d -> d.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            scan(entries, 1, options, includes, excludes, sources, unreadable);
        }

        log.info("Discovery completed: {} diagrams found, {} unreadable paths, in {}ms",
                sources.size(), unreadable.size(), System.currentTimeMillis() - start);
        return new DiscoveryResult(root, List.copyOf(sources), List.copyOf(unreadable));
    }

    /**
     * Reads a single file and parses it into sources.
     *
     * @throws InvalidSourceException In case the file cannot be read.
     */
    public List<DiagramSource> readFile(Path file) throws InvalidSourceException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidSourceException("Failed to read diagram source " + file, e);
        }
        return parseDocument(file, content);
    }

    /**
     * Parses document content into sources. {@code .mmd} and {@code .mermaid} files form one standalone source,
     * every other file is scanned for fenced mermaid blocks.
     */
    public List<DiagramSource> parseDocument(Path path, String content) {
        String text = !content.isEmpty() && content.charAt(0) == BOM ? content.substring(1) : content;

        if (isStandalone(path)) {
            String diagram = text.trim();
            if (diagram.isEmpty()) {
                return List.of();
            }
            return List.of(DiagramSource.builder()
                    .path(path)
                    .rawText(diagram)
                    .kind(SourceKind.STANDALONE)
                    .diagramType(typeDetector.detect(diagram))
                    .build());
        }

        List<MarkdownBlockExtractor.Block> blocks = blockExtractor.extract(text);
        List<DiagramSource> sources = new ArrayList<>(blocks.size());
        for (int i = 0; i < blocks.size(); i++) {
            MarkdownBlockExtractor.Block block = blocks.get(i);
            sources.add(DiagramSource.builder()
                    .path(path)
                    .rawText(block.getText())
                    .kind(SourceKind.EMBEDDED_BLOCK)
                    .blockIndex(i)
                    .documentBlockCount(blocks.size())
                    .startLine(block.getStartLine())
                    .diagramType(typeDetector.detect(block.getText()))
                    .build());
        }
        return sources;
    }

    private void scan(List<Path> entries,
                      int depth,
                      DiscoveryOptions options,
                      List<PathMatcher> includes,
                      Set<String> excludes,
                      List<DiagramSource> sources,
                      List<DiscoveryResult.UnreadablePath> unreadable) {
        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            LinkOption[] linkOptions = options.isFollowSymlinks() ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};

            if (Files.isDirectory(entry, linkOptions)) {
                if (depth >= options.getMaxDepth() || excludes.contains(name.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                try {
                    scan(list(entry), depth + 1, options, includes, excludes, sources, unreadable);
                } catch (IOException e) {
                    log.warn("Failed to scan directory {}: {}", entry, e.getMessage());
                    unreadable.add(new DiscoveryResult.UnreadablePath(entry, "Directory cannot be listed: " + e.getMessage()));
                }
            } else if (Files.isRegularFile(entry) && matches(name, includes)) {
                try {
                    List<DiagramSource> found = readFile(entry);
                    if (!found.isEmpty()) {
                        log.debug("Found {} diagram(s) in {}", found.size(), entry);
                    }
                    sources.addAll(found);
                } catch (InvalidSourceException e) {
                    log.warn("Failed to read {}: {}", entry, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                    unreadable.add(new DiscoveryResult.UnreadablePath(entry, e.getMessage()));
                }
            }
        }
    }

    private static List<Path> list(Path directory) throws IOException {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.sorted(Comparator.comparing(p -> p.getFileName().toString())).collect(Collectors.toList());
        }
    }

    private static List<PathMatcher> matchers(List<String> patterns) {
        return patterns.stream()
                .map(p -> FileSystems.getDefault().getPathMatcher("glob:" + p.toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList());
    }

    private static boolean matches(String fileName, List<PathMatcher> includes) {
        Path name = Path.of(fileName.toLowerCase(Locale.ROOT));
        return includes.stream().anyMatch(m -> m.matches(name));
    }

    private static boolean isStandalone(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 && STANDALONE_EXTENSIONS.contains(fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT));
    }

}
