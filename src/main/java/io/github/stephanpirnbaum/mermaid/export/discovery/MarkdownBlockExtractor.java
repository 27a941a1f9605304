package io.github.stephanpirnbaum.mermaid.export.discovery;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts fenced {@code mermaid} code blocks from Markdown text.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
public class MarkdownBlockExtractor {

    private static final Pattern OPENING_FENCE = Pattern.compile("^(\\s*)```\\s*mermaid\\s*$", Pattern.CASE_INSENSITIVE);

    private static final String FENCE = "```";

    /**
     * A diagram block.
     */
    @Value
    public static class Block {

        String text;

        /**
         * Zero based line of the first diagram line.
         */
        int startLine;

    }

    /**
     * Returns the non-blank mermaid blocks in document order. Indentation relative to the opening fence is kept,
     * trailing whitespace is removed from every line and the block is trimmed. A block without closing fence is
     * ignored.
     */
    public List<Block> extract(String markdown) {
        List<Block> blocks = new ArrayList<>();
        String[] lines = markdown.split("\\R", -1);

        boolean inBlock = false;
        int fenceIndent = 0;
        int startLine = -1;
        List<String> current = new ArrayList<>();

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (!inBlock) {
                Matcher matcher = OPENING_FENCE.matcher(line);
                if (matcher.matches()) {
                    inBlock = true;
                    fenceIndent = matcher.group(1).length();
                    startLine = i + 1;
                    current.clear();
                }
                continue;
            }

            if (line.trim().startsWith(FENCE)) {
                inBlock = false;
                String text = clean(current);
                if (!text.isEmpty()) {
                    blocks.add(new Block(text, startLine));
                }
                continue;
            }

            String stripped = line.stripLeading();
            int relativeIndent = Math.max(0, (line.length() - stripped.length()) - fenceIndent);
            current.add(" ".repeat(relativeIndent) + stripped);
        }

        if (inBlock) {
            log.debug("Ignoring unterminated mermaid block starting at line {}", startLine);
        }
        return blocks;
    }

    private static String clean(List<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(line.stripTrailing());
        }
        return sb.toString().trim();
    }

}
