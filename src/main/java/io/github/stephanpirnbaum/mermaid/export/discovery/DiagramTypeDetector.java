package io.github.stephanpirnbaum.mermaid.export.discovery;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects the Mermaid diagram type from the declaration line of a diagram.
 *
 * @author Stephan Pirnbaum
 */
public class DiagramTypeDetector {

    public static final String UNKNOWN = "unknown";

    private static final Map<String, Pattern> DECLARATIONS = new LinkedHashMap<>();

    static {
        DECLARATIONS.put("flowchart", Pattern.compile("^(flowchart|graph)\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("sequence", Pattern.compile("^sequenceDiagram\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("class", Pattern.compile("^classDiagram(-v2)?\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("state", Pattern.compile("^stateDiagram(-v2)?\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("er", Pattern.compile("^erDiagram\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("journey", Pattern.compile("^journey\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("gantt", Pattern.compile("^gantt\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("pie", Pattern.compile("^pie\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("gitgraph", Pattern.compile("^gitGraph\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("mindmap", Pattern.compile("^mindmap\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("timeline", Pattern.compile("^timeline\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("sankey", Pattern.compile("^sankey(-beta)?\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("quadrant", Pattern.compile("^quadrantChart\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("requirement", Pattern.compile("^requirementDiagram\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("c4context", Pattern.compile("^C4Context\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("c4container", Pattern.compile("^C4Container\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("c4component", Pattern.compile("^C4Component\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("c4dynamic", Pattern.compile("^C4Dynamic\\b", Pattern.CASE_INSENSITIVE));
        DECLARATIONS.put("c4deployment", Pattern.compile("^C4Deployment\\b", Pattern.CASE_INSENSITIVE));
    }

    /**
     * Skips YAML front matter, {@code %%} comments and directives and blank lines, then matches the first remaining
     * line against the known declarations.
     *
     * @return the diagram type, or {@value #UNKNOWN}.
     */
    public String detect(String text) {
        String[] lines = text.split("\\R");
        boolean inFrontMatter = false;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.equals("---")) {
                // front matter may only start on the first non-blank line
                inFrontMatter = !inFrontMatter && isFirstContent(lines, i);
                continue;
            }
            if (inFrontMatter || line.isEmpty() || line.startsWith("%%")) {
                continue;
            }
            for (Map.Entry<String, Pattern> declaration : DECLARATIONS.entrySet()) {
                if (declaration.getValue().matcher(line).find()) {
                    return declaration.getKey();
                }
            }
            return UNKNOWN;
        }
        return UNKNOWN;
    }

    private static boolean isFirstContent(String[] lines, int index) {
        for (int i = 0; i < index; i++) {
            if (!lines[i].isBlank()) {
                return false;
            }
        }
        return true;
    }

}
