package io.github.stephanpirnbaum.mermaid.export.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.github.stephanpirnbaum.mermaid.export.backend.BrowserRendererBackend;
import io.github.stephanpirnbaum.mermaid.export.backend.CliRendererBackend;
import io.github.stephanpirnbaum.mermaid.export.discovery.DiscoveryOptions;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import io.github.stephanpirnbaum.mermaid.export.model.MermaidTheme;
import io.github.stephanpirnbaum.mermaid.export.model.NamingMode;
import io.github.stephanpirnbaum.mermaid.export.model.RenderOptions;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Export settings, loaded from {@code mermaid-export.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * namingMode: versioned
 * maxDepth: 3
 * outputDirectory: exports
 * organizeByFormat: true
 * formats: [svg, png]
 * theme: dark
 * exportStrategy: auto
 * cli:
 *   command: /usr/local/bin/mmdc
 * }</pre>
 *
 * @author Stephan Pirnbaum
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportConfig {

    public static final String AUTO_STRATEGY = "auto";

    @Builder.Default
    NamingMode namingMode = NamingMode.VERSIONED;

    @Builder.Default
    int maxDepth = DiscoveryOptions.DEFAULT_MAX_DEPTH;

    /**
     * {@code null} writes next to the source. Relative paths resolve against each source's directory.
     */
    @Nullable
    String outputDirectory;

    @Builder.Default
    boolean organizeByFormat = false;

    @Builder.Default
    List<ExportFormat> formats = List.of(ExportFormat.SVG);

    @Builder.Default
    MermaidTheme theme = MermaidTheme.DEFAULT;

    @Builder.Default
    int width = 800;

    @Builder.Default
    int height = 600;

    @Builder.Default
    String backgroundColor = RenderOptions.TRANSPARENT;

    /**
     * {@code auto}, {@code cli} or {@code browser}.
     */
    @Builder.Default
    String exportStrategy = AUTO_STRATEGY;

    @Builder.Default
    long probeValiditySeconds = 30;

    @Builder.Default
    int workers = 1;

    @Builder.Default
    Discovery discovery = Discovery.builder().build();

    @Builder.Default
    Cli cli = Cli.builder().build();

    @Builder.Default
    Browser browser = Browser.builder().build();

    public static ExportConfig defaults() {
        return ExportConfig.builder().build();
    }

    public RenderOptions toRenderOptions() {
        return RenderOptions.builder()
                .theme(theme)
                .width(width)
                .height(height)
                .backgroundColor(backgroundColor)
                .build();
    }

    /**
     * @return the backend name to prefer, {@code null} for automatic selection.
     */
    @Nullable
    public String getPreferredBackend() {
        return StringUtils.isBlank(exportStrategy) || AUTO_STRATEGY.equalsIgnoreCase(exportStrategy.trim())
                ? null
                : exportStrategy.trim();
    }

    @Value
    @Builder
    @Jacksonized
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Discovery {

        @Builder.Default
        List<String> includePatterns = DiscoveryOptions.DEFAULT_INCLUDE_PATTERNS;

        @Builder.Default
        List<String> excludeDirectories = DiscoveryOptions.DEFAULT_EXCLUDE_DIRECTORIES;

        boolean followSymlinks;

    }

    @Value
    @Builder
    @Jacksonized
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Cli {

        @Builder.Default
        String command = CliRendererBackend.DEFAULT_COMMAND;

        @Builder.Default
        long timeoutSeconds = 30;

    }

    @Value
    @Builder
    @Jacksonized
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Browser {

        @Builder.Default
        String mermaidScriptUrl = BrowserRendererBackend.DEFAULT_MERMAID_SCRIPT_URL;

        @Builder.Default
        long timeoutSeconds = 30;

        @Builder.Default
        boolean installBrowser = false;

    }

}
