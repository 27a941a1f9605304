package io.github.stephanpirnbaum.mermaid.export.backend;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.impl.driver.Driver;
import com.microsoft.playwright.options.ScreenshotType;
import io.github.stephanpirnbaum.mermaid.export.RenderFailureException;
import io.github.stephanpirnbaum.mermaid.export.StrategyUnavailableException;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import io.github.stephanpirnbaum.mermaid.export.model.RenderOptions;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Renders diagrams with mermaid.js inside a headless Chromium driven by Playwright.
 * Requires a Chromium installation known to Playwright, which can be installed on construction.
 * <p>
 * WebP is not supported, Chromium screenshots are limited to PNG and JPEG.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
public class BrowserRendererBackend implements RendererBackend {

    public static final String NAME = "browser";

    public static final String DEFAULT_MERMAID_SCRIPT_URL = "https://cdn.jsdelivr.net/npm/mermaid@10/dist/mermaid.min.js";

    private static final Map<String, String> PLAYWRIGHT_ENV = Map.of("PLAYWRIGHT_SKIP_BROWSER_DOWNLOAD", "1");

    private static final String RENDER_SCRIPT = "async ([source, theme]) => {"
            + " mermaid.initialize({ startOnLoad: false, theme: theme, securityLevel: 'strict' });"
            + " const { svg } = await mermaid.render('mermaid-export', source);"
            + " document.getElementById('container').innerHTML = svg;"
            + " return svg; }";

    private final String mermaidScriptUrl;

    private final Duration timeout;

    public BrowserRendererBackend() {
        this(DEFAULT_MERMAID_SCRIPT_URL, Duration.ofSeconds(30));
    }

    public BrowserRendererBackend(String mermaidScriptUrl, Duration timeout) {
        this.mermaidScriptUrl = mermaidScriptUrl;
        this.timeout = timeout;
    }

    /**
     * @param installBrowser Whether Chromium shall be installed via Playwright before first use.
     *
     * @throws StrategyUnavailableException In case the installation fails.
     */
    public BrowserRendererBackend(String mermaidScriptUrl, Duration timeout, boolean installBrowser) throws StrategyUnavailableException {
        this(mermaidScriptUrl, timeout);
        if (installBrowser) {
            try {
                installBrowser(new String[]{"install", "chromium", "--with-deps", "--only-shell"});
            } catch (IOException e) {
                throw new StrategyUnavailableException("Could not install Chromium", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StrategyUnavailableException("Interrupted while installing Chromium", e);
            }
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public BackendTier getTier() {
        return BackendTier.FALLBACK;
    }

    @Override
    public boolean probe() {
        try (Playwright pw = Playwright.create(new Playwright.CreateOptions().setEnv(PLAYWRIGHT_ENV))) {
            String executable = pw.chromium().executablePath();
            boolean available = StringUtils.isNotEmpty(executable) && Files.isExecutable(Path.of(executable));
            log.debug("Chromium executable {} available: {}", executable, available);
            return available;
        } catch (RuntimeException e) {
            log.debug("Playwright not available: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public byte[] render(String text, RenderOptions options) throws RenderFailureException {
        String source = text == null ? "" : text.trim();
        if (source.isEmpty()) {
            throw new RenderFailureException("Empty diagram content cannot be rendered in the browser");
        }
        if (options.getFormat() == ExportFormat.WEBP) {
            throw new RenderFailureException("The browser backend cannot produce " + options.getFormat().getExtension());
        }

        try (Playwright pw = Playwright.create(new Playwright.CreateOptions().setEnv(PLAYWRIGHT_ENV))) {
            BrowserType.LaunchOptions launchOptions = new BrowserType.LaunchOptions().setHeadless(true);
            try (Browser browser = pw.chromium().launch(launchOptions);
                 BrowserContext ctx = browser.newContext(new Browser.NewContextOptions()
                         .setViewportSize(Math.max(options.getWidth(), 1), Math.max(options.getHeight(), 1)))) {
                Page page = ctx.newPage();
                page.setDefaultTimeout(timeout.toMillis());
                page.onConsoleMessage(msg -> log.debug("[console.{}] {}", msg.type(), msg.text()));

                page.setContent(buildPage(options));
                page.waitForFunction("() => typeof window.mermaid !== 'undefined'");
                String svg = (String) page.evaluate(RENDER_SCRIPT, Arrays.asList(source, options.getTheme().getRepresentation()));
                if (svg == null) {
                    throw new RenderFailureException("Mermaid did not return an SVG");
                }
                return convert(page, svg, options);
            }
        } catch (PlaywrightException e) {
            throw new RenderFailureException("Browser rendering failed: " + StringUtils.abbreviate(e.getMessage(), 500), e);
        }
    }

    private byte[] convert(Page page, String svg, RenderOptions options) throws RenderFailureException {
        switch (options.getFormat()) {
            case SVG:
                return svg.getBytes(StandardCharsets.UTF_8);
            case PNG:
                return diagram(page).screenshot(new Locator.ScreenshotOptions()
                        .setType(ScreenshotType.PNG)
                        .setOmitBackground(options.isTransparent()));
            case JPG:
            case JPEG:
                return diagram(page).screenshot(new Locator.ScreenshotOptions().setType(ScreenshotType.JPEG));
            case PDF:
                return page.pdf(new Page.PdfOptions().setPrintBackground(true));
            default:
                throw new RenderFailureException("The browser backend cannot produce " + options.getFormat().getExtension());
        }
    }

    private static Locator diagram(Page page) {
        return page.locator("#container svg").first();
    }

    private String buildPage(RenderOptions options) {
        String background = options.isTransparent() ? "transparent" : options.getBackgroundColor().replaceAll("[;<>\"]", "");
        return "<!DOCTYPE html><html><head><meta charset=\"utf-8\">"
                + "<script src=\"" + mermaidScriptUrl + "\"></script></head>"
                + "<body style=\"margin:0;background:" + background + "\"><div id=\"container\"></div></body></html>";
    }

    private int installBrowser(String[] args) throws IOException, InterruptedException {
        log.info("Installing Chromium via Playwright");
        // mimic behaviour from com.microsoft.playwright.CLI#main
        // see: https://playwright.dev/java/docs/browsers
        Driver driver = Driver.ensureDriverInstalled(Collections.emptyMap(), false);
        ProcessBuilder pb = driver.createProcessBuilder();
        pb.command().addAll(List.of(args));
        String version = Playwright.class.getPackage().getImplementationVersion();
        if (version != null) {
            pb.environment().put("PW_CLI_DISPLAY_VERSION", version);
        }

        pb.inheritIO();
        Process process = pb.start();
        int exitCode = process.waitFor();
        if (exitCode != 0) {
            throw new IOException("Chromium installation failed with exit code " + exitCode);
        }
        return exitCode;
    }

}
