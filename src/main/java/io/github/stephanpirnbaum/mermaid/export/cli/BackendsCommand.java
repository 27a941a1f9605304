package io.github.stephanpirnbaum.mermaid.export.cli;

import io.github.stephanpirnbaum.mermaid.export.MermaidExportService;
import io.github.stephanpirnbaum.mermaid.export.backend.RendererBackend;
import io.github.stephanpirnbaum.mermaid.export.config.ConfigLoader;
import io.github.stephanpirnbaum.mermaid.export.config.ExportConfig;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Lists the renderer backends in priority order together with their availability.
 *
 * @author Stephan Pirnbaum
 */
@CommandLine.Command(name = "backends", mixinStandardHelpOptions = true, description = "Probes the renderer backends.")
public class BackendsCommand implements Callable<Integer> {

    private final Function<ExportConfig, MermaidExportService> serviceFactory;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-c", "--config"}, description = "Configuration file.")
    private Path configPath;

    public BackendsCommand() {
        this(MermaidExportService::new);
    }

    BackendsCommand(Function<ExportConfig, MermaidExportService> serviceFactory) {
        this.serviceFactory = serviceFactory;
    }

    @Override
    public Integer call() {
        ExportConfig config = configPath != null ? ConfigLoader.load(configPath) : ExportConfig.defaults();
        MermaidExportService service = serviceFactory.apply(config);
        PrintWriter out = spec.commandLine().getOut();

        out.println("Renderer backends (priority order):");
        boolean anyAvailable = false;
        for (RendererBackend backend : service.getBackends()) {
            boolean available = backend.probe();
            anyAvailable |= available;
            out.printf("  %-8s %-8s %s%n", backend.getName(), backend.getTier(), available ? "available" : "unavailable");
        }
        out.flush();
        return anyAvailable ? ExportCommand.EXIT_OK : ExportCommand.EXIT_PARTIAL_FAILURE;
    }

}
