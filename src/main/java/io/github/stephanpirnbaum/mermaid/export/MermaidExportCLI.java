package io.github.stephanpirnbaum.mermaid.export;

import ch.qos.logback.classic.Level;
import io.github.stephanpirnbaum.mermaid.export.cli.BackendsCommand;
import io.github.stephanpirnbaum.mermaid.export.cli.ExportCommand;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * CLI application of the Mermaid exporter.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
@CommandLine.Command(
        name = "mermaid-export",
        mixinStandardHelpOptions = true,
        version = "mermaid-export 1.0.0-SNAPSHOT",
        description = "Exports Mermaid diagrams from .mmd files and Markdown documents",
        subcommands = {ExportCommand.class, BackendsCommand.class}
)
public class MermaidExportCLI implements Runnable {

    @CommandLine.Option(names = {"-v", "--verbose"}, scope = CommandLine.ScopeType.INHERIT, description = "Enable verbose output (DEBUG level).")
    private boolean verbose;

    @CommandLine.Option(names = {"-q", "--quiet"}, scope = CommandLine.ScopeType.INHERIT, description = "Suppress all output except errors.")
    private boolean quiet;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        MermaidExportCLI cli = new MermaidExportCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    private void configureLogging() {
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

}
