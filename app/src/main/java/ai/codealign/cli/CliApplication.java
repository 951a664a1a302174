package ai.codealign.cli;

import ai.codealign.config.Config;
import ai.codealign.config.ConfigLoader;
import ai.codealign.config.Mode;
import ai.codealign.config.SystemEnvironmentReader;
import ai.codealign.document.LineScanner;
import ai.codealign.format.DocumentAligner;
import ai.codealign.format.FormatResult;
import ai.codealign.format.SourceFileException;
import ai.codealign.format.SourceFileWriter;
import ai.codealign.format.SourceFormatter;
import ai.codealign.logging.LoggingConfigurator;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and formatter.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_CHECK_FAILED = 1;
    static final int EXIT_IO_FAILURE = 3;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final SourceFileWriter fileWriter;
    private final PrintWriter out;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new SourceFileWriter(), null);
    }

    CliApplication(ConfigLoader configLoader, SourceFileWriter fileWriter, PrintWriter out) {
        this.configLoader = configLoader;
        this.fileWriter = fileWriter;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        if (out != null) {
            commandLine.setOut(out);
            commandLine.setErr(out);
        }

        Config config;
        try {
            commandLine.parseArgs(args);
            if (commandLine.isUsageHelpRequested()) {
                commandLine.usage(commandLine.getOut());
                return commandLine.getCommandSpec().exitCodeOnUsageHelp();
            }
            if (commandLine.isVersionHelpRequested()) {
                commandLine.printVersionHelp(commandLine.getOut());
                return commandLine.getCommandSpec().exitCodeOnVersionHelp();
            }
            config = configLoader.load(cliArguments);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Formatting {} file(s) in {} mode", config.files().size(), config.mode());

        SourceFormatter formatter = new SourceFormatter(new LineScanner(config.tabWidth()),
                new DocumentAligner(config.alignOptions()));
        List<Path> changedFiles = new ArrayList<>();
        try {
            for (Path file : config.files()) {
                try (MDC.MDCCloseable ignored = MDC.putCloseable("file", file.toString())) {
                    FormatResult result = formatter.format(file);
                    LOGGER.debug("Moved {} tokens", result.report().totalMovedTokens());
                    if (result.changed()) {
                        changedFiles.add(file);
                    }
                    handle(config, commandLine.getOut(), result);
                }
            }
        } catch (SourceFileException ex) {
            LOGGER.error("{}", ex.getMessage(), ex);
            return EXIT_IO_FAILURE;
        }
        commandLine.getOut().flush();

        if (config.mode() == Mode.CHECK && !changedFiles.isEmpty()) {
            LOGGER.warn("{} file(s) need alignment", changedFiles.size());
            return EXIT_CHECK_FAILED;
        }
        return EXIT_OK;
    }

    private void handle(Config config, PrintWriter writer, FormatResult result) {
        switch (config.mode()) {
            case PRINT -> {
                if (config.files().size() > 1) {
                    writer.println("==> " + result.path() + " <==");
                }
                result.lines().forEach(writer::println);
            }
            case WRITE -> {
                if (result.changed()) {
                    fileWriter.write(result);
                    LOGGER.info("Rewrote {}", result.path());
                } else {
                    LOGGER.debug("Already aligned");
                }
            }
            case CHECK -> {
                if (result.changed()) {
                    writer.println(result.path());
                }
            }
        }
    }
}
