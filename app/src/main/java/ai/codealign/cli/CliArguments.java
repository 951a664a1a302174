package ai.codealign.cli;

import ai.codealign.config.LogFormat;
import ai.codealign.config.Mode;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "code-align", mixinStandardHelpOptions = true,
        description = "Aligns assignment operators and trailing comments across neighbouring lines")
public class CliArguments {

    @CommandLine.Parameters(paramLabel = "FILE", arity = "1..*", description = "Source files to format")
    private List<Path> files;

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class, description = "Output mode: print, write or check")
    private Mode mode;

    @CommandLine.Option(names = "--assign-span", description = "Lines an assignment group may span, 0 disables", paramLabel = "LINES")
    private Integer assignSpan;

    @CommandLine.Option(names = "--assign-threshold", description = "Column tolerance for assignments, 0 accepts any column", paramLabel = "COLUMNS")
    private Integer assignThreshold;

    @CommandLine.Option(names = "--comment-span", description = "Lines a trailing comment group may span, 0 disables", paramLabel = "LINES")
    private Integer commentSpan;

    @CommandLine.Option(names = "--comment-threshold", description = "Column tolerance for trailing comments, 0 accepts any column", paramLabel = "COLUMNS")
    private Integer commentThreshold;

    @CommandLine.Option(names = "--tab-width", description = "Columns between tab stops", paramLabel = "COLUMNS")
    private Integer tabWidth;

    @CommandLine.Option(names = "--align-on-tabstop", negatable = true, description = "Round alignment columns up to the next tab stop")
    private Boolean alignOnTabstop;

    @CommandLine.Option(names = "--align-with-tabs", negatable = true, description = "Fill alignment gaps with tabs before spaces")
    private Boolean alignWithTabs;

    @CommandLine.Option(names = "--keep-tabs", negatable = true, description = "Keep tabs between words that were not moved (default)")
    private Boolean keepTabs;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public List<Path> files() {
        return files == null ? List.of() : files;
    }

    public Mode mode() {
        return mode;
    }

    public Integer assignSpan() {
        return assignSpan;
    }

    public Integer assignThreshold() {
        return assignThreshold;
    }

    public Integer commentSpan() {
        return commentSpan;
    }

    public Integer commentThreshold() {
        return commentThreshold;
    }

    public Integer tabWidth() {
        return tabWidth;
    }

    public Boolean alignOnTabstop() {
        return alignOnTabstop;
    }

    public Boolean alignWithTabs() {
        return alignWithTabs;
    }

    public Boolean keepTabs() {
        return keepTabs;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
