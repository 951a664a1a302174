package ai.codealign.format;

import ai.codealign.document.LineScanner;
import ai.codealign.document.SourceDocument;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reads a source file and lays out its alignment groups.
 *
 * <p>The line separator of the file is the first one found in it, {@code \n} when it has none, and is reused when
 * the result is written back, together with the presence of a final separator.</p>
 */
public class SourceFormatter {

    static final String DEFAULT_LINE_SEPARATOR = "\n";

    private final LineScanner scanner;
    private final DocumentAligner aligner;

    public SourceFormatter(LineScanner scanner, DocumentAligner aligner) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.aligner = Objects.requireNonNull(aligner, "aligner");
    }

    public FormatResult format(Path path) {
        Objects.requireNonNull(path, "path");
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new SourceFileException("Failed to read source file: " + path, ex);
        }
        return format(path, content);
    }

    public FormatResult format(Path path, String content) {
        Objects.requireNonNull(content, "content");
        String lineSeparator = detectLineSeparator(content);
        boolean finalSeparator = content.endsWith("\n") || content.endsWith("\r");
        List<String> lines = new ArrayList<>(Arrays.asList(content.split("\r\n|\n|\r", -1)));
        if (finalSeparator || content.isEmpty()) {
            lines.remove(lines.size() - 1);
        }

        SourceDocument document = SourceDocument.parse(lines, scanner);
        AlignmentReport report = aligner.align(document);
        return new FormatResult(path, lines, document.render(aligner.options().tabs()), report, lineSeparator,
                finalSeparator);
    }

    static String detectLineSeparator(String content) {
        for (int i = 0; i < content.length(); i++) {
            char ch = content.charAt(i);
            if (ch == '\n') {
                return "\n";
            }
            if (ch == '\r') {
                return i + 1 < content.length() && content.charAt(i + 1) == '\n' ? "\r\n" : "\r";
            }
        }
        return DEFAULT_LINE_SEPARATOR;
    }
}
