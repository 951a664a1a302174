package ai.codealign.format;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of formatting a single file.
 *
 * @param lineSeparator  separator used between lines when the result is written
 * @param finalSeparator whether the file ends with a line separator
 */
public record FormatResult(
        Path path,
        List<String> originalLines,
        List<String> lines,
        AlignmentReport report,
        String lineSeparator,
        boolean finalSeparator
) {

    public FormatResult {
        Objects.requireNonNull(path, "path");
        originalLines = List.copyOf(Objects.requireNonNull(originalLines, "originalLines"));
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(lineSeparator, "lineSeparator");
        if (lineSeparator.isEmpty()) {
            throw new IllegalArgumentException("lineSeparator must not be empty");
        }
    }

    public boolean changed() {
        return !originalLines.equals(lines);
    }

    /**
     * The formatted lines joined the way the file was laid out.
     */
    public String content() {
        String joined = String.join(lineSeparator, lines);
        return finalSeparator && !lines.isEmpty() ? joined + lineSeparator : joined;
    }
}
