package ai.codealign.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scanned lines of one source file.
 */
public final class SourceDocument {

    private final List<SourceLine> lines;

    public SourceDocument(List<SourceLine> lines) {
        this.lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        for (int i = 0; i < this.lines.size(); i++) {
            if (this.lines.get(i).number() != i + 1) {
                throw new IllegalArgumentException("Line numbers must be consecutive starting at 1");
            }
        }
    }

    public static SourceDocument parse(List<String> rawLines, LineScanner scanner) {
        Objects.requireNonNull(rawLines, "rawLines");
        Objects.requireNonNull(scanner, "scanner");
        List<SourceLine> lines = new ArrayList<>(rawLines.size());
        for (int i = 0; i < rawLines.size(); i++) {
            lines.add(scanner.scan(i + 1, rawLines.get(i)));
        }
        return new SourceDocument(lines);
    }

    public List<SourceLine> lines() {
        return lines;
    }

    public SourceLine line(int number) {
        if (number < 1 || number > lines.size()) {
            throw new IllegalArgumentException("No line " + number + " in document of " + lines.size() + " lines");
        }
        return lines.get(number - 1);
    }

    public List<String> render() {
        return render(TabOptions.DEFAULT);
    }

    public List<String> render(TabOptions options) {
        List<String> rendered = new ArrayList<>(lines.size());
        for (SourceLine line : lines) {
            rendered.add(line.render(options));
        }
        return rendered;
    }
}
