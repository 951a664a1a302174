package ai.codealign.document;

import java.util.List;
import java.util.Objects;

/**
 * One line of a {@link SourceDocument}: its words and the whitespace left after the last of them.
 */
public final class SourceLine {

    private final int number;
    private final List<SourceToken> tokens;
    private final String trailingWhitespace;

    public SourceLine(int number, List<SourceToken> tokens, String trailingWhitespace) {
        if (number < 1) {
            throw new IllegalArgumentException("number must be 1 or greater");
        }
        this.number = number;
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        this.trailingWhitespace = Objects.requireNonNull(trailingWhitespace, "trailingWhitespace");
        for (int i = 1; i < this.tokens.size(); i++) {
            if (this.tokens.get(i).column() < this.tokens.get(i - 1).endColumn()) {
                throw new IllegalArgumentException("Tokens of line " + number + " overlap");
            }
        }
    }

    public int number() {
        return number;
    }

    public List<SourceToken> tokens() {
        return tokens;
    }

    /**
     * Whitespace after the last word, or the whole line when it has no words.
     */
    public String trailingWhitespace() {
        return trailingWhitespace;
    }

    public boolean isBlank() {
        return tokens.isEmpty();
    }

    /**
     * Column of the first word, zero for blank lines.
     */
    public int indentColumn() {
        return tokens.isEmpty() ? 0 : tokens.get(0).column();
    }

    /**
     * Position of {@code token} on this line, compared by identity.
     */
    public int indexOf(SourceToken token) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i) == token) {
                return i;
            }
        }
        throw new IllegalArgumentException(token + " is not part of line " + number);
    }

    public List<SourceToken> tokensFrom(SourceToken token) {
        return tokens.subList(indexOf(token), tokens.size());
    }

    public String render() {
        return render(TabOptions.DEFAULT);
    }

    /**
     * Rebuilds the text of the line from the current token columns.
     *
     * <p>Up to the first moved word the whitespace is written as read, except that tabs between words become
     * spaces unless {@link TabOptions#keepTabs()} is set. From the first moved word on, gaps are refilled to reach
     * each column, with tabs first when {@link TabOptions#alignWithTabs()} is set. Trailing whitespace is kept.</p>
     */
    public String render(TabOptions options) {
        Objects.requireNonNull(options, "options");
        StringBuilder builder = new StringBuilder();
        int column = 1;
        boolean settled = true;
        for (int i = 0; i < tokens.size(); i++) {
            SourceToken token = tokens.get(i);
            settled = settled && !token.isMoved();
            if (settled) {
                String gap = token.leadingWhitespace();
                builder.append(i == 0 || options.keepTabs() ? gap : expandTabs(gap, column, options));
            } else {
                fill(builder, column, token.column(), options);
            }
            builder.append(token.text());
            column = token.endColumn();
        }
        builder.append(trailingWhitespace);
        return builder.toString();
    }

    private static String expandTabs(String gap, int column, TabOptions options) {
        if (gap.indexOf('\t') < 0) {
            return gap;
        }
        StringBuilder expanded = new StringBuilder();
        int current = column;
        for (int i = 0; i < gap.length(); i++) {
            char ch = gap.charAt(i);
            int next = ch == '\t' ? options.nextTabStop(current) : current + 1;
            expanded.append(ch == '\t' ? " ".repeat(next - current) : String.valueOf(ch));
            current = next;
        }
        return expanded.toString();
    }

    private static void fill(StringBuilder builder, int from, int to, TabOptions options) {
        int column = from;
        if (options.alignWithTabs()) {
            while (options.nextTabStop(column) <= to) {
                builder.append('\t');
                column = options.nextTabStop(column);
            }
        }
        while (column < to) {
            builder.append(' ');
            column++;
        }
    }

    @Override
    public String toString() {
        return "SourceLine[" + number + ": " + render() + "]";
    }
}
