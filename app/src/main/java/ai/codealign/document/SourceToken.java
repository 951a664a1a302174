package ai.codealign.document;

import ai.codealign.align.AlignToken;
import java.util.Objects;

/**
 * A word of a source line with its current column. The column is the only mutable part; the column and the
 * whitespace in front of the word as read are kept so an unmoved word can be written back unchanged.
 */
public final class SourceToken implements AlignToken {

    private final String text;
    private final TokenKind kind;
    private final int originLine;
    private final int originalColumn;
    private final String leadingWhitespace;
    private int column;

    public SourceToken(String text, TokenKind kind, int column, int originLine, String leadingWhitespace) {
        this.text = Objects.requireNonNull(text, "text");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.leadingWhitespace = Objects.requireNonNull(leadingWhitespace, "leadingWhitespace");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("text must not be empty");
        }
        if (column < 1) {
            throw new IllegalArgumentException("column must be 1 or greater");
        }
        if (originLine < 1) {
            throw new IllegalArgumentException("originLine must be 1 or greater");
        }
        this.column = column;
        this.originalColumn = column;
        this.originLine = originLine;
    }

    public String text() {
        return text;
    }

    public TokenKind kind() {
        return kind;
    }

    @Override
    public int column() {
        return column;
    }

    @Override
    public int length() {
        return text.length();
    }

    @Override
    public int originLine() {
        return originLine;
    }

    public int originalColumn() {
        return originalColumn;
    }

    public boolean isMoved() {
        return column != originalColumn;
    }

    /**
     * Whitespace between the previous word, or the start of the line, and this word as read.
     */
    public String leadingWhitespace() {
        return leadingWhitespace;
    }

    /**
     * Column just past the last character.
     */
    public int endColumn() {
        return column + text.length();
    }

    void moveTo(int column) {
        if (column < 1) {
            throw new IllegalArgumentException("column must be 1 or greater");
        }
        this.column = column;
    }

    @Override
    public String toString() {
        return "SourceToken[" + text + " @" + originLine + ":" + column + "]";
    }
}
