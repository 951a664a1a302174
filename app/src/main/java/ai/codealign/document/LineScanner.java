package ai.codealign.document;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits raw text lines into whitespace-separated words.
 *
 * <p>A {@code //} at the start of a word opens a comment: the marker becomes its own word and the rest of the line,
 * trailing whitespace removed, becomes a single body word. Tabs advance to the next tab stop. Nothing else about the
 * language is known here. The whitespace in front of every word and after the last one is recorded as read.</p>
 */
public class LineScanner {

    static final String COMMENT_MARKER = "//";

    private final TabOptions tabs;

    public LineScanner(int tabWidth) {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be 1 or greater");
        }
        this.tabs = TabOptions.of(tabWidth);
    }

    public int tabWidth() {
        return tabs.tabWidth();
    }

    public SourceLine scan(int lineNumber, String text) {
        String raw = text == null ? "" : text;
        List<SourceToken> tokens = new ArrayList<>();
        int column = 1;
        int index = 0;
        int gapStart = 0;
        while (index < raw.length()) {
            char ch = raw.charAt(index);
            if (ch == '\t') {
                column = tabs.nextTabStop(column);
                index++;
                continue;
            }
            if (Character.isWhitespace(ch)) {
                column++;
                index++;
                continue;
            }
            String gap = raw.substring(gapStart, index);
            if (raw.startsWith(COMMENT_MARKER, index)) {
                tokens.add(new SourceToken(COMMENT_MARKER, TokenKind.COMMENT_MARKER, column, lineNumber, gap));
                int bodyStart = index + COMMENT_MARKER.length();
                String body = raw.substring(bodyStart).stripTrailing();
                if (!body.isEmpty()) {
                    tokens.add(new SourceToken(body, TokenKind.COMMENT_BODY, column + COMMENT_MARKER.length(),
                            lineNumber, ""));
                }
                gapStart = bodyStart + body.length();
                break;
            }
            int start = index;
            while (index < raw.length() && !Character.isWhitespace(raw.charAt(index))) {
                index++;
            }
            tokens.add(new SourceToken(raw.substring(start, index), TokenKind.WORD, column, lineNumber, gap));
            column += index - start;
            gapStart = index;
        }
        return new SourceLine(lineNumber, tokens, raw.substring(gapStart));
    }
}
