package ai.codealign.document;

import ai.codealign.align.ColumnApplier;
import java.util.List;
import java.util.Objects;

/**
 * Moves a token to a target column and carries the rest of its line along by the same amount.
 *
 * <p>The target is clamped so the token never runs into the word before it: one space stays between them, or none
 * when they were already touching. With {@link TabOptions#alignOnTabstop()} the result is then rounded up to the
 * next tab stop.</p>
 */
public class ShiftingColumnApplier implements ColumnApplier<SourceToken> {

    private final SourceDocument document;
    private final TabOptions tabs;

    public ShiftingColumnApplier(SourceDocument document) {
        this(document, TabOptions.DEFAULT);
    }

    public ShiftingColumnApplier(SourceDocument document, TabOptions tabs) {
        this.document = Objects.requireNonNull(document, "document");
        this.tabs = Objects.requireNonNull(tabs, "tabs");
    }

    @Override
    public void apply(SourceToken token, int targetColumn) {
        SourceLine line = document.line(token.originLine());
        List<SourceToken> tokens = line.tokens();
        int index = line.indexOf(token);

        int column = Math.max(1, targetColumn);
        if (index > 0) {
            SourceToken previous = tokens.get(index - 1);
            int gap = Math.min(1, token.column() - previous.endColumn());
            column = Math.max(column, previous.endColumn() + gap);
        }
        if (tabs.alignOnTabstop()) {
            column = tabs.roundUpToTabStop(column);
        }

        int delta = column - token.column();
        if (delta == 0) {
            return;
        }
        for (SourceToken follower : line.tokensFrom(token)) {
            follower.moveTo(follower.column() + delta);
        }
    }
}
