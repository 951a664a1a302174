package ai.codealign.document;

/**
 * How tab stops take part in alignment.
 *
 * @param tabWidth       columns between tab stops
 * @param alignOnTabstop round every alignment target up to the next tab stop
 * @param alignWithTabs  fill the gap in front of a moved word with tabs as far as they reach, then spaces
 * @param keepTabs       keep tabs between words that were not moved; when unset they become spaces
 */
public record TabOptions(int tabWidth, boolean alignOnTabstop, boolean alignWithTabs, boolean keepTabs) {

    public static final int DEFAULT_TAB_WIDTH = 8;
    public static final TabOptions DEFAULT = of(DEFAULT_TAB_WIDTH);

    public TabOptions {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be 1 or greater");
        }
    }

    public static TabOptions of(int tabWidth) {
        return new TabOptions(tabWidth, false, false, true);
    }

    /**
     * First tab stop strictly after {@code column}.
     */
    public int nextTabStop(int column) {
        return ((column - 1) / tabWidth + 1) * tabWidth + 1;
    }

    /**
     * {@code column} itself when it is a tab stop, otherwise the next one.
     */
    public int roundUpToTabStop(int column) {
        return (column - 1) % tabWidth == 0 ? column : nextTabStop(column);
    }
}
