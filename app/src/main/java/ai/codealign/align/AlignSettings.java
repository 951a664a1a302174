package ai.codealign.align;

/**
 * Span and threshold of one alignment category.
 *
 * <p>The span is the number of lines a pending group may wait for another candidate; zero disables the
 * category. The threshold is the tolerated column deviation from the current target; zero accepts any column.</p>
 */
public record AlignSettings(int span, int threshold) {

    public static final AlignSettings DISABLED = new AlignSettings(0, 0);

    public AlignSettings {
        if (span < 0) {
            throw new IllegalArgumentException("span must be zero or greater");
        }
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be zero or greater");
        }
    }

    public boolean isEnabled() {
        return span > 0;
    }
}
