package ai.codealign.align;

/**
 * Moves a token to the column chosen by an {@link AlignStack} flush.
 *
 * @param <T> token type handled by the applier
 */
@FunctionalInterface
public interface ColumnApplier<T extends AlignToken> {

    void apply(T token, int targetColumn);
}
