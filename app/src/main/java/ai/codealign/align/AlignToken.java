package ai.codealign.align;

/**
 * Read-only view of a formatting token that can take part in vertical alignment.
 *
 * <p>Tokens are owned by the surrounding document. The alignment engine only reads their position and never
 * changes it directly; column updates go through a {@link ColumnApplier}.</p>
 */
public interface AlignToken {

    /**
     * Current 1-based column of the first character.
     */
    int column();

    /**
     * Width of the token in columns.
     */
    int length();

    /**
     * 1-based line the token was read from. Diagnostic only.
     */
    int originLine();
}
