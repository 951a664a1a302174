package ai.codealign.document;

/**
 * Classification of scanned words.
 */
public enum TokenKind {
    WORD,
    COMMENT_MARKER,
    COMMENT_BODY
}
