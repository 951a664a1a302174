package ai.codealign.format;

import ai.codealign.document.SourceLine;
import ai.codealign.document.SourceToken;
import ai.codealign.document.TokenKind;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Kinds of tokens aligned across lines. Categories are applied in declaration order.
 */
public enum AlignCategory implements CandidateSelector {

    /**
     * First assignment operator of a line that does not start with it.
     */
    ASSIGN {
        @Override
        public Optional<SourceToken> select(SourceLine line) {
            List<SourceToken> tokens = line.tokens();
            for (int i = 1; i < tokens.size(); i++) {
                SourceToken token = tokens.get(i);
                if (token.kind() == TokenKind.WORD && ASSIGNMENT_OPERATORS.contains(token.text())) {
                    return Optional.of(token);
                }
            }
            return Optional.empty();
        }
    },

    /**
     * The {@code //} marker of a comment that follows code on the same line.
     */
    TRAILING_COMMENT {
        @Override
        public Optional<SourceToken> select(SourceLine line) {
            List<SourceToken> tokens = line.tokens();
            for (int i = 1; i < tokens.size(); i++) {
                if (tokens.get(i).kind() == TokenKind.COMMENT_MARKER) {
                    return Optional.of(tokens.get(i));
                }
            }
            return Optional.empty();
        }
    };

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", ">>>=", ":=");
}
