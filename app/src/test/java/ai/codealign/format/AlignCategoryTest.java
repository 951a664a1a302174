package ai.codealign.format;

import static org.assertj.core.api.Assertions.assertThat;

import ai.codealign.document.LineScanner;
import ai.codealign.document.SourceLine;
import ai.codealign.document.SourceToken;
import org.junit.jupiter.api.Test;

class AlignCategoryTest {

    private final LineScanner scanner = new LineScanner(8);

    @Test
    void assignPicksFirstAssignmentOperator() {
        SourceLine line = scanner.scan(1, "total += a == b = c");

        assertThat(AlignCategory.ASSIGN.select(line)).map(SourceToken::column).contains(7);
    }

    @Test
    void assignIgnoresLeadingOperatorAndComments() {
        assertThat(AlignCategory.ASSIGN.select(scanner.scan(1, "= value"))).isEmpty();
        assertThat(AlignCategory.ASSIGN.select(scanner.scan(1, "call(); // x = 1"))).isEmpty();
    }

    @Test
    void trailingCommentNeedsCodeBeforeIt() {
        assertThat(AlignCategory.TRAILING_COMMENT.select(scanner.scan(1, "x = 1; // one")))
                .map(SourceToken::column).contains(8);
        assertThat(AlignCategory.TRAILING_COMMENT.select(scanner.scan(1, "    // alone"))).isEmpty();
    }
}
