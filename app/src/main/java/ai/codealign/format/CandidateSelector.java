package ai.codealign.format;

import ai.codealign.document.SourceLine;
import ai.codealign.document.SourceToken;
import java.util.Optional;

/**
 * Picks at most one alignment candidate from a line.
 */
@FunctionalInterface
public interface CandidateSelector {

    Optional<SourceToken> select(SourceLine line);
}
