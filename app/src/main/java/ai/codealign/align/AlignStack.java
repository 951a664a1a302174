package ai.codealign.align;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups tokens of consecutive lines so that their trailing edges end on a shared column.
 *
 * <p>Candidates arrive in file order, at most one per line. A candidate joins the pending group when its column is
 * within {@code threshold} of the current target column; otherwise it is parked on the skipped list. Whenever the
 * target grows, every skipped candidate is offered again. The group is committed once more than {@code span} lines
 * pass without a new member, or when the session ends.</p>
 *
 * <p>One instance serves one session at a time and is not thread-safe.</p>
 *
 * @param <T> token type
 */
public final class AlignStack<T extends AlignToken> {

    private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(AlignStack.class);

    private final ColumnApplier<? super T> applier;
    private final Logger logger;
    private final List<AlignEntry<T>> aligned = new ArrayList<>();
    private final List<AlignEntry<T>> skipped = new ArrayList<>();

    private int span;
    private int threshold;
    private int maxColumn;
    private int newlineSeqnum;
    private int seqnum;

    public AlignStack(ColumnApplier<? super T> applier) {
        this(applier, DEFAULT_LOGGER);
    }

    /**
     * @param applier receives every committed token with its target column
     * @param logger  destination of the decision trace
     */
    public AlignStack(ColumnApplier<? super T> applier, Logger logger) {
        this.applier = Objects.requireNonNull(applier, "applier");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Opens a new session, dropping anything left from a previous one.
     *
     * @param span      number of lines a pending group may wait for another member
     * @param threshold tolerated column deviation, zero to accept every column
     */
    public void start(int span, int threshold) {
        start(new AlignSettings(span, threshold));
    }

    /**
     * Opens a new session with the span and threshold of {@code settings}.
     */
    public void start(AlignSettings settings) {
        Objects.requireNonNull(settings, "settings");
        logger.debug("Start(span={}, threshold={})", settings.span(), settings.threshold());
        aligned.clear();
        skipped.clear();
        this.span = settings.span();
        this.threshold = settings.threshold();
        maxColumn = 0;
        newlineSeqnum = 0;
        seqnum = 0;
    }

    /**
     * Adds a candidate seen on the current line.
     */
    public void add(T token) {
        add(token, seqnum);
    }

    /**
     * Adds a candidate with an explicit sequence number. Sequence numbers must not decrease within a session.
     */
    public void add(T token, int seqnum) {
        Objects.requireNonNull(token, "token");
        if (!accepts(token.column())) {
            skipped.add(new AlignEntry<>(token, seqnum));
            logger.debug("Skipped [{}/{}/{}]: line {}, col {} outside {} +/- {}",
                    seqnum, newlineSeqnum, this.seqnum, token.originLine(), token.column(), maxColumn, threshold);
            return;
        }

        if (seqnum > newlineSeqnum) {
            newlineSeqnum = seqnum;
        }
        aligned.add(new AlignEntry<>(token, seqnum));

        int endColumn = token.column() + token.length();
        if (endColumn > maxColumn) {
            logger.debug("Aligned [{}/{}/{}]: line {}, col {}: max column {} -> {}",
                    seqnum, newlineSeqnum, this.seqnum, token.originLine(), token.column(), maxColumn, endColumn);
            maxColumn = endColumn;
            reAddSkipped();
        } else {
            logger.debug("Aligned [{}/{}/{}]: line {}, col {}: end {} <= {}",
                    seqnum, newlineSeqnum, this.seqnum, token.originLine(), token.column(), endColumn, maxColumn);
        }
    }

    /**
     * Records {@code count} line breaks and commits the pending group once it has waited longer than the span.
     */
    public void newLines(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be zero or greater");
        }
        if (aligned.isEmpty()) {
            return;
        }
        seqnum += count;
        if (seqnum - newlineSeqnum > span) {
            logger.debug("NewLines({}): seqnum {} passed span {} after {}", count, seqnum, span, newlineSeqnum);
            flush();
        } else {
            logger.trace("NewLines({}): seqnum {}", count, seqnum);
        }
    }

    /**
     * Moves every pending token so that its trailing edge ends on the target column, then seeds the next group
     * from skipped candidates that are not older than the committed group.
     */
    public void flush() {
        logger.debug("Flush {} entries to column {}", aligned.size(), maxColumn);
        int lastSeqnum = 0;
        if (!aligned.isEmpty()) {
            for (AlignEntry<T> entry : aligned) {
                applier.apply(entry.token(), maxColumn - entry.token().length());
            }
            lastSeqnum = aligned.get(aligned.size() - 1).seqnum();
            aligned.clear();
        }
        maxColumn = 0;

        if (skipped.isEmpty()) {
            newlineSeqnum = seqnum;
            return;
        }
        int cutoff = lastSeqnum;
        skipped.removeIf(entry -> entry.seqnum() < cutoff);
        reAddSkipped();
    }

    /**
     * Commits the pending group and closes the session. Candidates still skipped are dropped unaligned.
     */
    public void end() {
        if (!aligned.isEmpty()) {
            logger.debug("End: flushing pending group");
            flush();
        }
        if (!skipped.isEmpty()) {
            logger.debug("End: dropping {} unaligned entries", skipped.size());
        }
        aligned.clear();
        skipped.clear();
    }

    public int span() {
        return span;
    }

    public int threshold() {
        return threshold;
    }

    /**
     * Target column of the pending group, zero when no group is pending.
     */
    public int maxColumn() {
        return maxColumn;
    }

    public int sequenceNumber() {
        return seqnum;
    }

    /**
     * Sequence number of the most recently accepted candidate.
     */
    public int newlineSequenceNumber() {
        return newlineSeqnum;
    }

    public boolean isIdle() {
        return aligned.isEmpty();
    }

    public List<T> alignedTokens() {
        return tokensOf(aligned);
    }

    public List<T> skippedTokens() {
        return tokensOf(skipped);
    }

    private boolean accepts(int column) {
        // first candidate of a group
        if (maxColumn == 0) {
            return true;
        }
        // tolerance check disabled
        if (threshold == 0) {
            return true;
        }
        return column >= maxColumn - threshold && column <= maxColumn + threshold;
    }

    private void reAddSkipped() {
        if (skipped.isEmpty()) {
            return;
        }
        List<AlignEntry<T>> replay = new ArrayList<>(skipped);
        skipped.clear();
        // newlineSeqnum and maxColumn must evolve in line order
        replay.sort(Comparator.comparingInt(AlignEntry::seqnum));
        for (AlignEntry<T> entry : replay) {
            logger.trace("Replaying skipped entry [{}]", entry.seqnum());
            add(entry.token(), entry.seqnum());
        }
        newLines(0);
    }

    private List<T> tokensOf(List<AlignEntry<T>> entries) {
        List<T> tokens = new ArrayList<>(entries.size());
        for (AlignEntry<T> entry : entries) {
            tokens.add(entry.token());
        }
        return List.copyOf(tokens);
    }
}
