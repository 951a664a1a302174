package ai.codealign.format;

import ai.codealign.align.AlignSettings;
import ai.codealign.align.AlignStack;
import ai.codealign.align.ColumnApplier;
import ai.codealign.document.ShiftingColumnApplier;
import ai.codealign.document.SourceDocument;
import ai.codealign.document.SourceLine;
import ai.codealign.document.SourceToken;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds the lines of a document through one {@link AlignStack} session per category and region.
 *
 * <p>A region is a run of lines that share the same indentation; blank lines belong to the region around them.
 * Categories run one after another, so a later category sees the columns left by an earlier one.</p>
 */
public class DocumentAligner {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentAligner.class);

    private final AlignOptions options;

    public DocumentAligner(AlignOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public AlignOptions options() {
        return options;
    }

    public AlignmentReport align(SourceDocument document) {
        Objects.requireNonNull(document, "document");
        ShiftingColumnApplier shifter = new ShiftingColumnApplier(document, options.tabs());
        Map<AlignCategory, Integer> moved = new EnumMap<>(AlignCategory.class);
        for (AlignCategory category : AlignCategory.values()) {
            AlignSettings settings = options.settingsFor(category);
            if (!settings.isEnabled()) {
                LOGGER.debug("Skipping disabled category {}", category);
                continue;
            }
            CountingApplier applier = new CountingApplier(shifter);
            AlignStack<SourceToken> stack = new AlignStack<>(applier,
                    LoggerFactory.getLogger(AlignStack.class.getName() + "." + category.name()));
            alignCategory(document, category, settings, stack);
            moved.put(category, applier.movedTokens);
            LOGGER.debug("Category {} moved {} tokens", category, applier.movedTokens);
        }
        return new AlignmentReport(moved);
    }

    private void alignCategory(SourceDocument document, CandidateSelector selector, AlignSettings settings,
                               AlignStack<SourceToken> stack) {
        int regionIndent = -1;
        stack.start(settings);
        for (SourceLine line : document.lines()) {
            if (!line.isBlank()) {
                int indent = line.indentColumn();
                if (regionIndent != -1 && indent != regionIndent) {
                    stack.end();
                    stack.start(settings);
                }
                regionIndent = indent;
                selector.select(line).ifPresent(stack::add);
            }
            stack.newLines(1);
        }
        stack.end();
    }

    private static final class CountingApplier implements ColumnApplier<SourceToken> {

        private final ColumnApplier<SourceToken> delegate;
        private int movedTokens;

        private CountingApplier(ColumnApplier<SourceToken> delegate) {
            this.delegate = delegate;
        }

        @Override
        public void apply(SourceToken token, int targetColumn) {
            int before = token.column();
            delegate.apply(token, targetColumn);
            if (token.column() != before) {
                movedTokens++;
            }
        }
    }
}
