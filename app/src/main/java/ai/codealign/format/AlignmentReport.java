package ai.codealign.format;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Number of tokens each category moved in one document.
 */
public record AlignmentReport(Map<AlignCategory, Integer> movedTokens) {

    public AlignmentReport {
        Objects.requireNonNull(movedTokens, "movedTokens");
        EnumMap<AlignCategory, Integer> copy = new EnumMap<>(AlignCategory.class);
        copy.putAll(movedTokens);
        movedTokens = Map.copyOf(copy);
    }

    public int movedTokens(AlignCategory category) {
        return movedTokens.getOrDefault(category, 0);
    }

    public int totalMovedTokens() {
        return movedTokens.values().stream().mapToInt(Integer::intValue).sum();
    }
}
