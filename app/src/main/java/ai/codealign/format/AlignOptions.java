package ai.codealign.format;

import ai.codealign.align.AlignSettings;
import ai.codealign.document.TabOptions;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Span and threshold for every alignment category, and the tab handling used to lay out the result. Categories
 * without settings are disabled.
 */
public record AlignOptions(Map<AlignCategory, AlignSettings> settings, TabOptions tabs) {

    public AlignOptions {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(tabs, "tabs");
        EnumMap<AlignCategory, AlignSettings> copy = new EnumMap<>(AlignCategory.class);
        copy.putAll(settings);
        settings = Map.copyOf(copy);
    }

    public AlignOptions(Map<AlignCategory, AlignSettings> settings) {
        this(settings, TabOptions.DEFAULT);
    }

    public AlignSettings settingsFor(AlignCategory category) {
        return settings.getOrDefault(category, AlignSettings.DISABLED);
    }

    public boolean isEnabled(AlignCategory category) {
        return settingsFor(category).isEnabled();
    }
}
