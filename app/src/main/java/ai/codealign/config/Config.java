package ai.codealign.config;

import ai.codealign.document.TabOptions;
import ai.codealign.format.AlignOptions;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Mode mode,
        List<Path> files,
        AlignOptions alignOptions,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        files = List.copyOf(Objects.requireNonNull(files, "files"));
        if (files.isEmpty()) {
            throw new IllegalArgumentException("At least one file must be provided");
        }
        Objects.requireNonNull(alignOptions, "alignOptions");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }

    public TabOptions tabs() {
        return alignOptions.tabs();
    }

    public int tabWidth() {
        return alignOptions.tabs().tabWidth();
    }
}
