package ai.codealign.config;

import ai.codealign.align.AlignSettings;
import ai.codealign.cli.CliArguments;
import ai.codealign.document.TabOptions;
import ai.codealign.format.AlignCategory;
import ai.codealign.format.AlignOptions;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "ALIGN_MODE";
    static final String ENV_ASSIGN_SPAN = "ALIGN_ASSIGN_SPAN";
    static final String ENV_ASSIGN_THRESH = "ALIGN_ASSIGN_THRESH";
    static final String ENV_RIGHT_CMT_SPAN = "ALIGN_RIGHT_CMT_SPAN";
    static final String ENV_RIGHT_CMT_THRESH = "ALIGN_RIGHT_CMT_THRESH";
    static final String ENV_TAB_WIDTH = "ALIGN_TAB_WIDTH";
    static final String ENV_ON_TABSTOP = "ALIGN_ON_TABSTOP";
    static final String ENV_WITH_TABS = "ALIGN_WITH_TABS";
    static final String ENV_KEEP_TABS = "ALIGN_KEEP_TABS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final int DEFAULT_ASSIGN_SPAN = 1;
    static final int DEFAULT_ASSIGN_THRESH = 0;
    static final int DEFAULT_RIGHT_CMT_SPAN = 3;
    static final int DEFAULT_RIGHT_CMT_THRESH = 0;
    static final int DEFAULT_TAB_WIDTH = TabOptions.DEFAULT_TAB_WIDTH;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = resolveMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        int assignSpan = resolveCount(arguments.assignSpan(), "--assign-span", ENV_ASSIGN_SPAN, DEFAULT_ASSIGN_SPAN);
        int assignThreshold = resolveCount(arguments.assignThreshold(), "--assign-threshold", ENV_ASSIGN_THRESH,
                DEFAULT_ASSIGN_THRESH);
        int commentSpan = resolveCount(arguments.commentSpan(), "--comment-span", ENV_RIGHT_CMT_SPAN,
                DEFAULT_RIGHT_CMT_SPAN);
        int commentThreshold = resolveCount(arguments.commentThreshold(), "--comment-threshold", ENV_RIGHT_CMT_THRESH,
                DEFAULT_RIGHT_CMT_THRESH);
        int tabWidth = resolveCount(arguments.tabWidth(), "--tab-width", ENV_TAB_WIDTH, DEFAULT_TAB_WIDTH);
        if (tabWidth < 1) {
            throw new IllegalArgumentException("Tab width must be 1 or greater");
        }
        TabOptions tabs = new TabOptions(tabWidth,
                resolveFlag(arguments.alignOnTabstop(), ENV_ON_TABSTOP, false),
                resolveFlag(arguments.alignWithTabs(), ENV_WITH_TABS, false),
                resolveFlag(arguments.keepTabs(), ENV_KEEP_TABS, true));

        Map<AlignCategory, AlignSettings> settings = new EnumMap<>(AlignCategory.class);
        settings.put(AlignCategory.ASSIGN, new AlignSettings(assignSpan, assignThreshold));
        settings.put(AlignCategory.TRAILING_COMMENT, new AlignSettings(commentSpan, commentThreshold));

        return new Config(mode, arguments.files(), new AlignOptions(settings, tabs), logFormat);
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_MODE)
                .filter(ConfigLoader::isNotBlank)
                .map(Mode::from)
                .orElse(Mode.PRINT);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveCount(Integer cliValue, String optionName, String envKey, int defaultValue) {
        if (cliValue != null) {
            if (cliValue < 0) {
                throw new IllegalArgumentException(optionName + " must be zero or greater");
            }
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> parseCount(value, envKey))
                .orElse(defaultValue);
    }

    private boolean resolveFlag(Boolean cliValue, String envKey, boolean defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim()))
                .orElse(defaultValue);
    }

    private static int parseCount(String raw, String envKey) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(envKey + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
