package ai.codealign.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.codealign.align.AlignSettings;
import ai.codealign.cli.CliArguments;
import ai.codealign.document.TabOptions;
import ai.codealign.format.AlignCategory;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "check",
                "--assign-span", "4",
                "--assign-threshold", "6",
                "--comment-span", "0",
                "--tab-width", "2",
                "--log-format", "json",
                "A.java", "B.java");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.CHECK);
        assertThat(config.files()).containsExactly(Path.of("A.java"), Path.of("B.java"));
        assertThat(config.alignOptions().settingsFor(AlignCategory.ASSIGN)).isEqualTo(new AlignSettings(4, 6));
        assertThat(config.alignOptions().isEnabled(AlignCategory.TRAILING_COMMENT)).isFalse();
        assertThat(config.tabWidth()).isEqualTo(2);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_MODE, "write");
        envValues.put(ConfigLoader.ENV_ASSIGN_SPAN, "2");
        envValues.put(ConfigLoader.ENV_ASSIGN_THRESH, " 3 ");
        envValues.put(ConfigLoader.ENV_RIGHT_CMT_SPAN, "5");
        envValues.put(ConfigLoader.ENV_RIGHT_CMT_THRESH, "1");
        envValues.put(ConfigLoader.ENV_TAB_WIDTH, "4");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "text");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "Main.java");

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.WRITE);
        assertThat(config.alignOptions().settingsFor(AlignCategory.ASSIGN)).isEqualTo(new AlignSettings(2, 3));
        assertThat(config.alignOptions().settingsFor(AlignCategory.TRAILING_COMMENT)).isEqualTo(new AlignSettings(5, 1));
        assertThat(config.tabWidth()).isEqualTo(4);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void cliOverridesEnvironment() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--assign-span", "7", "Main.java");

        Config config = new ConfigLoader(key -> ConfigLoader.ENV_ASSIGN_SPAN.equals(key)
                ? Optional.of("2") : Optional.empty()).load(cliArguments);

        assertThat(config.alignOptions().settingsFor(AlignCategory.ASSIGN).span()).isEqualTo(7);
    }

    @Test
    void appliesDefaultsWhenNothingConfigured() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "Main.java");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.PRINT);
        assertThat(config.alignOptions().settingsFor(AlignCategory.ASSIGN))
                .isEqualTo(new AlignSettings(ConfigLoader.DEFAULT_ASSIGN_SPAN, ConfigLoader.DEFAULT_ASSIGN_THRESH));
        assertThat(config.alignOptions().settingsFor(AlignCategory.TRAILING_COMMENT))
                .isEqualTo(new AlignSettings(ConfigLoader.DEFAULT_RIGHT_CMT_SPAN, ConfigLoader.DEFAULT_RIGHT_CMT_THRESH));
        assertThat(config.tabWidth()).isEqualTo(ConfigLoader.DEFAULT_TAB_WIDTH);
        assertThat(config.tabs()).isEqualTo(TabOptions.of(ConfigLoader.DEFAULT_TAB_WIDTH));
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void resolvesTabFlagsFromCliAndEnvironment() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_ON_TABSTOP, "true");
        envValues.put(ConfigLoader.ENV_WITH_TABS, "1");
        envValues.put(ConfigLoader.ENV_KEEP_TABS, "false");
        CliArguments fromEnvironment = CommandLine.populateCommand(new CliArguments(), "Main.java");
        CliArguments overridden = CommandLine.populateCommand(new CliArguments(),
                "--no-align-on-tabstop", "--keep-tabs", "Main.java");
        ConfigLoader loader = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key)));

        TabOptions environmentTabs = loader.load(fromEnvironment).tabs();
        TabOptions cliTabs = loader.load(overridden).tabs();

        assertThat(environmentTabs).isEqualTo(new TabOptions(ConfigLoader.DEFAULT_TAB_WIDTH, true, true, false));
        assertThat(cliTabs).isEqualTo(new TabOptions(ConfigLoader.DEFAULT_TAB_WIDTH, false, true, true));
    }

    @Test
    void rejectsInvalidEnvironmentValues() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "Main.java");

        Throwable notNumber = catchThrowable(() -> new ConfigLoader(key -> ConfigLoader.ENV_ASSIGN_SPAN.equals(key)
                ? Optional.of("wide") : Optional.empty()).load(cliArguments));
        Throwable negative = catchThrowable(() -> new ConfigLoader(key -> ConfigLoader.ENV_RIGHT_CMT_THRESH.equals(key)
                ? Optional.of("-1") : Optional.empty()).load(cliArguments));
        Throwable zeroTabs = catchThrowable(() -> new ConfigLoader(key -> ConfigLoader.ENV_TAB_WIDTH.equals(key)
                ? Optional.of("0") : Optional.empty()).load(cliArguments));

        assertThat(notNumber).isInstanceOf(IllegalArgumentException.class).hasMessageContaining(ConfigLoader.ENV_ASSIGN_SPAN);
        assertThat(negative).isInstanceOf(IllegalArgumentException.class).hasMessageContaining(ConfigLoader.ENV_RIGHT_CMT_THRESH);
        assertThat(zeroTabs).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNegativeCliValues() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--comment-span", "-2", "Main.java");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--comment-span");
    }
}
