package ai.codealign.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.codealign.config.ConfigLoader;
import ai.codealign.format.SourceFileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final StringWriter output = new StringWriter();
    private final CliApplication application = new CliApplication(
            new ConfigLoader(key -> Optional.empty()), new SourceFileWriter(), new PrintWriter(output, true));

    @Test
    void printsFormattedText() throws IOException {
        Path source = writeSource("int a = 1;", "int bbb = 2;");

        int exitCode = application.run(new String[] {source.toString()});

        assertThat(exitCode).isZero();
        assertThat(output.toString().lines()).containsExactly("int a   = 1;", "int bbb = 2;");
        assertThat(Files.readAllLines(source, StandardCharsets.UTF_8)).containsExactly("int a = 1;", "int bbb = 2;");
    }

    @Test
    void writeModeRewritesFile() throws IOException {
        Path source = writeSource("x = 1; // one", "yyy = 22; // two");

        int exitCode = application.run(new String[] {"--mode", "write", source.toString()});

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(source, StandardCharsets.UTF_8))
                .containsExactly("x   = 1;  // one", "yyy = 22; // two");
    }

    @Test
    void checkModeFailsWhenAlignmentIsNeeded() throws IOException {
        Path pending = writeSource("a = 1", "bbb = 2");

        int exitCode = application.run(new String[] {"--mode", "check", pending.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_CHECK_FAILED);
        assertThat(output.toString()).contains(pending.toString());
        assertThat(Files.readAllLines(pending, StandardCharsets.UTF_8)).containsExactly("a = 1", "bbb = 2");
    }

    @Test
    void checkModePassesForAlignedFile() throws IOException {
        Path aligned = writeSource("a   = 1", "bbb = 2");

        int exitCode = application.run(new String[] {"--mode", "check", aligned.toString()});

        assertThat(exitCode).isZero();
    }

    @Test
    void checkModeIgnoresWhitespaceNoCandidateTouches() throws IOException {
        Path plain = tempDir.resolve("plain.c");
        Files.writeString(plain, "int x;   \nfoo(a,\tb);\n", StandardCharsets.UTF_8);

        int exitCode = application.run(new String[] {"--mode", "check", plain.toString()});

        assertThat(exitCode).isZero();
        assertThat(output.toString()).doesNotContain(plain.toString());
    }

    @Test
    void writeModeKeepsCarriageReturnLineFeed() throws IOException {
        Path source = tempDir.resolve("windows.c");
        Files.writeString(source, "a = 1\r\nbbb = 2\r\nint z;\r\n", StandardCharsets.UTF_8);

        int exitCode = application.run(new String[] {"--mode", "write", source.toString()});

        assertThat(exitCode).isZero();
        assertThat(Files.readString(source, StandardCharsets.UTF_8)).isEqualTo("a   = 1\r\nbbb = 2\r\nint z;\r\n");
    }

    @Test
    void tabOptionsReachTheLayout() throws IOException {
        Path source = writeSource("a = 1", "bb = 2");

        int exitCode = application.run(new String[] {"--tab-width", "4", "--align-on-tabstop", source.toString()});

        assertThat(exitCode).isZero();
        assertThat(output.toString().lines()).containsExactly("a   = 1", "bb  = 2");
    }

    @Test
    void missingFileIsReportedAsIoFailure() {
        int exitCode = application.run(new String[] {tempDir.resolve("absent.c").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_IO_FAILURE);
    }

    @Test
    void invalidOptionsReturnUsageError() {
        int unknownMode = application.run(new String[] {"--mode", "explode", "A.java"});
        int noFiles = application.run(new String[] {});
        int negativeSpan = application.run(new String[] {"--assign-span", "-1", "A.java"});

        assertThat(unknownMode).isEqualTo(2);
        assertThat(noFiles).isEqualTo(2);
        assertThat(negativeSpan).isEqualTo(2);
        assertThat(output.toString()).contains("Usage:");
    }

    @Test
    void helpPrintsUsage() {
        int exitCode = application.run(new String[] {"--help"});

        assertThat(exitCode).isZero();
        assertThat(output.toString()).contains("code-align").contains("--assign-span");
    }

    private Path writeSource(String... lines) throws IOException {
        Path source = tempDir.resolve("Sample.java");
        Files.write(source, List.of(lines), StandardCharsets.UTF_8);
        return source;
    }
}
