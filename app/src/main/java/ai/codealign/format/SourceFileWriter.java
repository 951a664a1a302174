package ai.codealign.format;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;

/**
 * Writes formatted lines back over the file they were read from, keeping its line separator.
 */
public class SourceFileWriter {

    public void write(FormatResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result must be provided");
        }
        try {
            Files.writeString(result.path(), result.content(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new SourceFileException("Failed to write formatted file: " + result.path(), ex);
        }
    }
}
