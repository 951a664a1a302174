package ai.codealign.format;

/**
 * Runtime exception for source files that cannot be read or written.
 */
public class SourceFileException extends RuntimeException {

    public SourceFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
