package eu.fbk.ebes.tool;

import java.io.File;
import java.io.IOException;

import javax.annotation.Nullable;

/**
 * Signals that a query file cannot be read or does not have the expected structure.
 */
public class QueryFileException extends IOException {

    private static final long serialVersionUID = 1L;

    private final File file;

    public QueryFileException(final File file, final String message) {
        this(file, message, null);
    }

    public QueryFileException(final File file, final String message,
            @Nullable final Throwable cause) {
        super("Invalid query file " + file + ": " + message, cause);
        this.file = file;
    }

    public File getFile() {
        return this.file;
    }

}
