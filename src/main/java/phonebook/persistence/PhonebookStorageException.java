package phonebook.persistence;

import java.nio.file.Path;

/**
 * Base class for failures reading or writing the backing file.
 *
 * <p>Unlike field and lookup errors these are not recoverable by re-prompting, so they
 * propagate to whoever drives the directory.
 */
public class PhonebookStorageException extends RuntimeException {

    private final transient Path path;

    public PhonebookStorageException(final String message, final Path path, final Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * @return the file the failed operation was working on
     */
    public Path getPath() {
        return path;
    }
}
