package phonebook.persistence;

import java.nio.file.Path;

/**
 * Thrown when the backing file cannot be read or rewritten.
 */
public class PhonebookPersistenceException extends PhonebookStorageException {

    public PhonebookPersistenceException(final String message, final Path path, final Throwable cause) {
        super(message, path, cause);
    }
}
