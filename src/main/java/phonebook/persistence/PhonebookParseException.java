package phonebook.persistence;

import java.nio.file.Path;

/**
 * Thrown when the backing file exists but is not a valid directory file: a wrong or missing
 * header, a row with the wrong number of columns, a bad ID, a field breaking a record rule,
 * broken quoting or text that is not UTF-8.
 */
public class PhonebookParseException extends PhonebookStorageException {

    public PhonebookParseException(final String message, final Path path) {
        super(message, path, null);
    }

    public PhonebookParseException(final String message, final Path path, final Throwable cause) {
        super(message, path, cause);
    }
}
