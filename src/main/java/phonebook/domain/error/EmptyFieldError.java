package phonebook.domain.error;

/**
 * A required field was blank after stripping whitespace.
 *
 * @param fieldName label of the offending field
 */
public record EmptyFieldError(String fieldName) implements DirectoryError {

    @Override
    public String message() {
        return fieldName + " не может быть пустым.";
    }
}
