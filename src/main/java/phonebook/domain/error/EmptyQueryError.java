package phonebook.domain.error;

/**
 * Search was requested with a blank term.
 */
public record EmptyQueryError() implements DirectoryError {

    @Override
    public String message() {
        return "Введите корректный текст для поиска.";
    }
}
