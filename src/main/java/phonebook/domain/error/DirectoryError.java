package phonebook.domain.error;

/**
 * Recoverable failure of a directory operation.
 *
 * <p>Callers re-prompt or report these and carry on; none of them leaves the directory in a
 * modified state.
 */
public sealed interface DirectoryError
        permits EmptyFieldError, InvalidPhoneFormatError, IndexOutOfRangeError, EmptyQueryError {

    /**
     * @return message suitable for showing to the user
     */
    String message();
}
