package phonebook.domain.error;

/**
 * A phone value did not match {@code +7 (XXX) XXX-XX-XX}.
 *
 * @param fieldName label of the offending field
 * @param value     the rejected input, as given
 */
public record InvalidPhoneFormatError(String fieldName, String value) implements DirectoryError {

    @Override
    public String message() {
        return fieldName + ": некорректный формат телефона '" + value
                + "'. Используйте формат +7 (XXX) XXX-XX-XX";
    }
}
