package phonebook.domain;

import java.util.Objects;
import java.util.regex.Pattern;
import phonebook.domain.error.DirectoryError;
import phonebook.domain.error.EmptyFieldError;
import phonebook.domain.error.InvalidPhoneFormatError;

/**
 * Field-level checks shared by record creation, editing and file loading.
 *
 * <p>Nothing here throws for bad input: failures come back as {@link Result#err(Object)} so
 * the console can re-prompt and the loader can turn them into parse errors.
 */
public final class Validation {

    /** Example format: {@code +7 (XXX) XXX-XX-XX}. */
    static final Pattern PHONE_PATTERN = Pattern.compile("^\\+7 \\(\\d{3}\\) \\d{3}-\\d{2}-\\d{2}$");

    private Validation() {
    }

    /**
     * Strips surrounding whitespace from {@code value} and requires something to be left.
     *
     * <p>Whitespace is anything {@link Character#isWhitespace(int)} accepts, Unicode spaces
     * included. The emptiness check runs on the stripped value, so an accepted value is never
     * empty.
     *
     * @param value     raw input, may be null
     * @param fieldName name reported in the error
     * @return the stripped value, or {@link EmptyFieldError} when nothing is left
     */
    public static Result<String, EmptyFieldError> validateString(final String value, final String fieldName) {
        final String stripped = value == null ? "" : value.strip();
        if (stripped.isEmpty()) {
            return Result.err(new EmptyFieldError(fieldName));
        }
        return Result.ok(stripped);
    }

    /**
     * Tests a phone number against {@code +7 (DDD) DDD-DD-DD}.
     *
     * <p>The whole value must match; no separators are added or removed.
     *
     * @param value candidate phone number, may be null
     * @return {@code true} iff the value matches exactly
     */
    public static boolean validatePhone(final String value) {
        return value != null && PHONE_PATTERN.matcher(value).matches();
    }

    /**
     * Escalates {@link #validatePhone(String)} to a typed error.
     */
    public static Result<String, InvalidPhoneFormatError> requirePhone(final String value, final String fieldName) {
        if (validatePhone(value)) {
            return Result.ok(value);
        }
        return Result.err(new InvalidPhoneFormatError(fieldName, value));
    }

    /**
     * Applies the rules of one contact column.
     *
     * <p>Text columns are stripped and must not be blank. Phone columns must additionally
     * match the phone pattern as given, so surrounding whitespace is rejected rather than
     * stripped.
     *
     * @param field column being validated, never {@link ContactField#ID}
     * @param value raw input
     * @return the value to store, or the first rule it breaks
     */
    public static Result<String, DirectoryError> validateField(final ContactField field, final String value) {
        Objects.requireNonNull(field, "field must not be null");
        if (field == ContactField.ID) {
            throw new IllegalArgumentException("ID is positional and cannot be supplied");
        }
        final Result<String, EmptyFieldError> trimmed = validateString(value, field.label());
        if (!trimmed.isOk()) {
            return Result.err(trimmed.error());
        }
        if (!field.isPhone()) {
            return Result.ok(trimmed.value());
        }
        final Result<String, InvalidPhoneFormatError> phone = requirePhone(value, field.label());
        if (!phone.isOk()) {
            return Result.err(phone.error());
        }
        return Result.ok(phone.value());
    }
}
