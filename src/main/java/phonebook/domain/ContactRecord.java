package phonebook.domain;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import phonebook.domain.error.DirectoryError;

/**
 * One directory entry.
 *
 * <p>Enforces the contact requirements:
 * <ul>
 *   <li>lastName, firstName, patronymic, organization: required, stored stripped of surrounding whitespace</li>
 *   <li>workPhone, personalPhone: required, exactly {@code +7 (XXX) XXX-XX-XX}</li>
 * </ul>
 *
 * <p>The record has no id of its own. Its id is its one-based position in the directory and is
 * only exposed through {@link ContactEntry}, so an in-memory record can never disagree with the
 * row number written for it.
 *
 * <p>All checks go through {@link Validation}; {@link #create(ContactDraft)} and
 * {@link #apply(ContactUpdate)} report failures as {@link Result} values.
 *
 * @see ContactEntry
 */
public final class ContactRecord {

    private final Map<ContactField, String> values;

    private ContactRecord(final Map<ContactField, String> values) {
        this.values = values;
    }

    /**
     * Validates a draft and builds a record from it.
     *
     * <p>Fields are checked in column order and the first failure is returned.
     *
     * @param draft raw values (must not be null)
     * @return the new record, or the first field error
     */
    public static Result<ContactRecord, DirectoryError> create(final ContactDraft draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        final Map<ContactField, String> validated = new EnumMap<>(ContactField.class);
        for (final ContactField field : ContactField.textFields()) {
            final Result<String, DirectoryError> checked = Validation.validateField(field, draft.get(field));
            if (!checked.isOk()) {
                return Result.err(checked.error());
            }
            validated.put(field, checked.value());
        }
        return Result.ok(new ContactRecord(validated));
    }

    public String getLastName() {
        return values.get(ContactField.LAST_NAME);
    }

    public String getFirstName() {
        return values.get(ContactField.FIRST_NAME);
    }

    public String getPatronymic() {
        return values.get(ContactField.PATRONYMIC);
    }

    public String getOrganization() {
        return values.get(ContactField.ORGANIZATION);
    }

    public String getWorkPhone() {
        return values.get(ContactField.WORK_PHONE);
    }

    public String getPersonalPhone() {
        return values.get(ContactField.PERSONAL_PHONE);
    }

    /**
     * @param field any column except {@link ContactField#ID}
     * @return the stored value of that column
     */
    public String get(final ContactField field) {
        if (field == ContactField.ID) {
            throw new IllegalArgumentException("ID is positional; read it from ContactEntry");
        }
        return values.get(field);
    }

    /**
     * Merges the overrides present in {@code update} into this record.
     *
     * <p>Every override is validated before any field changes, so a rejected update leaves
     * the record exactly as it was.
     *
     * @param update overrides to apply (must not be null)
     * @return this record on success, or the first field error
     */
    public Result<ContactRecord, DirectoryError> apply(final ContactUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        final Map<ContactField, String> validated = new EnumMap<>(ContactField.class);
        for (final ContactField field : ContactField.textFields()) {
            if (update.get(field).isEmpty()) {
                continue;
            }
            final Result<String, DirectoryError> checked =
                    Validation.validateField(field, update.get(field).get());
            if (!checked.isOk()) {
                return Result.err(checked.error());
            }
            validated.put(field, checked.value());
        }
        values.putAll(validated);
        return Result.ok(this);
    }

    /**
     * Creates a detached copy with the same field values.
     *
     * @return a new record equal to this one
     */
    public ContactRecord copy() {
        return new ContactRecord(new EnumMap<>(values));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContactRecord)) {
            return false;
        }
        return values.equals(((ContactRecord) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ContactRecord" + values;
    }
}
