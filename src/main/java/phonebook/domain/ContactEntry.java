package phonebook.domain;

import java.util.Objects;

/**
 * A record as seen at a particular position in the directory.
 *
 * <p>Entries are snapshots: the id is valid until the next mutation of the directory.
 *
 * @param id     one-based position of the record
 * @param record the record itself
 */
public record ContactEntry(int id, ContactRecord record) {

    public ContactEntry {
        if (id < 1) {
            throw new IllegalArgumentException("id must be positive, was " + id);
        }
        Objects.requireNonNull(record, "record must not be null");
    }

    /**
     * @param field any column, {@link ContactField#ID} included
     * @return the value shown or written for that column
     */
    public String get(final ContactField field) {
        if (field == ContactField.ID) {
            return Integer.toString(id);
        }
        return record.get(field);
    }
}
