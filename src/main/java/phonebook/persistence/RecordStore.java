package phonebook.persistence;

import java.util.List;
import java.util.Optional;
import phonebook.domain.ContactDraft;
import phonebook.domain.ContactEntry;
import phonebook.domain.ContactUpdate;
import phonebook.domain.Result;
import phonebook.domain.error.DirectoryError;

/**
 * Owner of the directory's ordered collection and its persistence.
 *
 * <p>Ids are positions: the record at index {@code i} of {@link #records()} has id
 * {@code i + 1}. Every mutation rewrites the whole backing store.
 */
public interface RecordStore {

    /**
     * Replaces the in-memory collection with the persisted one.
     *
     * @throws PhonebookStorageException if the backing store cannot be read or parsed
     */
    void load();

    /**
     * Persists the full collection, assigning ids from positions.
     *
     * @throws PhonebookPersistenceException if the backing store cannot be written
     */
    void save();

    /**
     * @return snapshot of every record with its current id; later mutations do not show through
     */
    List<ContactEntry> records();

    int size();

    /**
     * @param oneBasedIndex record number
     * @return the entry at that position, empty when out of range
     */
    Optional<ContactEntry> find(int oneBasedIndex);

    /**
     * Validates the draft, appends it at the tail and saves.
     *
     * @return the stored entry (its id is the previous size + 1), or the first field error
     * @throws PhonebookPersistenceException if saving fails; the record is not kept in that case
     */
    Result<ContactEntry, DirectoryError> add(ContactDraft draft);

    /**
     * Merges the present overrides into the record at {@code oneBasedIndex} and saves.
     *
     * @return the edited entry (same id as before), an
     *     {@link phonebook.domain.error.IndexOutOfRangeError} or the first field error;
     *     nothing is changed or saved on error
     * @throws PhonebookPersistenceException if saving fails; the edit is undone in that case
     */
    Result<ContactEntry, DirectoryError> edit(int oneBasedIndex, ContactUpdate update);
}
