package phonebook.persistence;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import phonebook.config.PhonebookProperties;
import phonebook.domain.ContactDraft;
import phonebook.domain.ContactEntry;
import phonebook.domain.ContactRecord;
import phonebook.domain.ContactUpdate;
import phonebook.domain.Result;
import phonebook.domain.error.DirectoryError;
import phonebook.domain.error.IndexOutOfRangeError;

/**
 * {@link RecordStore} kept in memory and mirrored to one CSV file.
 *
 * <p>Design:
 * <ul>
 *   <li>Single-threaded: one caller issues one operation at a time, so no locking.</li>
 *   <li>Each mutation is followed by a full rewrite through {@link PhonebookFile}.</li>
 *   <li>If the rewrite fails the mutation is undone, keeping memory and file in step.</li>
 *   <li>Entries handed out hold copies, so callers cannot change stored records without
 *       going through {@link #edit(int, ContactUpdate)}.</li>
 * </ul>
 */
@Component
public class CsvRecordStore implements RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(CsvRecordStore.class);

    private final PhonebookFile file;
    private final Path path;
    private final List<ContactRecord> records = new ArrayList<>();

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "PhonebookFile is a stateless Spring-managed collaborator")
    @Autowired
    public CsvRecordStore(final PhonebookFile file, final PhonebookProperties properties) {
        this(file, Path.of(properties.file()));
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "PhonebookFile is a stateless collaborator")
    public CsvRecordStore(final PhonebookFile file, final Path path) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void load() {
        final List<ContactRecord> loaded = file.read(path);
        records.clear();
        records.addAll(loaded);
        LOG.info("Loaded {} contacts from {}", loaded.size(), path);
    }

    @Override
    public void save() {
        file.write(path, records);
    }

    @Override
    public List<ContactEntry> records() {
        final List<ContactEntry> entries = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            entries.add(entryAt(i));
        }
        return List.copyOf(entries);
    }

    @Override
    public int size() {
        return records.size();
    }

    @Override
    public Optional<ContactEntry> find(final int oneBasedIndex) {
        if (!inRange(oneBasedIndex)) {
            return Optional.empty();
        }
        return Optional.of(entryAt(oneBasedIndex - 1));
    }

    @Override
    public Result<ContactEntry, DirectoryError> add(final ContactDraft draft) {
        final Result<ContactRecord, DirectoryError> created = ContactRecord.create(draft);
        if (!created.isOk()) {
            return Result.err(created.error());
        }
        records.add(created.value());
        try {
            save();
        } catch (PhonebookStorageException e) {
            records.remove(records.size() - 1);
            LOG.error("Adding contact failed, rolled back in-memory change", e);
            throw e;
        }
        final ContactEntry entry = entryAt(records.size() - 1);
        LOG.info("Added contact #{}", entry.id());
        return Result.ok(entry);
    }

    @Override
    public Result<ContactEntry, DirectoryError> edit(final int oneBasedIndex, final ContactUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        if (!inRange(oneBasedIndex)) {
            return Result.err(new IndexOutOfRangeError(oneBasedIndex, records.size()));
        }
        final int position = oneBasedIndex - 1;
        final ContactRecord target = records.get(position);
        final ContactRecord before = target.copy();

        final Result<ContactRecord, DirectoryError> applied = target.apply(update);
        if (!applied.isOk()) {
            return Result.err(applied.error());
        }
        try {
            save();
        } catch (PhonebookStorageException e) {
            records.set(position, before);
            LOG.error("Editing contact #{} failed, rolled back in-memory change", oneBasedIndex, e);
            throw e;
        }
        LOG.info("Edited contact #{}", oneBasedIndex);
        return Result.ok(entryAt(position));
    }

    private boolean inRange(final int oneBasedIndex) {
        return oneBasedIndex >= 1 && oneBasedIndex <= records.size();
    }

    private ContactEntry entryAt(final int position) {
        return new ContactEntry(position + 1, records.get(position).copy());
    }
}
